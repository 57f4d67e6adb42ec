package com.earlywarning.analyzer.engine;

import com.earlywarning.analyzer.feature.UrlFeatures;
import com.earlywarning.analyzer.indicator.IndicatorGenerator;
import com.earlywarning.analyzer.threatintel.ThreatIntelSignal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the {@link ThreatVerdict}. Pure; no I/O.
 *
 * @author Naveed Gung
 */
@Component
public class ResultComposer {

    static final String SAFE_RECOMMENDATION =
            "This URL appears to be safe. Exercise normal caution.";
    static final String SUSPICIOUS_RECOMMENDATION =
            "This URL shows some suspicious characteristics. Proceed with caution and avoid entering credentials.";
    static final String HIGH_RISK_RECOMMENDATION =
            "This URL shows multiple high-risk indicators. Do not visit this URL and report it to your security team.";

    static final double MALICIOUS_SCORE = 0.5;

    public ThreatVerdict compose(String url, UrlFeatures features, List<String> indicators,
            FusionResult fusion, ThreatIntelSignal intel) {
        ThreatLevel level = fusion.threatLevel();
        return new ThreatVerdict(
                url,
                fusion.threatScore(),
                level,
                fusion.confidence(),
                fusion.threatScore() > MALICIOUS_SCORE,
                withIntelIndicators(indicators, intel),
                recommendationFor(level),
                level != ThreatLevel.SAFE,
                level == ThreatLevel.SAFE,
                features,
                intel);
    }

    static String recommendationFor(ThreatLevel level) {
        return switch (level) {
            case SAFE -> SAFE_RECOMMENDATION;
            case SUSPICIOUS -> SUSPICIOUS_RECOMMENDATION;
            case HIGH_RISK -> HIGH_RISK_RECOMMENDATION;
        };
    }

    /** Vendor hits go after the heuristic indicators and replace the "none" placeholder. */
    static List<String> withIntelIndicators(List<String> indicators, ThreatIntelSignal intel) {
        List<String> fromIntel = new ArrayList<>();
        if (Boolean.TRUE.equals(intel.flaggedBySafeBrowsing())) {
            fromIntel.add("Flagged by Google Safe Browsing");
        }
        if (Boolean.TRUE.equals(intel.flaggedByVirusTotal())) {
            fromIntel.add("Flagged by VirusTotal");
        }
        if (!fromIntel.isEmpty() && intel.vendorHitCount() > 0) {
            fromIntel.add("Vendor detections: " + intel.vendorHitCount());
        }
        if (fromIntel.isEmpty()) {
            return indicators;
        }

        List<String> merged = new ArrayList<>();
        for (String indicator : indicators) {
            if (!IndicatorGenerator.NO_INDICATORS.equals(indicator)) {
                merged.add(indicator);
            }
        }
        merged.addAll(fromIntel);
        return merged;
    }
}
