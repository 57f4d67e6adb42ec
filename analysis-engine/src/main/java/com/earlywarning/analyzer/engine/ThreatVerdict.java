package com.earlywarning.analyzer.engine;

import com.earlywarning.analyzer.feature.UrlFeatures;
import com.earlywarning.analyzer.threatintel.ThreatIntelSignal;

import java.util.List;

/**
 * Final verdict for one analysed URL.
 *
 * @param url            the URL exactly as submitted
 * @param threatScore    fused score in [0.0, 1.0], two decimals
 * @param threatLevel    tier of the score
 * @param confidence     how well the signals corroborate each other
 * @param malicious      score above one half
 * @param indicators     human-readable reasons, never empty
 * @param recommendation advice for the person who submitted the URL
 * @param actionRequired the user should act (Suspicious or High Risk)
 * @param safeToVisit    only true for Safe
 * @param features       the extracted features, echoed for transparency
 * @param intel          reputation signal used for fusion
 *
 * @author Naveed Gung
 */
public record ThreatVerdict(
        String url,
        double threatScore,
        ThreatLevel threatLevel,
        Confidence confidence,
        boolean malicious,
        List<String> indicators,
        String recommendation,
        boolean actionRequired,
        boolean safeToVisit,
        UrlFeatures features,
        ThreatIntelSignal intel) {

    public ThreatVerdict {
        if (indicators == null || indicators.isEmpty()) {
            throw new IllegalArgumentException("A verdict needs at least one indicator");
        }
        indicators = List.copyOf(indicators);
    }
}
