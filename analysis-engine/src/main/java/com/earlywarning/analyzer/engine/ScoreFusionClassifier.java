package com.earlywarning.analyzer.engine;

import com.earlywarning.analyzer.config.ScoringConfig;
import com.earlywarning.analyzer.indicator.IndicatorGenerator;
import com.earlywarning.analyzer.indicator.IndicatorRule;
import com.earlywarning.analyzer.threatintel.ThreatIntelSignal;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Combines model probability, heuristic indicators and reputation signal into
 * a final score, tier and confidence.
 *
 * <p>
 * Score: {@code modelWeight * modelProb + indicatorWeight * density}, where
 * density is the share of indicator rules that fired. A confirmed vendor hit
 * lifts the score to at least {@code intelOverrideFloor}, which is never below
 * the High Risk threshold. The score is rounded to two decimals before it is
 * tiered, so the reported score and tier always agree.
 * </p>
 *
 * <p>
 * Confidence:
 * </p>
 * <ul>
 * <li>HIGH when a vendor confirmed the URL, or a trained model and the
 * indicators point the same way</li>
 * <li>LOW with no trained model, no vendor hit and a single indicator as the only evidence</li>
 * <li>MEDIUM otherwise</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class ScoreFusionClassifier {

    private final ScoringConfig config;

    public ScoreFusionClassifier(ScoringConfig config) {
        this.config = config;
    }

    /**
     * Fuse the signals of one analysis.
     *
     * @param modelProb   classifier probability in [0.0, 1.0]
     * @param indicators  heuristic indicators, possibly only the placeholder
     * @param intel       reputation signal, possibly unknown
     * @param modelLoaded whether {@code modelProb} came from a trained artifact
     * @return the fused result
     */
    public FusionResult classify(double modelProb, List<String> indicators, ThreatIntelSignal intel,
            boolean modelLoaded) {
        int triggered = IndicatorGenerator.triggeredCount(indicators);
        double density = (double) Math.min(triggered, IndicatorRule.count()) / IndicatorRule.count();

        double score = clamp(config.getModelWeight() * clamp(modelProb) + config.getIndicatorWeight() * density);
        if (intel.hasPositiveHit()) {
            score = Math.max(score, config.getIntelOverrideFloor());
        }
        score = Math.round(score * 100.0) / 100.0;

        ThreatLevel level = ThreatLevel.of(score, config.getSuspiciousThreshold(), config.getHighRiskThreshold());
        Confidence confidence = confidence(modelProb, triggered, intel, modelLoaded);
        return new FusionResult(score, level, confidence);
    }

    private Confidence confidence(double modelProb, int triggered, ThreatIntelSignal intel, boolean modelLoaded) {
        if (intel.hasPositiveHit()) {
            return Confidence.HIGH;
        }
        if (!modelLoaded) {
            return triggered == 1 ? Confidence.LOW : Confidence.MEDIUM;
        }
        boolean modelSaysThreat = modelProb >= config.getSuspiciousThreshold();
        boolean indicatorsSayThreat = triggered >= config.getAgreementMinIndicators();
        return modelSaysThreat == indicatorsSayThreat ? Confidence.HIGH : Confidence.MEDIUM;
    }

    private static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }
}
