package com.earlywarning.analyzer.engine;

import com.earlywarning.analyzer.config.ScoringConfig;
import com.earlywarning.analyzer.indicator.IndicatorGenerator;
import com.earlywarning.analyzer.threatintel.ThreatIntelSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ScoreFusionClassifierTest {

    private static final List<String> NONE = List.of(IndicatorGenerator.NO_INDICATORS);
    private static final ThreatIntelSignal CLEAN = new ThreatIntelSignal(false, false, 0);
    private static final ThreatIntelSignal FLAGGED = new ThreatIntelSignal(true, null, 3);

    private ScoreFusionClassifier fusion;

    @BeforeEach
    void setUp() {
        fusion = new ScoreFusionClassifier(new ScoringConfig());
    }

    @Test
    void shouldPartitionScoresIntoTiers() {
        assertEquals(ThreatLevel.SAFE, ThreatLevel.of(0.0, 0.4, 0.7));
        assertEquals(ThreatLevel.SAFE, ThreatLevel.of(0.39, 0.4, 0.7));
        assertEquals(ThreatLevel.SUSPICIOUS, ThreatLevel.of(0.40, 0.4, 0.7));
        assertEquals(ThreatLevel.SUSPICIOUS, ThreatLevel.of(0.69, 0.4, 0.7));
        assertEquals(ThreatLevel.HIGH_RISK, ThreatLevel.of(0.70, 0.4, 0.7));
        assertEquals(ThreatLevel.HIGH_RISK, ThreatLevel.of(1.0, 0.4, 0.7));
    }

    @Test
    void shouldScoreZeroWithoutAnySignal() {
        FusionResult result = fusion.classify(0.0, NONE, ThreatIntelSignal.unknown(), false);

        assertEquals(0.0, result.threatScore());
        assertEquals(ThreatLevel.SAFE, result.threatLevel());
        assertEquals(Confidence.MEDIUM, result.confidence());
    }

    @Test
    void shouldBlendModelProbabilityWithIndicatorDensity() {
        FusionResult result = fusion.classify(0.55, indicators(2), ThreatIntelSignal.unknown(), false);

        assertEquals(0.46, result.threatScore());
        assertEquals(ThreatLevel.SUSPICIOUS, result.threatLevel());
    }

    @Test
    void shouldReachHighRiskOnFullModelProbability() {
        FusionResult result = fusion.classify(1.0, NONE, CLEAN, true);

        assertEquals(0.7, result.threatScore());
        assertEquals(ThreatLevel.HIGH_RISK, result.threatLevel());
    }

    @Test
    void shouldForceHighRiskOnPositiveIntelHit() {
        FusionResult result = fusion.classify(0.0, NONE, FLAGGED, false);

        assertEquals(0.85, result.threatScore());
        assertEquals(ThreatLevel.HIGH_RISK, result.threatLevel());
        assertEquals(Confidence.HIGH, result.confidence());
    }

    @Test
    void shouldKeepHigherScoreThanOverrideFloor() {
        FusionResult result = fusion.classify(1.0, indicators(8), FLAGGED, true);

        assertEquals(1.0, result.threatScore());
    }

    @Test
    void shouldNeverLowerScoreWhenIntelTurnsPositive() {
        for (double p = 0.0; p <= 1.0; p += 0.05) {
            for (int n = 0; n <= 8; n++) {
                double without = fusion.classify(p, indicators(n), CLEAN, true).threatScore();
                double with = fusion.classify(p, indicators(n), FLAGGED, true).threatScore();
                assertTrue(with >= without, "p=" + p + " n=" + n);
            }
        }
    }

    @Test
    void shouldTreatUnknownIntelLikeClean() {
        FusionResult unknown = fusion.classify(0.3, indicators(1), ThreatIntelSignal.unknown(), true);
        FusionResult clean = fusion.classify(0.3, indicators(1), CLEAN, true);

        assertEquals(clean, unknown);
    }

    @Test
    void shouldGiveHighConfidenceWhenModelAndIndicatorsAgree() {
        assertEquals(Confidence.HIGH, fusion.classify(0.9, indicators(3), CLEAN, true).confidence());
        assertEquals(Confidence.HIGH, fusion.classify(0.1, NONE, CLEAN, true).confidence());
    }

    @Test
    void shouldGiveMediumConfidenceWhenModelAndIndicatorsDisagree() {
        assertEquals(Confidence.MEDIUM, fusion.classify(0.9, NONE, CLEAN, true).confidence());
        assertEquals(Confidence.MEDIUM, fusion.classify(0.1, indicators(4), CLEAN, true).confidence());
    }

    @Test
    void shouldCapConfidenceWithoutTrainedModel() {
        assertEquals(Confidence.LOW, fusion.classify(0.2, indicators(1), CLEAN, false).confidence());
        assertEquals(Confidence.MEDIUM, fusion.classify(0.6, indicators(5), CLEAN, false).confidence());
    }

    @Test
    void shouldGiveMediumConfidenceWhenNothingFiresWithoutTrainedModel() {
        assertEquals(Confidence.MEDIUM, fusion.classify(0.0, NONE, ThreatIntelSignal.unknown(), false).confidence());
        assertEquals(Confidence.MEDIUM, fusion.classify(0.0, NONE, CLEAN, false).confidence());
    }

    @Test
    void shouldTreatNonFiniteProbabilityAsZero() {
        FusionResult result = fusion.classify(Double.NaN, NONE, CLEAN, true);

        assertEquals(0.0, result.threatScore());
        assertEquals(ThreatLevel.SAFE, result.threatLevel());
    }

    @Test
    void shouldHonourConfiguredThresholds() {
        ScoringConfig config = new ScoringConfig();
        config.setSuspiciousThreshold(0.2);
        config.setHighRiskThreshold(0.45);
        ScoreFusionClassifier strict = new ScoreFusionClassifier(config);

        assertEquals(ThreatLevel.HIGH_RISK, strict.classify(0.55, indicators(2), CLEAN, false).threatLevel());
    }

    private static List<String> indicators(int count) {
        if (count == 0) {
            return NONE;
        }
        return IntStream.range(0, count).mapToObj(i -> "indicator " + i).toList();
    }
}
