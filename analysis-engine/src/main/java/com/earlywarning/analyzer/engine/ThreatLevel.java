package com.earlywarning.analyzer.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete risk tier derived from the threat score.
 *
 * @author Naveed Gung
 */
public enum ThreatLevel {

    SAFE("Safe"),
    SUSPICIOUS("Suspicious"),
    HIGH_RISK("High Risk");

    private final String label;

    ThreatLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Map a score to its tier. Lower bounds are inclusive, so the tiers
     * partition [0, 1] with no gaps: {@code [0, suspicious)},
     * {@code [suspicious, highRisk)}, {@code [highRisk, 1]}.
     */
    public static ThreatLevel of(double score, double suspiciousThreshold, double highRiskThreshold) {
        if (score >= highRiskThreshold) {
            return HIGH_RISK;
        }
        if (score >= suspiciousThreshold) {
            return SUSPICIOUS;
        }
        return SAFE;
    }
}
