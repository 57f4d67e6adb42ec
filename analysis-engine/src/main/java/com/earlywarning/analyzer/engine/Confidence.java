package com.earlywarning.analyzer.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much corroborating evidence backs a threat score. Ordinal, not a
 * probability.
 *
 * @author Naveed Gung
 */
public enum Confidence {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
