package com.earlywarning.analyzer.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScoringConfigTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void shouldAcceptDefaults() {
        assertTrue(validator.validate(new ScoringConfig()).isEmpty());
    }

    @Test
    void shouldRejectWeightsNotSummingToOne() {
        ScoringConfig config = new ScoringConfig();
        config.setModelWeight(0.8);

        assertViolation(config, "model-weight and indicator-weight must sum to 1.0");
    }

    @Test
    void shouldRejectInvertedThresholds() {
        ScoringConfig config = new ScoringConfig();
        config.setSuspiciousThreshold(0.8);

        assertViolation(config, "suspicious-threshold must be below high-risk-threshold");
    }

    @Test
    void shouldRejectOverrideFloorBelowHighRisk() {
        ScoringConfig config = new ScoringConfig();
        config.setIntelOverrideFloor(0.6);

        assertViolation(config, "intel-override-floor must not be below high-risk-threshold");
    }

    @Test
    void shouldRejectThreatIntelBudgetBelowMinimum() {
        ThreatIntelConfig config = new ThreatIntelConfig();
        config.setLookupBudgetMs(10);

        assertFalse(validator.validate(config).isEmpty());
    }

    private static void assertViolation(Object config, String message) {
        Set<? extends ConstraintViolation<?>> violations = validator.validate(config);
        assertTrue(violations.stream().anyMatch(v -> message.equals(v.getMessage())), violations.toString());
    }
}
