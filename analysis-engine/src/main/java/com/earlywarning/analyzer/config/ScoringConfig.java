package com.earlywarning.analyzer.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Score fusion weights and tier thresholds.
 *
 * <p>
 * These are policy values, not derived constants, and can be recalibrated
 * without touching the fusion algorithm. Tier lower bounds are inclusive:
 * a score equal to {@code suspiciousThreshold} is Suspicious.
 * </p>
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "analyzer.scoring")
public class ScoringConfig {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double modelWeight = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double indicatorWeight = 0.3;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double suspiciousThreshold = 0.4;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double highRiskThreshold = 0.7;

    /** Minimum score once any reputation vendor confirms the URL as malicious. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double intelOverrideFloor = 0.85;

    /** Triggered indicators needed before the heuristics count as pointing at a threat. */
    @Min(1)
    private int agreementMinIndicators = 2;

    public double getModelWeight() {
        return modelWeight;
    }

    public void setModelWeight(double modelWeight) {
        this.modelWeight = modelWeight;
    }

    public double getIndicatorWeight() {
        return indicatorWeight;
    }

    public void setIndicatorWeight(double indicatorWeight) {
        this.indicatorWeight = indicatorWeight;
    }

    public double getSuspiciousThreshold() {
        return suspiciousThreshold;
    }

    public void setSuspiciousThreshold(double suspiciousThreshold) {
        this.suspiciousThreshold = suspiciousThreshold;
    }

    public double getHighRiskThreshold() {
        return highRiskThreshold;
    }

    public void setHighRiskThreshold(double highRiskThreshold) {
        this.highRiskThreshold = highRiskThreshold;
    }

    public double getIntelOverrideFloor() {
        return intelOverrideFloor;
    }

    public void setIntelOverrideFloor(double intelOverrideFloor) {
        this.intelOverrideFloor = intelOverrideFloor;
    }

    public int getAgreementMinIndicators() {
        return agreementMinIndicators;
    }

    public void setAgreementMinIndicators(int agreementMinIndicators) {
        this.agreementMinIndicators = agreementMinIndicators;
    }

    @AssertTrue(message = "model-weight and indicator-weight must sum to 1.0")
    public boolean isWeightSumValid() {
        return Math.abs(modelWeight + indicatorWeight - 1.0) < 1e-9;
    }

    @AssertTrue(message = "suspicious-threshold must be below high-risk-threshold")
    public boolean isThresholdOrderValid() {
        return suspiciousThreshold < highRiskThreshold;
    }

    @AssertTrue(message = "intel-override-floor must not be below high-risk-threshold")
    public boolean isOverrideFloorValid() {
        return intelOverrideFloor >= highRiskThreshold;
    }
}
