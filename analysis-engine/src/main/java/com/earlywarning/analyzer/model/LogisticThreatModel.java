package com.earlywarning.analyzer.model;

import com.earlywarning.analyzer.feature.FeatureSchema;
import com.earlywarning.analyzer.feature.UrlFeatures;

/**
 * Logistic regression over the feature vector.
 *
 * @author Naveed Gung
 */
public final class LogisticThreatModel implements ThreatModel {

    private final FeatureSchema schema;
    private final double intercept;
    private final double[] coefficients;

    public LogisticThreatModel(FeatureSchema schema, double intercept, double[] coefficients) {
        if (coefficients.length != schema.size()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d coefficients for schema %s, got %d",
                    schema.size(), schema, coefficients.length));
        }
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("Coefficients must be finite");
            }
        }
        this.schema = schema;
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
    }

    @Override
    public double predict(UrlFeatures features) {
        double[] x = schema.vectorize(features);
        double z = intercept;
        for (int i = 0; i < x.length; i++) {
            z += coefficients[i] * x[i];
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    @Override
    public String name() {
        return "logistic-v" + schema.getVersion();
    }
}
