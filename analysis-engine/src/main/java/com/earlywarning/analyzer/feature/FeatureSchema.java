package com.earlywarning.analyzer.feature;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Versioned column order of the classifier input vector.
 *
 * <p>
 * A model artifact declares the schema version and feature names it was
 * trained with; the loader rejects any artifact whose list differs from the
 * one here. The simulated domain age is deliberately not a model column.
 * </p>
 *
 * @author Naveed Gung
 */
public enum FeatureSchema {

    V1(1, List.of(
            column("url_length", f -> f.length()),
            column("dot_count", f -> f.dotCount()),
            column("has_ip", f -> f.hasIpHost() ? 1.0 : 0.0),
            column("has_https", f -> f.usesHttps() ? 1.0 : 0.0),
            column("suspicious_keywords", f -> f.suspiciousKeywordCount()),
            column("tld_risk_score", UrlFeatures::tldRiskScore),
            column("subdomain_count", f -> f.subdomainCount()),
            column("entropy", UrlFeatures::entropy)));

    private final int version;
    private final List<Column> columns;

    FeatureSchema(int version, List<Column> columns) {
        this.version = version;
        this.columns = columns;
    }

    public int getVersion() {
        return version;
    }

    public int size() {
        return columns.size();
    }

    public List<String> featureNames() {
        return columns.stream().map(Column::name).toList();
    }

    /** Project the features onto this schema's column order. */
    public double[] vectorize(UrlFeatures features) {
        double[] vector = new double[columns.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = columns.get(i).extractor().applyAsDouble(features);
        }
        return vector;
    }

    /**
     * Look up a schema by its declared version.
     *
     * @throws IllegalArgumentException if no schema has that version
     */
    public static FeatureSchema fromVersion(int version) {
        for (FeatureSchema schema : values()) {
            if (schema.version == version) {
                return schema;
            }
        }
        throw new IllegalArgumentException("Unknown feature schema version: " + version);
    }

    private static Column column(String name, ToDoubleFunction<UrlFeatures> extractor) {
        return new Column(name, extractor);
    }

    private record Column(String name, ToDoubleFunction<UrlFeatures> extractor) {
    }
}
