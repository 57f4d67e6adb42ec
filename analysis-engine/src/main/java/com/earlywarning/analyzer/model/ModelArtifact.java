package com.earlywarning.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON form of an exported classifier.
 *
 * <pre>
 * {
 *   "schemaVersion": 1,
 *   "type": "forest",
 *   "features": ["url_length", "dot_count", ...],
 *   "trees": [ { "nodes": [ {"feature": 2, "threshold": 0.5, "left": 1, "right": 2},
 *                           {"probability": 0.08}, {"probability": 0.91} ] } ]
 * }
 * </pre>
 *
 * <p>
 * Logistic models carry {@code intercept} and {@code coefficients} instead of
 * {@code trees}. Tree nodes are flattened in pre-order: a split sends
 * {@code x[feature] <= threshold} to {@code left}.
 * </p>
 *
 * @author Naveed Gung
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelArtifact(
        int schemaVersion,
        String type,
        List<String> features,
        double intercept,
        List<Double> coefficients,
        List<Tree> trees) {

    public static final String TYPE_LOGISTIC = "logistic";
    public static final String TYPE_FOREST = "forest";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tree(List<Node> nodes) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Node(
            Integer feature,
            Double threshold,
            Integer left,
            Integer right,
            Double probability) {

        public boolean isLeaf() {
            return feature == null;
        }
    }
}
