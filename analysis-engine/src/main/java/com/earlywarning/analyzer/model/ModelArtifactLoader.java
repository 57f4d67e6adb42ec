package com.earlywarning.analyzer.model;

import com.earlywarning.analyzer.config.ModelConfig;
import com.earlywarning.analyzer.feature.FeatureSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads and validates the classifier artifact named by {@code analyzer.model.path}.
 *
 * <p>
 * Any problem (no path, missing file, bad JSON, unknown model type, feature
 * schema mismatch) yields {@link Optional#empty()} and one log line; the
 * caller then falls back to the heuristic model.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class ModelArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactLoader.class);

    private final ModelConfig config;
    private final ObjectMapper objectMapper;

    public ModelArtifactLoader(ModelConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    public Optional<ThreatModel> load() {
        if (!config.hasPath()) {
            log.warn("No classifier artifact configured (analyzer.model.path); using heuristic fallback");
            return Optional.empty();
        }

        Path path = Path.of(config.getPath());
        if (!Files.isRegularFile(path)) {
            log.warn("Classifier artifact {} not found; using heuristic fallback", path);
            return Optional.empty();
        }

        try {
            ModelArtifact artifact = objectMapper.readValue(path.toFile(), ModelArtifact.class);
            ThreatModel model = build(artifact);
            log.info("Loaded classifier artifact {} as {}", path, model.name());
            return Optional.of(model);
        } catch (IOException e) {
            log.error("Failed to read classifier artifact {}: {}", path, e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.error("Rejected classifier artifact {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Turn a parsed artifact into a model.
     *
     * @throws IllegalArgumentException if the artifact does not match a known schema and type
     */
    static ThreatModel build(ModelArtifact artifact) {
        FeatureSchema schema = FeatureSchema.fromVersion(artifact.schemaVersion());
        List<String> declared = artifact.features() == null ? List.of() : artifact.features();
        if (!declared.equals(schema.featureNames())) {
            throw new IllegalArgumentException(String.format(
                    "Feature order %s does not match schema v%d %s",
                    declared, schema.getVersion(), schema.featureNames()));
        }

        String type = artifact.type() == null ? "" : artifact.type();
        return switch (type) {
            case ModelArtifact.TYPE_LOGISTIC -> new LogisticThreatModel(
                    schema, artifact.intercept(), toArray(artifact.coefficients()));
            case ModelArtifact.TYPE_FOREST -> new ForestThreatModel(schema, artifact.trees());
            default -> throw new IllegalArgumentException("Unknown model type: '" + type + "'");
        };
    }

    private static double[] toArray(List<Double> values) {
        if (values == null) {
            return new double[0];
        }
        return values.stream().mapToDouble(v -> v == null ? Double.NaN : v).toArray();
    }
}
