package com.earlywarning.analyzer.model;

import com.earlywarning.analyzer.feature.UrlFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide classifier handle.
 *
 * <p>
 * The artifact is loaded exactly once, when the bean is created; after that
 * the handle is read-only and shared by every request without locking. With
 * no usable artifact the heuristic model takes its place.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class UrlThreatClassifier {

    private static final Logger log = LoggerFactory.getLogger(UrlThreatClassifier.class);

    private final ThreatModel model;
    private final boolean modelLoaded;

    @Autowired
    public UrlThreatClassifier(ModelArtifactLoader loader) {
        this(loader.load().orElse(null));
    }

    private UrlThreatClassifier(ThreatModel loadedModel) {
        this.modelLoaded = loadedModel != null;
        this.model = modelLoaded ? loadedModel : new HeuristicThreatModel();
        log.info("URL threat classifier ready: model={} trained={}", model.name(), modelLoaded);
    }

    /** Classifier backed by the heuristic model only. */
    public static UrlThreatClassifier heuristicOnly() {
        return new UrlThreatClassifier((ThreatModel) null);
    }

    /** Classifier backed by an already-built model. */
    public static UrlThreatClassifier of(ThreatModel model) {
        return new UrlThreatClassifier(model);
    }

    /**
     * Raw threat probability for the features.
     *
     * @return probability clamped to [0.0, 1.0]; a non-finite model output maps to 0.0
     */
    public double predict(UrlFeatures features) {
        double p = model.predict(features);
        if (!Double.isFinite(p)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, p));
    }

    public boolean isModelLoaded() {
        return modelLoaded;
    }

    public String activeModelName() {
        return model.name();
    }
}
