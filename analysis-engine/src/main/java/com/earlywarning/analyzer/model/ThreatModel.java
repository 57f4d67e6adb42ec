package com.earlywarning.analyzer.model;

import com.earlywarning.analyzer.feature.UrlFeatures;

/**
 * A probabilistic URL threat estimator.
 *
 * <p>
 * Implementations are immutable once constructed and safe for unlimited
 * concurrent callers.
 * </p>
 *
 * @author Naveed Gung
 */
public interface ThreatModel {

    /**
     * Estimate the probability that the URL is malicious.
     *
     * @param features extracted URL features
     * @return probability in [0.0, 1.0]
     */
    double predict(UrlFeatures features);

    /** Short identifier for logs and health output. */
    String name();
}
