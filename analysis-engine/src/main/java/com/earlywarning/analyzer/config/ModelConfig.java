package com.earlywarning.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of the pre-trained classifier artifact.
 *
 * <p>
 * The path is optional. When it is blank or the file is missing the engine
 * runs on the heuristic fallback model; that is a supported mode, not an
 * error.
 * </p>
 *
 * @author Naveed Gung
 */
@ConfigurationProperties(prefix = "analyzer.model")
public class ModelConfig {

    private String path = "";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public boolean hasPath() {
        return path != null && !path.isBlank();
    }
}
