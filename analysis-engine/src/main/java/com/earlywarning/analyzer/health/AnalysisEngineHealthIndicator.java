package com.earlywarning.analyzer.health;

import com.earlywarning.analyzer.model.UrlThreatClassifier;
import com.earlywarning.analyzer.threatintel.ThreatIntelService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reports which classifier and reputation providers are active.
 *
 * <p>
 * Always UP: the engine answers every request from static features even
 * with no trained model and no reputation provider configured.
 * </p>
 *
 * @author Naveed Gung
 */
@Component("analysisEngine")
public class AnalysisEngineHealthIndicator implements HealthIndicator {

    private final UrlThreatClassifier classifier;
    private final ThreatIntelService threatIntelService;

    public AnalysisEngineHealthIndicator(UrlThreatClassifier classifier, ThreatIntelService threatIntelService) {
        this.classifier = classifier;
        this.threatIntelService = threatIntelService;
    }

    @Override
    public Health health() {
        Health.Builder builder = Health.up()
                .withDetail("classifier", classifier.activeModelName())
                .withDetail("modelLoaded", classifier.isModelLoaded());
        for (Map.Entry<String, Boolean> provider : threatIntelService.providerStatus().entrySet()) {
            builder.withDetail("threatIntel." + provider.getKey(), provider.getValue() ? "enabled" : "disabled");
        }
        return builder.build();
    }
}
