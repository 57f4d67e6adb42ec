package com.earlywarning.analyzer.metrics;

import com.earlywarning.analyzer.history.ScanRecordStore;
import com.earlywarning.analyzer.model.UrlThreatClassifier;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Exposes analyzer-wide gauges via Micrometer/Prometheus.
 *
 * <ul>
 * <li>{@code analyzer.uptime_seconds} - engine uptime</li>
 * <li>{@code analyzer.classifier.model_loaded} - 1 when a trained artifact is active</li>
 * <li>{@code analyzer.history.records} - scan records currently retained</li>
 * </ul>
 *
 * <p>
 * Per-request counters and timers are registered by the components that own them.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class AnalyzerMetrics {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerMetrics.class);

    private final UrlThreatClassifier classifier;
    private final ScanRecordStore scanRecordStore;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public AnalyzerMetrics(UrlThreatClassifier classifier, ScanRecordStore scanRecordStore,
            MeterRegistry meterRegistry) {
        this.classifier = classifier;
        this.scanRecordStore = scanRecordStore;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("analyzer.uptime_seconds", this, m -> (System.currentTimeMillis() - m.startTime) / 1000.0)
                .description("Analysis engine uptime in seconds")
                .register(meterRegistry);

        Gauge.builder("analyzer.classifier.model_loaded", classifier, c -> c.isModelLoaded() ? 1.0 : 0.0)
                .description("1 when a trained model artifact is in use, 0 for the heuristic fallback")
                .register(meterRegistry);

        Gauge.builder("analyzer.history.records", scanRecordStore, ScanRecordStore::size)
                .description("Scan records currently retained in history")
                .register(meterRegistry);

        log.info("Analyzer metrics registered");
    }
}
