package com.earlywarning.analyzer.engine;

import com.earlywarning.analyzer.feature.UrlFeatureExtractor;
import com.earlywarning.analyzer.feature.UrlFeatures;
import com.earlywarning.analyzer.indicator.IndicatorGenerator;
import com.earlywarning.analyzer.model.UrlThreatClassifier;
import com.earlywarning.analyzer.threatintel.ThreatIntelService;
import com.earlywarning.analyzer.threatintel.ThreatIntelSignal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Central analysis orchestrator.
 *
 * <p>
 * Extracts features from the URL, then runs the reputation lookup alongside
 * the indicator rules and the classifier, fuses the three signals and
 * composes the verdict. Stateless across calls apart from the shared,
 * read-only classifier; identical URLs are simply recomputed.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class UrlThreatAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(UrlThreatAnalyzer.class);

    private final UrlFeatureExtractor featureExtractor;
    private final IndicatorGenerator indicatorGenerator;
    private final UrlThreatClassifier classifier;
    private final ThreatIntelService threatIntelService;
    private final ScoreFusionClassifier fusionClassifier;
    private final ResultComposer resultComposer;
    private final MeterRegistry meterRegistry;

    private final Counter analysesRequested;
    private final Map<ThreatLevel, Counter> verdictsByLevel = new EnumMap<>(ThreatLevel.class);
    private final Timer analysisLatency;

    public UrlThreatAnalyzer(
            UrlFeatureExtractor featureExtractor,
            IndicatorGenerator indicatorGenerator,
            UrlThreatClassifier classifier,
            ThreatIntelService threatIntelService,
            ScoreFusionClassifier fusionClassifier,
            ResultComposer resultComposer,
            MeterRegistry meterRegistry) {
        this.featureExtractor = featureExtractor;
        this.indicatorGenerator = indicatorGenerator;
        this.classifier = classifier;
        this.threatIntelService = threatIntelService;
        this.fusionClassifier = fusionClassifier;
        this.resultComposer = resultComposer;
        this.meterRegistry = meterRegistry;

        this.analysesRequested = Counter.builder("analyzer.analysis.requests")
                .description("Total URLs submitted for analysis")
                .register(meterRegistry);
        for (ThreatLevel level : ThreatLevel.values()) {
            verdictsByLevel.put(level, Counter.builder("analyzer.analysis.verdicts")
                    .description("Verdicts issued, by threat level")
                    .tag("level", level.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        this.analysisLatency = Timer.builder("analyzer.analysis.latency")
                .description("Time from submission to composed verdict")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    /**
     * Analyse a URL, blocking until the verdict is ready.
     *
     * <p>
     * Must not be called from a reactive event-loop thread; use
     * {@link #analyzeAsync(String)} there.
     * </p>
     *
     * @param url the URL to analyse; malformed input still yields a verdict
     * @return the verdict, never null
     */
    public ThreatVerdict analyze(String url) {
        return analyzeAsync(url).block();
    }

    /**
     * Analyse a URL without blocking. The returned {@link Mono} always emits
     * exactly one verdict; reputation failures degrade to an unknown signal.
     */
    public Mono<ThreatVerdict> analyzeAsync(String url) {
        return Mono.defer(() -> {
            analysesRequested.increment();
            Timer.Sample sample = Timer.start(meterRegistry);

            String target = url == null ? "" : url;
            UrlFeatures features = featureExtractor.extract(target);

            Mono<ThreatIntelSignal> intel = target.isBlank()
                    ? Mono.just(ThreatIntelSignal.unknown())
                    : threatIntelService.lookup(target);
            Mono<LocalAssessment> local = Mono.fromCallable(() -> new LocalAssessment(
                    indicatorGenerator.indicatorsFor(features),
                    classifier.predict(features)));

            return Mono.zip(intel, local)
                    .map(signals -> compose(target, features, signals.getT2(), signals.getT1()))
                    .doOnNext(verdict -> {
                        sample.stop(analysisLatency);
                        verdictsByLevel.get(verdict.threatLevel()).increment();
                    });
        });
    }

    private ThreatVerdict compose(String url, UrlFeatures features, LocalAssessment local,
            ThreatIntelSignal intel) {
        FusionResult fusion = fusionClassifier.classify(
                local.modelProbability(), local.indicators(), intel, classifier.isModelLoaded());
        ThreatVerdict verdict = resultComposer.compose(url, features, local.indicators(), fusion, intel);

        log.debug("Analysed {}: score={} level={} confidence={} model={} intel={}",
                url, verdict.threatScore(), verdict.threatLevel(), verdict.confidence(),
                classifier.activeModelName(), intel);
        if (verdict.threatLevel() == ThreatLevel.HIGH_RISK) {
            log.info("HIGH RISK URL: {} score={} indicators={}",
                    url, verdict.threatScore(), verdict.indicators());
        }
        return verdict;
    }

    /** Signals computed in-process from the features alone. */
    private record LocalAssessment(List<String> indicators, double modelProbability) {
    }
}
