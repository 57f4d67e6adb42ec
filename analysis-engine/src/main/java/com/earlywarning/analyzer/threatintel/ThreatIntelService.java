package com.earlywarning.analyzer.threatintel;

import com.earlywarning.analyzer.config.ThreatIntelConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facade that aggregates results from all enabled reputation providers.
 *
 * <p>
 * Queries providers in parallel via reactive streams. The whole lookup is
 * bounded by {@code analyzer.threat-intel.lookup-budget-ms}: providers that
 * have not answered when the budget runs out stay unknown, and the ones that
 * did answer are kept. The returned {@link Mono} never signals an error.
 * With no provider enabled this is a no-op that returns
 * {@link ThreatIntelSignal#unknown()} immediately.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class ThreatIntelService {

    private static final Logger log = LoggerFactory.getLogger(ThreatIntelService.class);

    private final List<UrlReputationProvider> providers;
    private final List<UrlReputationProvider> enabledProviders;
    private final Duration lookupBudget;
    private final Counter degradedLookups;

    public ThreatIntelService(List<UrlReputationProvider> providers, ThreatIntelConfig config,
            MeterRegistry meterRegistry) {
        this.providers = List.copyOf(providers);
        this.enabledProviders = providers.stream().filter(UrlReputationProvider::isEnabled).toList();
        this.lookupBudget = Duration.ofMillis(config.getLookupBudgetMs());
        this.degradedLookups = Counter.builder("analyzer.threatintel.lookups.degraded")
                .description("Reputation lookups that timed out or failed and were treated as unknown")
                .register(meterRegistry);

        log.info("Threat intel initialized with {} of {} providers enabled: {}",
                enabledProviders.size(), providers.size(),
                enabledProviders.stream().map(UrlReputationProvider::name).toList());
    }

    /**
     * Look up a URL across all enabled providers in parallel.
     *
     * @param url the URL to check
     * @return merged signal; unknown on timeout, failure or when nothing is enabled
     */
    public Mono<ThreatIntelSignal> lookup(String url) {
        if (enabledProviders.isEmpty()) {
            return Mono.just(ThreatIntelSignal.unknown());
        }

        log.debug("Starting parallel reputation lookup for {}", url);

        return Flux.merge(enabledProviders.stream().map(p -> p.lookupUrl(url)).toList())
                .take(lookupBudget)
                .collectList()
                .map(results -> {
                    if (results.size() < enabledProviders.size()) {
                        degradedLookups.increment();
                        log.warn("Reputation lookup for {} exceeded {} ms; {} of {} providers answered",
                                url, lookupBudget.toMillis(), results.size(), enabledProviders.size());
                    }
                    return ThreatIntelSignal.from(results);
                })
                .onErrorResume(e -> {
                    degradedLookups.increment();
                    log.warn("Reputation lookup failed for {}: {}", url, e.getMessage());
                    return Mono.just(ThreatIntelSignal.unknown());
                });
    }

    /** Provider name to enabled flag, in registration order. */
    public Map<String, Boolean> providerStatus() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        for (UrlReputationProvider provider : providers) {
            status.put(provider.name(), provider.isEnabled());
        }
        return status;
    }
}
