package com.earlywarning.analyzer.threatintel;

import reactor.core.publisher.Mono;

/**
 * A URL reputation service.
 *
 * <p>
 * Implementations must never signal an error: transport, auth, quota and
 * parse failures all complete with {@link ThreatIntelResult#unavailable}.
 * </p>
 *
 * @author Naveed Gung
 */
public interface UrlReputationProvider {

    /** Provider name, also used as {@link ThreatIntelResult#source()}. */
    String name();

    /** False when no credentials are configured; disabled providers are never called. */
    boolean isEnabled();

    /**
     * Look up the reputation of a URL.
     *
     * @param url the URL exactly as submitted
     * @return the lookup result (never an error signal)
     */
    Mono<ThreatIntelResult> lookupUrl(String url);
}
