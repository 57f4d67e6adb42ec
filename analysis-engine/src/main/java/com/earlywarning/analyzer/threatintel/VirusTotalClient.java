package com.earlywarning.analyzer.threatintel;

import com.earlywarning.analyzer.config.ThreatIntelConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * VirusTotal API v3 client for URL reputation lookups.
 *
 * <p>
 * URLs are addressed by their unpadded base64url identifier. A 404 means
 * VirusTotal has never analysed the URL and is reported as clean. Requests
 * beyond the configured per-minute quota are not sent; they resolve as
 * unavailable instead of waiting for a permit.
 * </p>
 *
 * @see <a href="https://docs.virustotal.com/reference/url-info">VirusTotal API
 *      v3 URL report</a>
 * @author Naveed Gung
 */
@Component
public class VirusTotalClient implements UrlReputationProvider {

    private static final Logger log = LoggerFactory.getLogger(VirusTotalClient.class);

    public static final String SOURCE = "virustotal";

    private final WebClient webClient;
    private final ThreatIntelConfig.VirusTotal config;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;

    public VirusTotalClient(ThreatIntelConfig threatIntelConfig, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder) {
        this.config = threatIntelConfig.getVirusTotal();
        this.objectMapper = objectMapper;
        this.rateLimiter = RateLimiter.create(config.getRateLimitPerMinute() / 60.0);
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("x-apikey", config.getApiKey())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public String name() {
        return SOURCE;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Mono<ThreatIntelResult> lookupUrl(String url) {
        return Mono.defer(() -> {
            if (!rateLimiter.tryAcquire()) {
                log.debug("VirusTotal quota of {}/min exhausted, skipping lookup", config.getRateLimitPerMinute());
                return Mono.just(ThreatIntelResult.unavailable(SOURCE));
            }
            return webClient.get()
                    .uri("/urls/{id}", urlIdentifier(url))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(config.getTimeoutMs()))
                    .map(this::parseUrlResponse)
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                        log.debug("VirusTotal has no report for {}", url);
                        return Mono.just(ThreatIntelResult.clean(SOURCE));
                    })
                    .onErrorResume(e -> {
                        log.warn("VirusTotal URL lookup failed for {}: {}", url, e.getMessage());
                        return Mono.just(ThreatIntelResult.unavailable(SOURCE));
                    });
        });
    }

    /** VirusTotal URL identifier: base64url without padding. */
    static String urlIdentifier(String url) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(url.getBytes(StandardCharsets.UTF_8));
    }

    ThreatIntelResult parseUrlResponse(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode attrs = root.path("data").path("attributes");
            JsonNode lastAnalysis = attrs.path("last_analysis_stats");

            int malicious = lastAnalysis.path("malicious").asInt(0);
            int suspicious = lastAnalysis.path("suspicious").asInt(0);
            int total = malicious + suspicious
                    + lastAnalysis.path("harmless").asInt(0)
                    + lastAnalysis.path("undetected").asInt(0);

            boolean isMalicious = malicious >= config.getMinMaliciousEngines();

            Map<String, Object> details = new HashMap<>();
            details.put("malicious_detections", malicious);
            details.put("suspicious_detections", suspicious);
            details.put("total_engines", total);
            details.put("reputation", attrs.path("reputation").asInt(0));

            return isMalicious
                    ? ThreatIntelResult.malicious(SOURCE, malicious, details)
                    : ThreatIntelResult.clean(SOURCE);

        } catch (Exception e) {
            log.error("Failed to parse VirusTotal URL response: {}", e.getMessage());
            return ThreatIntelResult.unavailable(SOURCE);
        }
    }
}
