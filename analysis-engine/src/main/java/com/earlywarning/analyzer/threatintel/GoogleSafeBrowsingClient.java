package com.earlywarning.analyzer.threatintel;

import com.earlywarning.analyzer.config.ThreatIntelConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google Safe Browsing Lookup API v4 client.
 *
 * @see <a href="https://developers.google.com/safe-browsing/v4/lookup-api">Safe
 *      Browsing Lookup API v4</a>
 * @author Naveed Gung
 */
@Component
public class GoogleSafeBrowsingClient implements UrlReputationProvider {

    private static final Logger log = LoggerFactory.getLogger(GoogleSafeBrowsingClient.class);

    public static final String SOURCE = "google-safe-browsing";

    static final List<String> THREAT_TYPES = List.of(
            "MALWARE", "SOCIAL_ENGINEERING", "UNWANTED_SOFTWARE", "POTENTIALLY_HARMFUL_APPLICATION");

    private final WebClient webClient;
    private final ThreatIntelConfig.GoogleSafeBrowsing config;
    private final ObjectMapper objectMapper;

    public GoogleSafeBrowsingClient(ThreatIntelConfig threatIntelConfig, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder) {
        this.config = threatIntelConfig.getSafeBrowsing();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
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
        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/threatMatches:find")
                        .queryParam("key", config.getApiKey())
                        .build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody(url))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .map(this::parseResponse)
                .onErrorResume(e -> {
                    log.warn("Safe Browsing lookup failed for {}: {}", url, e.getMessage());
                    return Mono.just(ThreatIntelResult.unavailable(SOURCE));
                });
    }

    Map<String, Object> requestBody(String url) {
        return Map.of(
                "client", Map.of(
                        "clientId", config.getClientId(),
                        "clientVersion", config.getClientVersion()),
                "threatInfo", Map.of(
                        "threatTypes", THREAT_TYPES,
                        "platformTypes", List.of("ANY_PLATFORM"),
                        "threatEntryTypes", List.of("URL"),
                        "threatEntries", List.of(Map.of("url", url))));
    }

    /** An empty JSON object is the API's answer for "no match". */
    ThreatIntelResult parseResponse(String body) {
        try {
            JsonNode matches = objectMapper.readTree(body).path("matches");
            if (!matches.isArray() || matches.isEmpty()) {
                return ThreatIntelResult.clean(SOURCE);
            }

            List<String> threatTypes = new ArrayList<>();
            for (JsonNode match : matches) {
                String type = match.path("threatType").asText("THREAT_TYPE_UNSPECIFIED");
                if (!threatTypes.contains(type)) {
                    threatTypes.add(type);
                }
            }

            return ThreatIntelResult.malicious(SOURCE, matches.size(), Map.of(
                    "match_count", matches.size(),
                    "threat_types", List.copyOf(threatTypes)));

        } catch (Exception e) {
            log.error("Failed to parse Safe Browsing response: {}", e.getMessage());
            return ThreatIntelResult.unavailable(SOURCE);
        }
    }
}
