package com.earlywarning.analyzer.threatintel;

import com.earlywarning.analyzer.config.ThreatIntelConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class VirusTotalClientTest {

    private static final String REPORT = """
            {"data": {"attributes": {
              "reputation": -12,
              "last_analysis_stats": {"malicious": 6, "suspicious": 1, "harmless": 60, "undetected": 20}
            }}}
            """;

    private ThreatIntelConfig config;
    private AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        config = new ThreatIntelConfig();
        config.getVirusTotal().setApiKey("test-key");
        lastRequest = new AtomicReference<>();
    }

    @Test
    void shouldEncodeUrlIdentifierWithoutPadding() {
        assertEquals("aHR0cDovL2V4YW1wbGUuY29tLw", VirusTotalClient.urlIdentifier("http://example.com/"));
    }

    @Test
    void shouldFlagUrlDetectedByEnoughEngines() {
        VirusTotalClient client = clientAnswering(HttpStatus.OK, REPORT);

        StepVerifier.create(client.lookupUrl("http://example.com/"))
                .assertNext(result -> {
                    assertTrue(result.isMalicious());
                    assertEquals(6, result.hitCount());
                    assertEquals(87, result.details().get("total_engines"));
                })
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertTrue(request.url().toString().endsWith("/urls/aHR0cDovL2V4YW1wbGUuY29tLw"));
        assertEquals("test-key", request.headers().getFirst("x-apikey"));
    }

    @Test
    void shouldTreatSingleDetectionAsClean() {
        VirusTotalClient client = clientAnswering(HttpStatus.OK, REPORT);

        ThreatIntelResult result = client.parseUrlResponse(
                "{\"data\":{\"attributes\":{\"last_analysis_stats\":{\"malicious\":1,\"harmless\":70}}}}");

        assertEquals(ThreatIntelResult.Status.CLEAN, result.status());
    }

    @Test
    void shouldTreatUnknownUrlAsClean() {
        VirusTotalClient client = clientAnswering(HttpStatus.NOT_FOUND, "{\"error\":{\"code\":\"NotFoundError\"}}");

        StepVerifier.create(client.lookupUrl("https://brand-new.example/"))
                .assertNext(result -> assertEquals(ThreatIntelResult.Status.CLEAN, result.status()))
                .verifyComplete();
    }

    @Test
    void shouldReportServerErrorAsUnavailable() {
        VirusTotalClient client = clientAnswering(HttpStatus.INTERNAL_SERVER_ERROR, "oops");

        StepVerifier.create(client.lookupUrl("https://example.com/"))
                .assertNext(result -> assertFalse(result.isAvailable()))
                .verifyComplete();
    }

    @Test
    void shouldReportGarbageBodyAsUnavailable() {
        VirusTotalClient client = clientAnswering(HttpStatus.OK, REPORT);

        assertFalse(client.parseUrlResponse("not json").isAvailable());
    }

    @Test
    void shouldSkipLookupWhenQuotaExhausted() {
        VirusTotalClient client = clientAnswering(HttpStatus.OK, REPORT);

        StepVerifier.create(client.lookupUrl("http://example.com/"))
                .assertNext(result -> assertTrue(result.isAvailable()))
                .verifyComplete();
        StepVerifier.create(client.lookupUrl("http://example.com/"))
                .assertNext(result -> assertFalse(result.isAvailable()))
                .verifyComplete();
    }

    @Test
    void shouldBeDisabledWithoutApiKey() {
        config.getVirusTotal().setApiKey("");

        assertFalse(clientAnswering(HttpStatus.OK, REPORT).isEnabled());
    }

    private VirusTotalClient clientAnswering(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(body)
                    .build());
        });
        return new VirusTotalClient(config, new ObjectMapper(), builder);
    }
}
