package com.earlywarning.analyzer.health;

import com.earlywarning.analyzer.config.ThreatIntelConfig;
import com.earlywarning.analyzer.model.UrlThreatClassifier;
import com.earlywarning.analyzer.threatintel.GoogleSafeBrowsingClient;
import com.earlywarning.analyzer.threatintel.StubReputationProvider;
import com.earlywarning.analyzer.threatintel.ThreatIntelService;
import com.earlywarning.analyzer.threatintel.VirusTotalClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisEngineHealthIndicatorTest {

    @Test
    void shouldStayUpOnHeuristicFallbackWithoutProviders() {
        ThreatIntelService intel = new ThreatIntelService(List.of(
                StubReputationProvider.disabled(GoogleSafeBrowsingClient.SOURCE),
                StubReputationProvider.disabled(VirusTotalClient.SOURCE)),
                new ThreatIntelConfig(), new SimpleMeterRegistry());

        Health health = new AnalysisEngineHealthIndicator(UrlThreatClassifier.heuristicOnly(), intel).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("heuristic-fallback", health.getDetails().get("classifier"));
        assertEquals(false, health.getDetails().get("modelLoaded"));
        assertEquals("disabled", health.getDetails().get("threatIntel." + GoogleSafeBrowsingClient.SOURCE));
        assertEquals("disabled", health.getDetails().get("threatIntel." + VirusTotalClient.SOURCE));
    }

    @Test
    void shouldReportEnabledProvider() {
        ThreatIntelService intel = new ThreatIntelService(List.of(
                StubReputationProvider.clean(VirusTotalClient.SOURCE)),
                new ThreatIntelConfig(), new SimpleMeterRegistry());

        Health health = new AnalysisEngineHealthIndicator(UrlThreatClassifier.heuristicOnly(), intel).health();

        assertEquals("enabled", health.getDetails().get("threatIntel." + VirusTotalClient.SOURCE));
    }
}
