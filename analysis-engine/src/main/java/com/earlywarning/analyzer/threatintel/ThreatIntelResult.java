package com.earlywarning.analyzer.threatintel;

import java.util.Map;

/**
 * Result of one reputation provider's lookup.
 *
 * @param source   the provider name (e.g., "google-safe-browsing", "virustotal")
 * @param status   whether the URL was flagged, found clean, or could not be checked
 * @param hitCount provider-specific positive detections (matches or engines)
 * @param details  provider-specific response details
 *
 * @author Naveed Gung
 */
public record ThreatIntelResult(
        String source,
        Status status,
        int hitCount,
        Map<String, Object> details) {

    public enum Status {
        MALICIOUS, CLEAN, UNAVAILABLE
    }

    public boolean isMalicious() {
        return status == Status.MALICIOUS;
    }

    public boolean isAvailable() {
        return status != Status.UNAVAILABLE;
    }

    /** Factory for a clean (non-malicious) result. */
    public static ThreatIntelResult clean(String source) {
        return new ThreatIntelResult(source, Status.CLEAN, 0, Map.of());
    }

    /** Factory for a malicious result. */
    public static ThreatIntelResult malicious(String source, int hitCount, Map<String, Object> details) {
        return new ThreatIntelResult(source, Status.MALICIOUS, Math.max(0, hitCount), Map.copyOf(details));
    }

    /** Factory for a provider-unavailable result. */
    public static ThreatIntelResult unavailable(String source) {
        return new ThreatIntelResult(source, Status.UNAVAILABLE, 0, Map.of("status", "unavailable"));
    }
}
