package com.earlywarning.analyzer.threatintel;

import java.util.List;

/**
 * Combined reputation verdict for one URL.
 *
 * <p>
 * A {@code null} flag means "unknown": the provider is disabled, failed, or
 * ran out of time. Unknown is never treated as clean or as malicious.
 * </p>
 *
 * @param flaggedBySafeBrowsing Google Safe Browsing verdict, null when unknown
 * @param flaggedByVirusTotal   VirusTotal verdict, null when unknown
 * @param vendorHitCount        positive detections summed over flagging providers
 *
 * @author Naveed Gung
 */
public record ThreatIntelSignal(
        Boolean flaggedBySafeBrowsing,
        Boolean flaggedByVirusTotal,
        int vendorHitCount) {

    private static final ThreatIntelSignal UNKNOWN = new ThreatIntelSignal(null, null, 0);

    public ThreatIntelSignal {
        if (vendorHitCount < 0) {
            throw new IllegalArgumentException("vendorHitCount must be >= 0");
        }
    }

    /** Signal for a disabled adapter or a failed lookup. */
    public static ThreatIntelSignal unknown() {
        return UNKNOWN;
    }

    /** Merge per-provider results; unavailable results leave their flag unknown. */
    public static ThreatIntelSignal from(List<ThreatIntelResult> results) {
        Boolean safeBrowsing = null;
        Boolean virusTotal = null;
        int hits = 0;

        for (ThreatIntelResult result : results) {
            if (!result.isAvailable()) {
                continue;
            }
            boolean flagged = result.isMalicious();
            if (GoogleSafeBrowsingClient.SOURCE.equals(result.source())) {
                safeBrowsing = flagged;
            } else if (VirusTotalClient.SOURCE.equals(result.source())) {
                virusTotal = flagged;
            } else {
                continue;
            }
            if (flagged) {
                hits += result.hitCount();
            }
        }
        return new ThreatIntelSignal(safeBrowsing, virusTotal, hits);
    }

    /** True when at least one vendor confirmed the URL as malicious. */
    public boolean hasPositiveHit() {
        return Boolean.TRUE.equals(flaggedBySafeBrowsing) || Boolean.TRUE.equals(flaggedByVirusTotal);
    }
}
