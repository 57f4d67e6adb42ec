package com.earlywarning.analyzer.history;

import com.earlywarning.analyzer.engine.ThreatVerdict;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored verdict.
 *
 * @param id        generated scan id
 * @param userId    submitting user, null when anonymous
 * @param createdAt when the verdict was stored
 * @param verdict   the engine output
 *
 * @author Naveed Gung
 */
public record ScanRecord(String id, String userId, Instant createdAt, ThreatVerdict verdict) {

    public static ScanRecord of(ThreatVerdict verdict, String userId, Instant createdAt) {
        return new ScanRecord(UUID.randomUUID().toString(), userId, createdAt, verdict);
    }
}
