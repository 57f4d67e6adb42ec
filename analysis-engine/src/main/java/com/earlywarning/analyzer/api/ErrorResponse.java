package com.earlywarning.analyzer.api;

import java.time.Instant;
import java.util.Map;

/**
 * JSON error body for all API failures.
 *
 * @author Naveed Gung
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        Map<String, String> details) {

    public static ErrorResponse of(int status, String error, String message) {
        return new ErrorResponse(Instant.now(), status, error, message, Map.of());
    }
}
