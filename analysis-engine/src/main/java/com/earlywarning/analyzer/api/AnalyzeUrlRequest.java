package com.earlywarning.analyzer.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /analyze-url}.
 *
 * @param url    the URL to analyse
 * @param userId optional identity of the submitter, stored with the scan
 *
 * @author Naveed Gung
 */
public record AnalyzeUrlRequest(
        @NotBlank(message = "url must not be blank")
        @Size(max = 8192, message = "url must be at most 8192 characters")
        String url,

        @Size(max = 128, message = "userId must be at most 128 characters")
        String userId) {
}
