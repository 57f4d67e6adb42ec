package com.earlywarning.analyzer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for URL reputation integrations.
 *
 * <p>
 * All API keys are sourced from environment variables to prevent
 * credential leakage. A provider without a key is disabled silently; the
 * engine then analyses URLs from static features alone.
 * </p>
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "analyzer.threat-intel")
public class ThreatIntelConfig {

    /** Upper bound for the whole reputation lookup, all providers included. */
    @Min(100)
    private int lookupBudgetMs = 6000;

    @Valid
    private GoogleSafeBrowsing safeBrowsing = new GoogleSafeBrowsing();

    @Valid
    private VirusTotal virusTotal = new VirusTotal();

    public int getLookupBudgetMs() {
        return lookupBudgetMs;
    }

    public void setLookupBudgetMs(int lookupBudgetMs) {
        this.lookupBudgetMs = lookupBudgetMs;
    }

    public GoogleSafeBrowsing getSafeBrowsing() {
        return safeBrowsing;
    }

    public void setSafeBrowsing(GoogleSafeBrowsing safeBrowsing) {
        this.safeBrowsing = safeBrowsing;
    }

    public VirusTotal getVirusTotal() {
        return virusTotal;
    }

    public void setVirusTotal(VirusTotal virusTotal) {
        this.virusTotal = virusTotal;
    }

    public static class GoogleSafeBrowsing {
        private String apiKey = "";
        @NotBlank
        private String baseUrl = "https://safebrowsing.googleapis.com/v4";
        @NotBlank
        private String clientId = "ransomware-early-warning";
        @NotBlank
        private String clientVersion = "1.0.0";
        @Min(100)
        private int timeoutMs = 5000;

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientVersion() {
            return clientVersion;
        }

        public void setClientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class VirusTotal {
        private String apiKey = "";
        @NotBlank
        private String baseUrl = "https://www.virustotal.com/api/v3";
        /** Public API tier allows four requests per minute. */
        @Min(1)
        private int rateLimitPerMinute = 4;
        @Min(100)
        private int timeoutMs = 5000;
        /** Engines that must report "malicious" before the URL counts as flagged. */
        @Min(1)
        private int minMaliciousEngines = 2;

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getRateLimitPerMinute() {
            return rateLimitPerMinute;
        }

        public void setRateLimitPerMinute(int rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMinMaliciousEngines() {
            return minMaliciousEngines;
        }

        public void setMinMaliciousEngines(int minMaliciousEngines) {
            this.minMaliciousEngines = minMaliciousEngines;
        }
    }
}
