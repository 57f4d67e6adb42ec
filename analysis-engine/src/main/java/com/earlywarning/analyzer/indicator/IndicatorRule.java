package com.earlywarning.analyzer.indicator;

import com.earlywarning.analyzer.feature.UrlFeatures;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Heuristic threat rules over {@link UrlFeatures}.
 *
 * <p>
 * Declaration order is evaluation order and therefore the order of the
 * indicator list; do not reorder constants without updating consumers that
 * rely on stable output.
 * </p>
 *
 * @author Naveed Gung
 */
public enum IndicatorRule {

    LONG_URL(
            f -> f.length() > Thresholds.MAX_LENGTH,
            f -> String.format("Unusually long URL (%d characters)", f.length())),
    EXCESSIVE_DOTS(
            f -> f.dotCount() > Thresholds.MAX_DOTS,
            f -> String.format("Excessive dots in URL (%d)", f.dotCount())),
    IP_HOST(
            UrlFeatures::hasIpHost,
            f -> "IP address detected instead of domain"),
    SUSPICIOUS_KEYWORDS(
            f -> f.suspiciousKeywordCount() > 0,
            f -> String.format("Suspicious keywords detected (%d found)", f.suspiciousKeywordCount())),
    HIGH_RISK_TLD(
            f -> f.tldRiskScore() > 0,
            f -> "High-risk TLD detected"),
    NO_HTTPS(
            f -> !f.usesHttps(),
            f -> "No HTTPS encryption"),
    DEEP_SUBDOMAINS(
            f -> f.subdomainCount() > Thresholds.MAX_SUBDOMAINS,
            f -> String.format("Excessive subdomain depth (%d)", f.subdomainCount())),
    HIGH_ENTROPY(
            f -> f.entropy() > Thresholds.MAX_ENTROPY,
            f -> "High URL entropy (obfuscation indicator)");

    private final Predicate<UrlFeatures> trigger;
    private final Function<UrlFeatures, String> message;

    IndicatorRule(Predicate<UrlFeatures> trigger, Function<UrlFeatures, String> message) {
        this.trigger = trigger;
        this.message = message;
    }

    public boolean triggers(UrlFeatures features) {
        return trigger.test(features);
    }

    public String describe(UrlFeatures features) {
        return message.apply(features);
    }

    /** Total number of rules, the denominator of the indicator density. */
    public static int count() {
        return values().length;
    }

    /** Tunable trigger thresholds. */
    public static final class Thresholds {
        public static final int MAX_LENGTH = 75;
        public static final int MAX_DOTS = 3;
        public static final int MAX_SUBDOMAINS = 2;
        public static final double MAX_ENTROPY = 4.0;

        private Thresholds() {
        }
    }
}
