package com.earlywarning.analyzer.model;

import com.earlywarning.analyzer.feature.UrlFeatures;
import com.earlywarning.analyzer.indicator.IndicatorRule;

import java.util.EnumMap;
import java.util.Map;

/**
 * Deterministic fallback used when no trained artifact is available.
 *
 * <p>
 * Weighted sum over the same rules as the indicator generator, clamped to
 * [0.0, 1.0]. Keyword hits add per keyword up to a cap. A simulated domain
 * age under {@link #YOUNG_DOMAIN_DAYS} adds a small bump; that age is a
 * stable pseudo-value, so its weight stays low.
 * </p>
 *
 * @author Naveed Gung
 */
public final class HeuristicThreatModel implements ThreatModel {

    static final double KEYWORD_WEIGHT = 0.15;
    static final double KEYWORD_CAP = 0.45;
    static final double YOUNG_DOMAIN_WEIGHT = 0.05;
    static final int YOUNG_DOMAIN_DAYS = 30;

    private static final Map<IndicatorRule, Double> RULE_WEIGHTS = new EnumMap<>(IndicatorRule.class);

    static {
        RULE_WEIGHTS.put(IndicatorRule.LONG_URL, 0.15);
        RULE_WEIGHTS.put(IndicatorRule.EXCESSIVE_DOTS, 0.10);
        RULE_WEIGHTS.put(IndicatorRule.IP_HOST, 0.40);
        RULE_WEIGHTS.put(IndicatorRule.HIGH_RISK_TLD, 0.25);
        RULE_WEIGHTS.put(IndicatorRule.NO_HTTPS, 0.15);
        RULE_WEIGHTS.put(IndicatorRule.DEEP_SUBDOMAINS, 0.10);
        RULE_WEIGHTS.put(IndicatorRule.HIGH_ENTROPY, 0.10);
    }

    @Override
    public double predict(UrlFeatures features) {
        double score = 0.0;
        for (Map.Entry<IndicatorRule, Double> entry : RULE_WEIGHTS.entrySet()) {
            if (entry.getKey().triggers(features)) {
                score += entry.getValue();
            }
        }

        score += Math.min(KEYWORD_CAP, features.suspiciousKeywordCount() * KEYWORD_WEIGHT);

        if (features.hasDomainAge() && features.domainAgeDays() < YOUNG_DOMAIN_DAYS) {
            score += YOUNG_DOMAIN_WEIGHT;
        }

        return Math.min(1.0, Math.max(0.0, score));
    }

    @Override
    public String name() {
        return "heuristic-fallback";
    }
}
