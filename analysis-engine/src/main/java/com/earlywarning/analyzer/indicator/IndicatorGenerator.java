package com.earlywarning.analyzer.indicator;

import com.earlywarning.analyzer.feature.UrlFeatures;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives human-readable threat indicators directly from feature values.
 *
 * <p>
 * Independent of the classifier. Each {@link IndicatorRule} contributes at
 * most one entry, in declaration order; an empty result is replaced by
 * {@link #NO_INDICATORS} so callers always get a non-empty list.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class IndicatorGenerator {

    public static final String NO_INDICATORS = "No specific threat indicators detected.";

    /**
     * Evaluate all rules against the features.
     *
     * @param features the extracted URL features
     * @return immutable, non-empty list of indicator strings
     */
    public List<String> indicatorsFor(UrlFeatures features) {
        List<String> indicators = new ArrayList<>();
        for (IndicatorRule rule : IndicatorRule.values()) {
            if (rule.triggers(features)) {
                indicators.add(rule.describe(features));
            }
        }
        return indicators.isEmpty() ? List.of(NO_INDICATORS) : List.copyOf(indicators);
    }

    /**
     * Number of real indicators in a list produced by {@link #indicatorsFor}.
     *
     * @param indicators indicator list, possibly holding only the placeholder
     * @return count excluding {@link #NO_INDICATORS}
     */
    public static int triggeredCount(List<String> indicators) {
        return (int) indicators.stream().filter(i -> !NO_INDICATORS.equals(i)).count();
    }
}
