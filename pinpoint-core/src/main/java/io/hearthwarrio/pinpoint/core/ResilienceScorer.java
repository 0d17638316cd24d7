package io.hearthwarrio.pinpoint.core;

import java.util.regex.Pattern;

/**
 * Rates how likely a locator strategy is to survive changes to the page.
 * <p>
 * Scores are in {@code [0, 100]}; higher is more resilient.
 */
public interface ResilienceScorer {

    /**
     * Matches a run of four or more digits, the usual trace of a generated identifier.
     */
    Pattern GENERATED_DIGIT_RUN = Pattern.compile("\\d{4,}");

    /**
     * @param kind  strategy used by the locator
     * @param value raw value the strategy keys on (id value, class string, selector, ...); may be null
     * @return score within {@code [0, 100]}
     */
    int score(StrategyKind kind, String value);

    static boolean looksGenerated(String value) {
        return value != null && GENERATED_DIGIT_RUN.matcher(value).find();
    }
}
