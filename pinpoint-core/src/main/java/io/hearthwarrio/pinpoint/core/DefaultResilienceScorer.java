package io.hearthwarrio.pinpoint.core;

import java.util.regex.Pattern;

/**
 * Fixed lookup with value-sensitive penalties for ids, classes and structural selectors.
 * <p>
 * A combined class selector ({@code .a.b}) is scored as a whole: one generated-looking token is enough to
 * drop the combination to the generated score.
 */
public class DefaultResilienceScorer implements ResilienceScorer {

    static final int GENERATED = 10;

    private static final Pattern QUOTED = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'");

    @Override
    public int score(StrategyKind kind, String value) {
        if (kind == null) {
            return 0;
        }
        String v = value == null ? "" : value;
        return clamp(rawScore(kind, v));
    }

    private int rawScore(StrategyKind kind, String value) {
        switch (kind) {
            case TESTID:
                return 100;
            case ROLE:
                return 90;
            case LABEL:
                return 85;
            case PLACEHOLDER:
                return 80;
            case ID:
                return ResilienceScorer.looksGenerated(value) ? GENERATED : 70;
            case NAME:
                return 65;
            case TEXT:
                return 60;
            case CLASS:
                return ResilienceScorer.looksGenerated(value) ? GENERATED : 40;
            case CSS:
                return isFragilePath(value) ? 15 : 30;
            case XPATH:
            default:
                return 0;
        }
    }

    private boolean isFragilePath(String selector) {
        // '>' inside quoted attribute values is not a combinator
        String unquoted = QUOTED.matcher(selector).replaceAll("\"\"");
        return unquoted.contains("nth-of-type") || unquoted.split(">", -1).length > 3;
    }

    private int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
