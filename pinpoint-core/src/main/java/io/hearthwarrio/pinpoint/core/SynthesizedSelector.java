package io.hearthwarrio.pinpoint.core;

import java.util.Objects;

/**
 * Structural selector plus how it was found.
 * <p>
 * {@link #isUnique()} is false only for the degraded result of an ancestry walk that hit the depth bound.
 */
public final class SynthesizedSelector {

    private final String selector;
    private final SelectorStrategy strategy;
    private final boolean unique;

    public SynthesizedSelector(String selector, SelectorStrategy strategy, boolean unique) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.unique = unique;
    }

    public String getSelector() {
        return selector;
    }

    public SelectorStrategy getStrategy() {
        return strategy;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isDegraded() {
        return !unique;
    }

    @Override
    public String toString() {
        return "SynthesizedSelector{" +
                "selector='" + selector + '\'' +
                ", strategy=" + strategy +
                ", unique=" + unique +
                '}';
    }
}
