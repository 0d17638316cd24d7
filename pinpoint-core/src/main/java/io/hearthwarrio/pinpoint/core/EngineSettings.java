package io.hearthwarrio.pinpoint.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the engine. Immutable; every {@code withX} returns a modified copy.
 */
public final class EngineSettings {

    public static final String DEFAULT_TEST_ID_ATTRIBUTE = "data-testid";
    public static final int DEFAULT_MAX_SELECTOR_DEPTH = 5;
    public static final int DEFAULT_ANCESTOR_PROBE_DEPTH = 4;
    public static final Duration DEFAULT_DYNAMIC_WINDOW = Duration.ofSeconds(2);
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMillis(5000);
    public static final int DEFAULT_SEMANTIC_CHAIN_LENGTH = 3;
    public static final int DEFAULT_SELENIUM_CHAIN_LENGTH = 2;
    public static final int DEFAULT_TIMESTAMP_CAPACITY = 10_000;
    public static final int DEFAULT_TEXT_LIMIT = 50;

    private final String testIdAttribute;
    private final int maxSelectorDepth;
    private final int ancestorProbeDepth;
    private final Duration dynamicWindow;
    private final Duration waitTimeout;
    private final int semanticChainLength;
    private final int seleniumChainLength;
    private final int timestampCapacity;
    private final int textLimit;

    private EngineSettings(
            String testIdAttribute,
            int maxSelectorDepth,
            int ancestorProbeDepth,
            Duration dynamicWindow,
            Duration waitTimeout,
            int semanticChainLength,
            int seleniumChainLength,
            int timestampCapacity,
            int textLimit
    ) {
        this.testIdAttribute = testIdAttribute;
        this.maxSelectorDepth = maxSelectorDepth;
        this.ancestorProbeDepth = ancestorProbeDepth;
        this.dynamicWindow = dynamicWindow;
        this.waitTimeout = waitTimeout;
        this.semanticChainLength = semanticChainLength;
        this.seleniumChainLength = seleniumChainLength;
        this.timestampCapacity = timestampCapacity;
        this.textLimit = textLimit;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_TEST_ID_ATTRIBUTE,
                DEFAULT_MAX_SELECTOR_DEPTH,
                DEFAULT_ANCESTOR_PROBE_DEPTH,
                DEFAULT_DYNAMIC_WINDOW,
                DEFAULT_WAIT_TIMEOUT,
                DEFAULT_SEMANTIC_CHAIN_LENGTH,
                DEFAULT_SELENIUM_CHAIN_LENGTH,
                DEFAULT_TIMESTAMP_CAPACITY,
                DEFAULT_TEXT_LIMIT
        );
    }

    /**
     * Attribute treated as the explicit test hook (for example {@code data-testid}, {@code data-qa}).
     */
    public EngineSettings withTestIdAttribute(String attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        if (attribute.isBlank()) {
            throw new IllegalArgumentException("attribute must not be blank");
        }
        return new EngineSettings(attribute.trim(), maxSelectorDepth, ancestorProbeDepth, dynamicWindow,
                waitTimeout, semanticChainLength, seleniumChainLength, timestampCapacity, textLimit);
    }

    /**
     * Maximum number of {@code >}-joined segments in an ancestry selector.
     */
    public EngineSettings withMaxSelectorDepth(int depth) {
        return new EngineSettings(testIdAttribute, positive(depth, "maxSelectorDepth"), ancestorProbeDepth,
                dynamicWindow, waitTimeout, semanticChainLength, seleniumChainLength, timestampCapacity, textLimit);
    }

    public EngineSettings withAncestorProbeDepth(int depth) {
        return new EngineSettings(testIdAttribute, maxSelectorDepth, positive(depth, "ancestorProbeDepth"),
                dynamicWindow, waitTimeout, semanticChainLength, seleniumChainLength, timestampCapacity, textLimit);
    }

    /**
     * How long after insertion an element still counts as dynamic.
     */
    public EngineSettings withDynamicWindow(Duration window) {
        return new EngineSettings(testIdAttribute, maxSelectorDepth, ancestorProbeDepth,
                nonNegative(window, "dynamicWindow"), waitTimeout, semanticChainLength, seleniumChainLength,
                timestampCapacity, textLimit);
    }

    /**
     * Timeout written into the emitted wait-for-visible instructions.
     */
    public EngineSettings withWaitTimeout(Duration timeout) {
        return new EngineSettings(testIdAttribute, maxSelectorDepth, ancestorProbeDepth, dynamicWindow,
                nonNegative(timeout, "waitTimeout"), semanticChainLength, seleniumChainLength,
                timestampCapacity, textLimit);
    }

    public EngineSettings withSemanticChainLength(int length) {
        return new EngineSettings(testIdAttribute, maxSelectorDepth, ancestorProbeDepth, dynamicWindow,
                waitTimeout, positive(length, "semanticChainLength"), seleniumChainLength, timestampCapacity,
                textLimit);
    }

    public EngineSettings withSeleniumChainLength(int length) {
        return new EngineSettings(testIdAttribute, maxSelectorDepth, ancestorProbeDepth, dynamicWindow,
                waitTimeout, semanticChainLength, positive(length, "seleniumChainLength"), timestampCapacity,
                textLimit);
    }

    public EngineSettings withTimestampCapacity(int capacity) {
        return new EngineSettings(testIdAttribute, maxSelectorDepth, ancestorProbeDepth, dynamicWindow,
                waitTimeout, semanticChainLength, seleniumChainLength, positive(capacity, "timestampCapacity"),
                textLimit);
    }

    public String getTestIdAttribute() {
        return testIdAttribute;
    }

    public int getMaxSelectorDepth() {
        return maxSelectorDepth;
    }

    public int getAncestorProbeDepth() {
        return ancestorProbeDepth;
    }

    public Duration getDynamicWindow() {
        return dynamicWindow;
    }

    public Duration getWaitTimeout() {
        return waitTimeout;
    }

    public int getSemanticChainLength() {
        return semanticChainLength;
    }

    public int getSeleniumChainLength() {
        return seleniumChainLength;
    }

    public int getTimestampCapacity() {
        return timestampCapacity;
    }

    /**
     * Maximum length of text fragments (accessible names, visible text) used in locators.
     */
    public int getTextLimit() {
        return textLimit;
    }

    private static int positive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    private static Duration nonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "testIdAttribute='" + testIdAttribute + '\'' +
                ", maxSelectorDepth=" + maxSelectorDepth +
                ", ancestorProbeDepth=" + ancestorProbeDepth +
                ", dynamicWindow=" + dynamicWindow +
                ", waitTimeout=" + waitTimeout +
                ", semanticChainLength=" + semanticChainLength +
                ", seleniumChainLength=" + seleniumChainLength +
                ", timestampCapacity=" + timestampCapacity +
                '}';
    }
}
