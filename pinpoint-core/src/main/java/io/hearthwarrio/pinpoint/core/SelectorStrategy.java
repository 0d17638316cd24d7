package io.hearthwarrio.pinpoint.core;

/**
 * Which step of selector synthesis produced a structural selector.
 */
public enum SelectorStrategy {
    ID,
    CLASS,
    CLASS_COMBINATION,
    ATTRIBUTE,
    ANCESTRY_PATH
}
