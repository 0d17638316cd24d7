package io.hearthwarrio.pinpoint.core;

/**
 * How a candidate locator identifies its element.
 */
public enum StrategyKind {
    TESTID,
    ROLE,
    LABEL,
    PLACEHOLDER,
    TEXT,
    ID,
    NAME,
    CLASS,
    CSS,
    XPATH
}
