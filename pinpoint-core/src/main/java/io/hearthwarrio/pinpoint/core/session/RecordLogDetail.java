package io.hearthwarrio.pinpoint.core.session;

/**
 * Controls how much of a {@link io.hearthwarrio.pinpoint.core.SelectionRecord} is logged.
 */
public enum RecordLogDetail {

    /**
     * Display name and structural selector only.
     */
    NONE,

    /**
     * Adds XPath and both composed locators.
     */
    LOCATORS,

    /**
     * Adds attributes, ranked candidates and the HTML snapshot.
     */
    FULL
}
