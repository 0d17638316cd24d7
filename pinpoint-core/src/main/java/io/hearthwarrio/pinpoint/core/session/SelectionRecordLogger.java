package io.hearthwarrio.pinpoint.core.session;

import io.hearthwarrio.pinpoint.core.SelectionRecord;

/**
 * Receives every record produced by an {@link InspectionSession}.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface SelectionRecordLogger {

    void logSelection(SelectionRecord record);

    default RecordLogDetail detail() {
        return RecordLogDetail.LOCATORS;
    }
}
