package io.hearthwarrio.pinpoint.core.session;

import io.hearthwarrio.pinpoint.core.SelectionRecord;

import java.util.Objects;

/**
 * Default stdout logger for selection records.
 */
public final class StdOutSelectionRecordLogger implements SelectionRecordLogger {

    private final RecordLogDetail detail;

    public StdOutSelectionRecordLogger(RecordLogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public RecordLogDetail detail() {
        return detail;
    }

    @Override
    public void logSelection(SelectionRecord record) {
        if (detail == RecordLogDetail.NONE) {
            // still log something minimal
            System.out.println("[Pinpoint] selected '" + record.getDisplayName() + "', selector="
                    + record.getStructuralSelector());
            return;
        }
        System.out.println("[Pinpoint] selected element\n" + RecordLogText.render(record, detail));
    }
}
