package io.hearthwarrio.pinpoint.core.session;

import io.hearthwarrio.pinpoint.core.SelectionRecord;

import java.util.List;

/**
 * Receives the full current selection after every change (select, deselect, reset).
 */
@FunctionalInterface
public interface SelectionListener {

    /**
     * @param selection records in selection order; empty after a reset
     */
    void selectionChanged(List<SelectionRecord> selection);
}
