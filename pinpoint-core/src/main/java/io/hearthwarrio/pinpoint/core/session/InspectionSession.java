package io.hearthwarrio.pinpoint.core.session;

import io.hearthwarrio.pinpoint.core.PinpointEngine;
import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.SynthesizedSelector;
import io.hearthwarrio.pinpoint.core.dynamic.MutationTracker;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Inspection mode of one document: an {@link InspectionState#IDLE} / {@link InspectionState#INSPECTING}
 * state machine owning the current selection.
 * <p>
 * Transitions:
 * <ul>
 *   <li>{@link #start()}: IDLE to INSPECTING, starts mutation tracking; no-op when already inspecting.</li>
 *   <li>{@link #stop()}: INSPECTING to IDLE, stops mutation tracking; the selection is kept.</li>
 *   <li>{@link #reset()}: same state, selection cleared.</li>
 *   <li>{@link #clearAll()}: stop followed by reset.</li>
 * </ul>
 * Selections are toggles keyed by structural selector and are ignored while idle.
 * <p>
 * This class is not thread-safe and is expected to be used from a single inspection thread.
 */
public final class InspectionSession {

    private static final Logger logger = LoggerFactory.getLogger(InspectionSession.class);

    private final PinpointEngine engine;
    private final MutationTracker tracker;
    private final Map<String, SelectionRecord> selection = new LinkedHashMap<>();
    private final List<SelectionListener> listeners = new ArrayList<>();

    /**
     * Mutable to support runtime overrides.
     */
    private SelectionRecordLogger recordLogger;

    private InspectionState state = InspectionState.IDLE;

    public InspectionSession(PinpointEngine engine, MutationTracker tracker) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
    }

    public InspectionSession withRecordLogger(SelectionRecordLogger logger) {
        this.recordLogger = logger;
        return this;
    }

    public InspectionSession withLoggingToStdOut(RecordLogDetail detail) {
        return withRecordLogger(new StdOutSelectionRecordLogger(detail));
    }

    public InspectionSession withListener(SelectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
        return this;
    }

    public InspectionSession start() {
        if (state == InspectionState.INSPECTING) {
            logger.debug("start ignored: already inspecting");
            return this;
        }
        state = InspectionState.INSPECTING;
        tracker.start();
        logger.info("Inspection started");
        return this;
    }

    public InspectionSession stop() {
        if (state == InspectionState.IDLE) {
            return this;
        }
        state = InspectionState.IDLE;
        tracker.stop();
        logger.info("Inspection stopped with {} selected element(s)", selection.size());
        return this;
    }

    public InspectionSession reset() {
        selection.clear();
        logger.info("Selection reset ({})", state);
        notifyListeners();
        return this;
    }

    public InspectionSession clearAll() {
        stop();
        return reset();
    }

    /**
     * Toggles the element in the selection.
     *
     * @return the new record when the element became selected; empty when it was deselected or the session is idle
     */
    public Optional<SelectionRecord> select(TreeNode node) {
        if (node == null || state != InspectionState.INSPECTING) {
            return Optional.empty();
        }

        SynthesizedSelector selector = engine.synthesizeSelector(node);
        String key = selector.getSelector();
        if (selection.remove(key) != null) {
            logger.debug("Deselected '{}'", key);
            notifyListeners();
            return Optional.empty();
        }

        SelectionRecord record = engine.describe(node, selector);
        selection.put(key, record);
        logger.debug("Selected '{}' (dynamic={})", key, record.isDynamic());

        if (recordLogger != null) {
            recordLogger.logSelection(record);
        }
        notifyListeners();
        return Optional.of(record);
    }

    /**
     * Removes one record by its structural selector.
     *
     * @return true when something was removed
     */
    public boolean deselect(String structuralSelector) {
        if (structuralSelector == null || selection.remove(structuralSelector) == null) {
            return false;
        }
        notifyListeners();
        return true;
    }

    public List<SelectionRecord> getSelection() {
        return Collections.unmodifiableList(new ArrayList<>(selection.values()));
    }

    public InspectionState getState() {
        return state;
    }

    public boolean isInspecting() {
        return state == InspectionState.INSPECTING;
    }

    public MutationTracker getTracker() {
        return tracker;
    }

    public PinpointEngine getEngine() {
        return engine;
    }

    private void notifyListeners() {
        List<SelectionRecord> snapshot = getSelection();
        for (SelectionListener listener : listeners) {
            listener.selectionChanged(snapshot);
        }
    }
}
