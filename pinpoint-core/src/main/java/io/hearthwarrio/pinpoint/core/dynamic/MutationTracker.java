package io.hearthwarrio.pinpoint.core.dynamic;

import io.hearthwarrio.pinpoint.core.tree.InsertionListener;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Timestamps elements inserted into the document while observation is on.
 * <p>
 * Notifications arriving while stopped are dropped. Stopping keeps what was recorded so far.
 * Not thread-safe; the host delivers notifications on the inspection thread.
 */
public final class MutationTracker implements InsertionListener {

    private static final Logger logger = LoggerFactory.getLogger(MutationTracker.class);

    private final CreationTimestamps timestamps;
    private boolean observing;

    public MutationTracker(CreationTimestamps timestamps) {
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps must not be null");
    }

    public void start() {
        observing = true;
    }

    public void stop() {
        observing = false;
    }

    public boolean isObserving() {
        return observing;
    }

    @Override
    public void onInsertion(TreeNode node, Instant insertedAt) {
        if (!observing || node == null || insertedAt == null) {
            return;
        }
        timestamps.record(node.nodeKey(), insertedAt);
        logger.trace("Recorded insertion of <{}> at {}", node.tagName(), insertedAt);
    }

    @Override
    public void onRemoval(TreeNode node) {
        if (node != null) {
            timestamps.forget(node.nodeKey());
        }
    }

    public Optional<Instant> insertedAt(TreeNode node) {
        if (node == null) {
            return Optional.empty();
        }
        return timestamps.insertedAt(node.nodeKey());
    }

    public void clear() {
        timestamps.clear();
    }
}
