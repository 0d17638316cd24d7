package io.hearthwarrio.pinpoint.core.dynamic;

import io.hearthwarrio.pinpoint.core.ResilienceScorer;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether an element should be treated as dynamic.
 * <p>
 * An element is dynamic when it was inserted less than {@code window} ago, or when its id or class
 * carries a run of four or more digits (the usual shape of framework-generated identifiers).
 */
public final class DynamicInsertionDetector {

    private final MutationTracker tracker;
    private final Clock clock;
    private final Duration window;

    public DynamicInsertionDetector(MutationTracker tracker, Clock clock, Duration window) {
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
    }

    public boolean isDynamic(TreeNode node) {
        if (node == null) {
            return false;
        }
        return isRecentlyInserted(node)
                || ResilienceScorer.looksGenerated(node.id())
                || ResilienceScorer.looksGenerated(node.attribute("class"));
    }

    public boolean isRecentlyInserted(TreeNode node) {
        Optional<Instant> insertedAt = tracker.insertedAt(node);
        if (insertedAt.isEmpty()) {
            return false;
        }
        Duration age = Duration.between(insertedAt.get(), clock.instant());
        return age.compareTo(window) < 0;
    }
}
