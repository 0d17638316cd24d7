package io.hearthwarrio.pinpoint.core.dynamic;

import java.time.Instant;
import java.util.Optional;

/**
 * Association from a node key (see {@link io.hearthwarrio.pinpoint.core.tree.TreeNode#nodeKey()}) to the instant
 * the node was inserted into the document.
 * <p>
 * Written only by {@link MutationTracker}, read only by {@link DynamicInsertionDetector}.
 */
public interface CreationTimestamps {

    void record(Object nodeKey, Instant insertedAt);

    Optional<Instant> insertedAt(Object nodeKey);

    void forget(Object nodeKey);

    void clear();

    int size();
}
