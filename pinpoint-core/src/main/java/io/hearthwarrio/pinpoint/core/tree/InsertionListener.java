package io.hearthwarrio.pinpoint.core.tree;

import java.time.Instant;

/**
 * Receives subtree change notifications from the host.
 */
public interface InsertionListener {

    /**
     * Called for every element added to the document, descendants of an added subtree included.
     */
    void onInsertion(TreeNode node, Instant insertedAt);

    /**
     * Called when the host knows an element is gone for good.
     */
    default void onRemoval(TreeNode node) {
    }
}
