package io.hearthwarrio.pinpoint.core.tree;

import io.hearthwarrio.pinpoint.core.dynamic.BoundedCreationTimestamps;
import io.hearthwarrio.pinpoint.core.dynamic.CreationTimestamps;

import java.util.List;

/**
 * The inspected document as seen by the engine.
 */
public interface DocumentTree {

    /**
     * All elements matching a CSS selector, in document order.
     *
     * @throws MalformedSelectorException when the selector cannot be parsed by the host
     */
    List<TreeNode> querySelectorAll(String selector);

    /**
     * Identity of the document. One inspection session exists per key.
     */
    Object documentKey();

    /**
     * Registers a receiver of insertion and removal notifications.
     */
    void addInsertionListener(InsertionListener listener);

    void removeInsertionListener(InsertionListener listener);

    /**
     * Creates the insertion-time store suited to this host's node keys.
     * <p>
     * Default is a bounded, insertion-ordered store: safe for hosts whose node keys are detached identifiers
     * that never become unreachable on their own.
     */
    default CreationTimestamps newTimestampStore(int capacity) {
        return new BoundedCreationTimestamps(capacity);
    }
}
