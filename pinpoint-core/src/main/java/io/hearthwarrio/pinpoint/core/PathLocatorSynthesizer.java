package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Builds an absolute XPath for an element.
 * <p>
 * An element with an id gets {@code //*[@id='...']}; anything else gets a root-to-node path where each step
 * carries {@code [k]} only when same-tag siblings precede it.
 */
public final class PathLocatorSynthesizer {

    public String synthesizePath(TreeNode node) {
        Objects.requireNonNull(node, "node must not be null");

        String id = node.id();
        if (!id.isBlank()) {
            return "//*[@id=" + LocatorLiterals.xpath(id) + "]";
        }

        Deque<String> steps = new ArrayDeque<>();
        TreeNode current = node;
        while (current != null) {
            int preceding = SelectorSynthesizer.positionAmongSameTag(current) - 1;
            String step = preceding > 0
                    ? current.tagName() + "[" + (preceding + 1) + "]"
                    : current.tagName();
            steps.addFirst(step);
            current = current.parent();
        }
        return "/" + String.join("/", steps);
    }
}
