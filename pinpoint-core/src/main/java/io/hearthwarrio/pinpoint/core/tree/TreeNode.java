package io.hearthwarrio.pinpoint.core.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Read-only handle to an element of the inspected document.
 * <p>
 * Adapters wrap a host element (a parsed HTML element, a live browser element, ...) and expose only what
 * locator synthesis needs. Two handles denote the same element iff {@link #equals(Object)} says so, so adapters
 * must implement identity of the underlying host element rather than of the wrapper.
 * <p>
 * Attribute reads never fail: a missing attribute is an empty string.
 */
public interface TreeNode {

    /**
     * Lower-case tag name, for example {@code input}.
     */
    String tagName();

    /**
     * Attribute value, trimmed; empty string when absent or unreadable.
     */
    String attribute(String name);

    boolean hasAttribute(String name);

    /**
     * Parent element, or {@code null} for the document root element.
     */
    TreeNode parent();

    /**
     * Preceding element sibling, or {@code null}.
     */
    TreeNode previousSibling();

    /**
     * Following element sibling, or {@code null}.
     */
    TreeNode nextSibling();

    /**
     * Number of element children (text nodes are not counted).
     */
    int childCount();

    /**
     * Rendered text of the element, possibly spanning several lines. Empty when there is none.
     */
    String visibleText();

    /**
     * Serialized markup of the element including itself.
     */
    String outerHtml();

    /**
     * Stable key of the underlying host element, used to associate state (insertion time) with the element.
     */
    Object nodeKey();

    default String id() {
        return attribute("id");
    }

    default List<String> classNames() {
        String raw = attribute("class");
        if (raw.isBlank()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(raw.trim().split("\\s+")));
    }

    /**
     * Ancestors from the closest outwards, at most {@code depth} of them.
     */
    default List<TreeNode> ancestors(int depth) {
        List<TreeNode> out = new ArrayList<>();
        TreeNode current = parent();
        while (current != null && out.size() < depth) {
            out.add(current);
            current = current.parent();
        }
        return out;
    }
}
