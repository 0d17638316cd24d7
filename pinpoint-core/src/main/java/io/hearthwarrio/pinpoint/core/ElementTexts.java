package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

/**
 * Text extraction shared by the locator grammars and record descriptions.
 */
public final class ElementTexts {

    private ElementTexts() {
        // utility class
    }

    /**
     * First non-blank line of {@code text}, trimmed and cut to {@code limit} characters.
     */
    public static String firstLine(String text, int limit) {
        if (text == null || text.isBlank()) {
            return "";
        }
        for (String line : text.split("\\R")) {
            String t = line.trim();
            if (!t.isEmpty()) {
                return truncate(t, limit);
            }
        }
        return "";
    }

    public static String truncate(String text, int limit) {
        if (text == null) {
            return "";
        }
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * {@code aria-label}, then {@code title}, then {@code alt}, then the first line of visible text.
     */
    public static String accessibleName(TreeNode node, int limit) {
        String ariaLabel = node.attribute("aria-label");
        if (!ariaLabel.isBlank()) {
            return ariaLabel;
        }
        String title = node.attribute("title");
        if (!title.isBlank()) {
            return title;
        }
        String alt = node.attribute("alt");
        if (!alt.isBlank()) {
            return alt;
        }
        return firstLine(node.visibleText(), limit);
    }
}
