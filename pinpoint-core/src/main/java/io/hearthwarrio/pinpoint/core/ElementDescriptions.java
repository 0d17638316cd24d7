package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-facing description of an element: display name and a fixed set of attributes.
 */
public final class ElementDescriptions {

    /**
     * Attributes copied into a record, in this order, when present. {@code data-testid} stands for the configured
     * test id attribute.
     */
    public static final List<String> RECORDED_ATTRIBUTES = Collections.unmodifiableList(Arrays.asList(
            "id", "class", "name", EngineSettings.DEFAULT_TEST_ID_ATTRIBUTE, "aria-label", "role",
            "type", "value", "placeholder", "alt", "src", "href"
    ));

    private ElementDescriptions() {
        // utility class
    }

    /**
     * {@code name}, {@code aria-label}, test id, visible text (ellipsized), {@code title}, then tag name.
     */
    public static String displayName(TreeNode node, EngineSettings settings) {
        String name = node.attribute("name");
        if (!name.isBlank()) {
            return name;
        }
        String ariaLabel = node.attribute("aria-label");
        if (!ariaLabel.isBlank()) {
            return ariaLabel;
        }
        String testId = node.attribute(settings.getTestIdAttribute());
        if (!testId.isBlank()) {
            return testId;
        }
        String text = ElementTexts.normalizeWhitespace(node.visibleText());
        if (!text.isEmpty()) {
            int limit = settings.getTextLimit();
            return text.length() > limit ? text.substring(0, limit) + "..." : text;
        }
        String title = node.attribute("title");
        if (!title.isBlank()) {
            return title;
        }
        return node.tagName();
    }

    public static Map<String, String> attributes(TreeNode node, EngineSettings settings) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String attr : RECORDED_ATTRIBUTES) {
            String name = EngineSettings.DEFAULT_TEST_ID_ATTRIBUTE.equals(attr) ? settings.getTestIdAttribute() : attr;
            String value = node.attribute(name);
            if (!value.isEmpty()) {
                out.put(name, value);
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
