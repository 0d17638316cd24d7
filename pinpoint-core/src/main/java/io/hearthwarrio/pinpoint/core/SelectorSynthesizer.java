package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Builds the shortest structural (CSS) selector that matches exactly one element: the target.
 * <p>
 * Resolution order, each candidate verified through the {@link UniquenessOracle}:
 * <ol>
 *   <li>{@code #id}</li>
 *   <li>each class token alone, then all tokens combined</li>
 *   <li>{@code tag[attr="value"]} for the {@link #ATTRIBUTE_ALLOW_LIST}</li>
 *   <li>an ancestry path of {@code tag:nth-of-type(k)} segments joined with {@code " > "},
 *       grown one ancestor at a time up to the configured depth</li>
 * </ol>
 * When the depth bound is hit first the longest path is returned and flagged as degraded.
 */
public final class SelectorSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(SelectorSynthesizer.class);

    /**
     * Attributes tried in order. {@code data-testid} is swapped for the configured test id attribute.
     */
    public static final List<String> ATTRIBUTE_ALLOW_LIST = Collections.unmodifiableList(Arrays.asList(
            "name",
            EngineSettings.DEFAULT_TEST_ID_ATTRIBUTE,
            "role",
            "type",
            "aria-label",
            "value",
            "placeholder"
    ));

    private static final String CHILD_COMBINATOR = " > ";

    private final UniquenessOracle oracle;
    private final EngineSettings settings;

    public SelectorSynthesizer(UniquenessOracle oracle, EngineSettings settings) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Never fails; see {@link #synthesize(TreeNode)} for the degraded flag.
     */
    public String synthesizeSelector(TreeNode node) {
        return synthesize(node).getSelector();
    }

    public SynthesizedSelector synthesize(TreeNode node) {
        Objects.requireNonNull(node, "node must not be null");

        String id = node.id();
        if (!id.isBlank()) {
            String candidate = "#" + LocatorLiterals.cssIdentifier(id);
            if (oracle.isUnique(candidate, node)) {
                return found(candidate, SelectorStrategy.ID);
            }
        }

        List<String> classes = node.classNames();
        for (String cls : classes) {
            String candidate = "." + LocatorLiterals.cssIdentifier(cls);
            if (oracle.isUnique(candidate, node)) {
                return found(candidate, SelectorStrategy.CLASS);
            }
        }
        if (classes.size() > 1) {
            String candidate = classCombination(classes);
            if (oracle.isUnique(candidate, node)) {
                return found(candidate, SelectorStrategy.CLASS_COMBINATION);
            }
        }

        String tag = node.tagName();
        for (String attr : ATTRIBUTE_ALLOW_LIST) {
            String attrName = EngineSettings.DEFAULT_TEST_ID_ATTRIBUTE.equals(attr)
                    ? settings.getTestIdAttribute()
                    : attr;
            String value = node.attribute(attrName);
            if (value.isBlank()) {
                continue;
            }
            String candidate = attributeSelector(tag, attrName, value);
            if (oracle.isUnique(candidate, node)) {
                return found(candidate, SelectorStrategy.ATTRIBUTE);
            }
        }

        return ancestryPath(node);
    }

    private SynthesizedSelector ancestryPath(TreeNode node) {
        Deque<String> segments = new ArrayDeque<>();
        String path = "";
        TreeNode current = node;

        while (current != null && segments.size() < settings.getMaxSelectorDepth()) {
            segments.addFirst(segment(current));
            path = String.join(CHILD_COMBINATOR, segments);
            if (oracle.isUnique(path, node)) {
                return found(path, SelectorStrategy.ANCESTRY_PATH);
            }
            current = current.parent();
        }

        logger.warn("No unique selector for <{}> within {} levels; using degraded selector '{}'",
                node.tagName(), settings.getMaxSelectorDepth(), path);
        return new SynthesizedSelector(path, SelectorStrategy.ANCESTRY_PATH, false);
    }

    /**
     * {@code tag} or {@code tag:nth-of-type(k)}; the position is kept when k &gt; 1 or the bare tag matches
     * other elements too.
     */
    String segment(TreeNode element) {
        String tag = element.tagName();
        int position = positionAmongSameTag(element);
        if (position > 1 || !oracle.isUnique(tag, element)) {
            return tag + ":nth-of-type(" + position + ")";
        }
        return tag;
    }

    static int positionAmongSameTag(TreeNode element) {
        String tag = element.tagName();
        int position = 1;
        TreeNode sibling = element.previousSibling();
        while (sibling != null) {
            if (tag.equals(sibling.tagName())) {
                position++;
            }
            sibling = sibling.previousSibling();
        }
        return position;
    }

    static String classCombination(List<String> classes) {
        StringBuilder sb = new StringBuilder();
        for (String cls : classes) {
            sb.append('.').append(LocatorLiterals.cssIdentifier(cls));
        }
        return sb.toString();
    }

    static String attributeSelector(String tag, String attribute, String value) {
        return tag + "[" + attribute + "=" + LocatorLiterals.cssAttributeValue(value) + "]";
    }

    private SynthesizedSelector found(String selector, SelectorStrategy strategy) {
        logger.debug("Selector '{}' chosen via {}", selector, strategy);
        return new SynthesizedSelector(selector, strategy, true);
    }
}
