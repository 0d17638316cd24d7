package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Looks around an element for something more stable to hang a locator on.
 * <ul>
 *   <li>Ancestor probe: the closest of the first few ancestors that is a landmark
 *       ({@code form}, {@code main}, {@code section}, {@code article}, {@code tr}) or carries a test id or
 *       an {@code aria-label}.</li>
 *   <li>Label probe: for form controls, a {@code label} that immediately precedes the control.</li>
 * </ul>
 * Finding nothing is normal and yields {@link SemanticContext#NONE}.
 */
public final class SemanticContextResolver {

    private static final Logger logger = LoggerFactory.getLogger(SemanticContextResolver.class);

    static final Set<String> LANDMARK_TAGS = Set.of("form", "main", "section", "article", "tr");
    static final Set<String> LABELLED_CONTROL_TAGS = Set.of("input", "select", "textarea");

    private final EngineSettings settings;

    public SemanticContextResolver(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public SemanticContext resolveContext(TreeNode node) {
        Objects.requireNonNull(node, "node must not be null");

        String ancestor = ancestorQualifier(node);
        String labelText = precedingLabelText(node);
        String label = labelText.isEmpty() ? "" : "getByLabel(" + LocatorLiterals.singleQuoted(labelText) + ")";

        if (ancestor.isEmpty() && label.isEmpty()) {
            return SemanticContext.NONE;
        }
        SemanticContext context = new SemanticContext(ancestor, label, labelText);
        logger.debug("Semantic context for <{}>: {}", node.tagName(), context);
        return context;
    }

    private String ancestorQualifier(TreeNode node) {
        String testIdAttribute = settings.getTestIdAttribute();
        for (TreeNode ancestor : node.ancestors(settings.getAncestorProbeDepth())) {
            String testId = ancestor.attribute(testIdAttribute);
            String ariaLabel = ancestor.attribute("aria-label");
            boolean landmark = LANDMARK_TAGS.contains(ancestor.tagName());

            if (!testId.isBlank()) {
                return "getByTestId(" + LocatorLiterals.singleQuoted(testId) + ")";
            }
            if (!ariaLabel.isBlank()) {
                return "getByRole('region', { name: " + LocatorLiterals.singleQuoted(ariaLabel) + " })";
            }
            if (landmark) {
                return "locator(" + LocatorLiterals.singleQuoted(ancestor.tagName()) + ")";
            }
        }
        return "";
    }

    private String precedingLabelText(TreeNode node) {
        if (!LABELLED_CONTROL_TAGS.contains(node.tagName())) {
            return "";
        }
        TreeNode previous = node.previousSibling();
        if (previous == null || !"label".equals(previous.tagName())) {
            return "";
        }
        return ElementTexts.normalizeWhitespace(previous.visibleText());
    }
}
