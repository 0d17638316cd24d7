package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.DocumentTree;
import io.hearthwarrio.pinpoint.core.tree.MalformedSelectorException;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Answers "does this selector match exactly the target and nothing else".
 * <p>
 * Host failures never escape: a malformed selector or a driver quirk is a plain "no".
 */
public final class UniquenessOracle {

    private static final Logger logger = LoggerFactory.getLogger(UniquenessOracle.class);

    private final DocumentTree tree;

    public UniquenessOracle(DocumentTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
    }

    public boolean isUnique(String selector, TreeNode target) {
        if (selector == null || selector.isBlank() || target == null) {
            return false;
        }
        try {
            List<TreeNode> matches = tree.querySelectorAll(selector);
            boolean unique = matches.size() == 1 && target.equals(matches.get(0));
            logger.debug("Uniqueness check '{}': {} match(es), unique={}", selector, matches.size(), unique);
            return unique;
        } catch (MalformedSelectorException e) {
            logger.debug("Selector '{}' rejected by host: {}", selector, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            // driver quirks: treat as non-unique
            logger.debug("Uniqueness check '{}' failed: {}", selector, e.toString());
            return false;
        }
    }

    public DocumentTree tree() {
        return tree;
    }
}
