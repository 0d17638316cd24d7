package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered table of {@link RoleRule}s; evaluated top to bottom, the first match wins.
 */
public final class RoleInferenceRules {

    public static final RoleInferenceRules DEFAULT = new RoleInferenceRules(List.of(
            RoleRule.of("button", "button"),
            RoleRule.of("button", "input").withTypes("button", "submit", "reset"),
            RoleRule.of("link", "a").requiring("href"),
            RoleRule.of("checkbox", "input").withTypes("checkbox"),
            RoleRule.of("radio", "input").withTypes("radio"),
            RoleRule.of("combobox", "select"),
            RoleRule.of("textbox", "input"),
            RoleRule.of("heading", "h1", "h2", "h3", "h4", "h5", "h6")
    ));

    private final List<RoleRule> rules;

    public RoleInferenceRules(List<RoleRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Role implied by tag and type alone.
     */
    public Optional<String> infer(TreeNode node) {
        for (RoleRule rule : rules) {
            if (rule.matches(node)) {
                return Optional.of(rule.getRole());
            }
        }
        return Optional.empty();
    }

    /**
     * Explicit {@code role} attribute when present, otherwise {@link #infer(TreeNode)}.
     */
    public Optional<String> roleOf(TreeNode node) {
        String explicit = node.attribute("role");
        if (!explicit.isBlank()) {
            return Optional.of(explicit);
        }
        return infer(node);
    }

    /**
     * Returns a table with {@code rule} evaluated before all existing rules.
     */
    public RoleInferenceRules withFirst(RoleRule rule) {
        List<RoleRule> out = new ArrayList<>(rules.size() + 1);
        out.add(Objects.requireNonNull(rule, "rule must not be null"));
        out.addAll(rules);
        return new RoleInferenceRules(out);
    }

    public List<RoleRule> getRules() {
        return rules;
    }
}
