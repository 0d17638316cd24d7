package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the role inference table: (tag, type attribute, required attribute) to role.
 * <p>
 * An empty type set matches any type. An {@code input} without a type attribute has type {@code text}.
 */
public final class RoleRule {

    private final Set<String> tags;
    private final Set<String> types;
    private final String requiredAttribute;
    private final String role;

    private RoleRule(Set<String> tags, Set<String> types, String requiredAttribute, String role) {
        this.tags = tags;
        this.types = types;
        this.requiredAttribute = requiredAttribute;
        this.role = role;
    }

    public static RoleRule of(String role, String... tags) {
        Objects.requireNonNull(role, "role must not be null");
        if (tags.length == 0) {
            throw new IllegalArgumentException("at least one tag is required");
        }
        return new RoleRule(lowerSet(tags), Collections.emptySet(), "", role);
    }

    public RoleRule withTypes(String... types) {
        return new RoleRule(tags, lowerSet(types), requiredAttribute, role);
    }

    public RoleRule requiring(String attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return new RoleRule(tags, types, attribute, role);
    }

    public boolean matches(TreeNode node) {
        if (!tags.contains(node.tagName())) {
            return false;
        }
        if (!types.isEmpty() && !types.contains(typeOf(node))) {
            return false;
        }
        return requiredAttribute.isEmpty() || node.hasAttribute(requiredAttribute);
    }

    public String getRole() {
        return role;
    }

    private static String typeOf(TreeNode node) {
        String type = node.attribute("type").toLowerCase(Locale.ROOT);
        if (type.isEmpty() && "input".equals(node.tagName())) {
            return "text";
        }
        return type;
    }

    private static Set<String> lowerSet(String... values) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : Arrays.asList(values)) {
            out.add(v.toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public String toString() {
        return "RoleRule{" + tags + (types.isEmpty() ? "" : " type" + types)
                + (requiredAttribute.isEmpty() ? "" : " [" + requiredAttribute + "]")
                + " -> " + role + '}';
    }
}
