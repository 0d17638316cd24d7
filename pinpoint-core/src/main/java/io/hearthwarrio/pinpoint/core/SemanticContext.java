package io.hearthwarrio.pinpoint.core;

/**
 * Qualifiers that anchor a semantic-query locator: an enclosing landmark and/or an associated label.
 * Both are already in semantic-query syntax, for example {@code getByTestId('login-form')}.
 * Empty strings mean "not found".
 */
public final class SemanticContext {

    public static final SemanticContext NONE = new SemanticContext("", "", "");

    private final String ancestorQualifier;
    private final String labelQualifier;
    private final String labelText;

    public SemanticContext(String ancestorQualifier, String labelQualifier, String labelText) {
        this.ancestorQualifier = ancestorQualifier == null ? "" : ancestorQualifier;
        this.labelQualifier = labelQualifier == null ? "" : labelQualifier;
        this.labelText = labelText == null ? "" : labelText;
    }

    public String getAncestorQualifier() {
        return ancestorQualifier;
    }

    public String getLabelQualifier() {
        return labelQualifier;
    }

    public String getLabelText() {
        return labelText;
    }

    public boolean hasAncestor() {
        return !ancestorQualifier.isEmpty();
    }

    public boolean hasLabel() {
        return !labelQualifier.isEmpty();
    }

    public boolean isEmpty() {
        return !hasAncestor() && !hasLabel();
    }

    /**
     * The label qualifier when there is one, otherwise the ancestor qualifier.
     */
    public String primaryQualifier() {
        return hasLabel() ? labelQualifier : ancestorQualifier;
    }

    /**
     * Prefix for candidates scoped by the landmark: {@code "getByTestId('x')."} or empty.
     */
    public String scopePrefix() {
        return hasAncestor() ? ancestorQualifier + "." : "";
    }

    @Override
    public String toString() {
        return "SemanticContext{" +
                "ancestor='" + ancestorQualifier + '\'' +
                ", label='" + labelQualifier + '\'' +
                '}';
    }
}
