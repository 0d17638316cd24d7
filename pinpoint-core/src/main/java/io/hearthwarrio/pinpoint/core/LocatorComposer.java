package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.List;
import java.util.Objects;

/**
 * Composes both locator grammars for an element.
 */
public final class LocatorComposer {

    private final SelectorSynthesizer selectorSynthesizer;
    private final PlaywrightGrammar playwright;
    private final SeleniumGrammar selenium;

    public LocatorComposer(SelectorSynthesizer selectorSynthesizer, PlaywrightGrammar playwright, SeleniumGrammar selenium) {
        this.selectorSynthesizer = Objects.requireNonNull(selectorSynthesizer, "selectorSynthesizer must not be null");
        this.playwright = Objects.requireNonNull(playwright, "playwright must not be null");
        this.selenium = Objects.requireNonNull(selenium, "selenium must not be null");
    }

    public ComposedLocators compose(TreeNode node, SemanticContext context, boolean dynamic) {
        return compose(node, context, dynamic, selectorSynthesizer.synthesize(node));
    }

    public ComposedLocators compose(TreeNode node, SemanticContext context, boolean dynamic, SynthesizedSelector selector) {
        Objects.requireNonNull(node, "node must not be null");
        SemanticContext ctx = context == null ? SemanticContext.NONE : context;
        String css = selector.getSelector();

        List<Candidate> a = playwright.candidates(node, ctx, css);
        List<Candidate> b = selenium.candidates(node, css);

        return new ComposedLocators(
                playwright.render(a, css, dynamic),
                selenium.render(b, dynamic),
                Candidate.rank(a),
                Candidate.rank(b)
        );
    }
}
