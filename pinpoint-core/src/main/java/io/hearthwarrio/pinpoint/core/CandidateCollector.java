package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists every strategy that can locate an element, ranked by resilience.
 * <p>
 * Semantic strategies are given in semantic-query syntax, structural ones as raw CSS or XPath.
 * Strategies are kept even when two of them spell the same selector ({@code #id} as id and as css).
 */
public final class CandidateCollector {

    private final ResilienceScorer scorer;
    private final PlaywrightGrammar playwright;

    public CandidateCollector(ResilienceScorer scorer, PlaywrightGrammar playwright) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.playwright = Objects.requireNonNull(playwright, "playwright must not be null");
    }

    public List<Candidate> collect(TreeNode node, SemanticContext context, String structuralSelector, String path) {
        List<Candidate> out = new ArrayList<>();

        for (Candidate c : playwright.candidates(node, context, structuralSelector)) {
            if (c.getKind() != StrategyKind.CSS) {
                out.add(c);
            }
        }

        String id = node.id();
        if (!id.isBlank()) {
            out.add(candidate(StrategyKind.ID, id, "#" + LocatorLiterals.cssIdentifier(id)));
        }
        String name = node.attribute("name");
        if (!name.isBlank()) {
            out.add(candidate(StrategyKind.NAME, name,
                    SelectorSynthesizer.attributeSelector(node.tagName(), "name", name)));
        }
        List<String> classes = node.classNames();
        if (!classes.isEmpty()) {
            out.add(candidate(StrategyKind.CLASS, String.join(" ", classes),
                    SelectorSynthesizer.classCombination(classes)));
        }
        out.add(candidate(StrategyKind.CSS, structuralSelector, structuralSelector));
        out.add(candidate(StrategyKind.XPATH, path, path));

        out.sort(Candidate.BY_SCORE_DESCENDING);
        return out;
    }

    private Candidate candidate(StrategyKind kind, String scoredValue, String text) {
        return new Candidate(kind, text, scorer.score(kind, scoredValue));
    }
}
