package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Semantic-query locator grammar (Playwright style): {@code page.getByTestId('x').or(page.getByRole(...))}.
 * <p>
 * Candidates, in discovery order: test id, associated label (or else placeholder), role with accessible
 * name, leaf text, structural selector. Each is scoped by the landmark qualifier when there is one.
 */
public final class PlaywrightGrammar {

    static final String DYNAMIC_MARKER = "// DYNAMIC ELEMENT WAITER";

    private final ResilienceScorer scorer;
    private final RoleInferenceRules roles;
    private final EngineSettings settings;

    public PlaywrightGrammar(ResilienceScorer scorer, RoleInferenceRules roles, EngineSettings settings) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.roles = Objects.requireNonNull(roles, "roles must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public List<Candidate> candidates(TreeNode node, SemanticContext context, String structuralSelector) {
        String prefix = context.scopePrefix();
        int limit = settings.getTextLimit();
        List<Candidate> out = new ArrayList<>(5);

        String testId = node.attribute(settings.getTestIdAttribute());
        if (!testId.isBlank()) {
            out.add(candidate(StrategyKind.TESTID, testId,
                    prefix + "getByTestId(" + LocatorLiterals.singleQuoted(testId) + ")"));
        }

        String placeholder = node.attribute("placeholder");
        if (context.hasLabel()) {
            out.add(candidate(StrategyKind.LABEL, context.getLabelText(), prefix + context.getLabelQualifier()));
        } else if (!placeholder.isBlank()) {
            out.add(candidate(StrategyKind.PLACEHOLDER, placeholder,
                    prefix + "getByPlaceholder(" + LocatorLiterals.singleQuoted(placeholder) + ")"));
        }

        Optional<String> role = roles.roleOf(node);
        if (role.isPresent()) {
            String name = ElementTexts.accessibleName(node, limit);
            if (!name.isBlank()) {
                out.add(candidate(StrategyKind.ROLE, role.get(),
                        prefix + "getByRole(" + LocatorLiterals.singleQuoted(role.get())
                                + ", { name: " + LocatorLiterals.singleQuoted(name) + " })"));
            }
        }

        if (node.childCount() == 0) {
            String text = ElementTexts.firstLine(node.visibleText(), limit);
            if (!text.isBlank()) {
                out.add(candidate(StrategyKind.TEXT, text,
                        prefix + "getByText(" + LocatorLiterals.singleQuoted(text) + ")"));
            }
        }

        out.add(candidate(StrategyKind.CSS, structuralSelector,
                prefix + "locator(" + LocatorLiterals.singleQuoted(structuralSelector) + ")"));
        return out;
    }

    /**
     * Joins the best distinct candidates into one alternation chain, behind a visibility wait when dynamic.
     */
    public String render(List<Candidate> candidates, String structuralSelector, boolean dynamic) {
        List<Candidate> ranked = Candidate.rank(candidates);
        int n = Math.min(settings.getSemanticChainLength(), ranked.size());

        StringBuilder chain = new StringBuilder("page.");
        for (int i = 0; i < n; i++) {
            String text = ranked.get(i).getText();
            if (i == 0) {
                chain.append(text);
            } else {
                chain.append(".or(page.").append(text).append(')');
            }
        }

        if (!dynamic) {
            return chain.toString();
        }
        return DYNAMIC_MARKER + "\n"
                + "await page.waitForSelector(" + LocatorLiterals.singleQuoted(structuralSelector)
                + ", { state: 'visible', timeout: " + settings.getWaitTimeout().toMillis() + " });\n"
                + "await " + chain;
    }

    private Candidate candidate(StrategyKind kind, String scoredValue, String text) {
        return new Candidate(kind, text, scorer.score(kind, scoredValue));
    }
}
