package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Explicit-selector locator grammar (Selenium {@code By} style).
 * <p>
 * Candidates: {@code By.id} and {@code By.name} when independently verified unique, {@code By.cssSelector}
 * always. The best two become a primary lookup with a {@code NoSuchElementException} fallback.
 */
public final class SeleniumGrammar {

    private final ResilienceScorer scorer;
    private final UniquenessOracle oracle;
    private final EngineSettings settings;

    public SeleniumGrammar(ResilienceScorer scorer, UniquenessOracle oracle, EngineSettings settings) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public List<Candidate> candidates(TreeNode node, String structuralSelector) {
        List<Candidate> out = new ArrayList<>(3);

        String id = node.id();
        if (!id.isBlank() && oracle.isUnique("#" + LocatorLiterals.cssIdentifier(id), node)) {
            out.add(new Candidate(StrategyKind.ID, "By.id(" + LocatorLiterals.javaString(id) + ")",
                    scorer.score(StrategyKind.ID, id)));
        }

        String name = node.attribute("name");
        if (!name.isBlank()
                && oracle.isUnique(SelectorSynthesizer.attributeSelector(node.tagName(), "name", name), node)) {
            out.add(new Candidate(StrategyKind.NAME, "By.name(" + LocatorLiterals.javaString(name) + ")",
                    scorer.score(StrategyKind.NAME, name)));
        }

        out.add(new Candidate(StrategyKind.CSS,
                "By.cssSelector(" + LocatorLiterals.javaString(structuralSelector) + ")",
                scorer.score(StrategyKind.CSS, structuralSelector)));
        return out;
    }

    public String render(List<Candidate> candidates, boolean dynamic) {
        List<Candidate> ranked = Candidate.rank(candidates);
        int n = Math.min(settings.getSeleniumChainLength(), ranked.size());
        if (n == 0) {
            return "";
        }
        String primary = ranked.get(0).getText();

        StringBuilder sb = new StringBuilder(256);
        if (dynamic) {
            sb.append("WebDriverWait wait = new WebDriverWait(driver, Duration.ofMillis(")
                    .append(settings.getWaitTimeout().toMillis()).append("));\n")
                    .append("wait.until(ExpectedConditions.visibilityOfElementLocated(")
                    .append(primary).append("));\n");
        }

        if (n == 1) {
            sb.append("WebElement element = driver.findElement(").append(primary).append(");");
            return sb.toString();
        }

        sb.append("WebElement element;\n");
        appendAttempt(sb, ranked, 0, n, "");
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }

    private void appendAttempt(StringBuilder sb, List<Candidate> ranked, int index, int count, String indent) {
        String lookup = "element = driver.findElement(" + ranked.get(index).getText() + ");\n";
        if (index == count - 1) {
            sb.append(indent).append(lookup);
            return;
        }
        String exception = index == 0 ? "e" : "e" + (index + 1);
        sb.append(indent).append("try {\n")
                .append(indent).append("    ").append(lookup)
                .append(indent).append("} catch (NoSuchElementException ").append(exception).append(") {\n");
        appendAttempt(sb, ranked, index + 1, count, indent + "    ");
        sb.append(indent).append("}\n");
    }
}
