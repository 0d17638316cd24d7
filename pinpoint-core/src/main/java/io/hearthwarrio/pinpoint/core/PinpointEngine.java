package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.dynamic.DynamicInsertionDetector;
import io.hearthwarrio.pinpoint.core.tree.DocumentTree;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.List;
import java.util.Objects;

/**
 * Locator synthesis and resilience scoring over one {@link DocumentTree}.
 * <p>
 * Wires the synthesizers, the scorer, the context resolver and both grammars together. Every operation is a
 * best effort and returns a value for any element, however exotic.
 * <p>
 * This class is not thread-safe and is expected to be used from a single inspection thread.
 */
public final class PinpointEngine {

    private final EngineSettings settings;
    private final DynamicInsertionDetector detector;
    private final SelectorSynthesizer selectorSynthesizer;
    private final PathLocatorSynthesizer pathSynthesizer;
    private final SemanticContextResolver contextResolver;
    private final ResilienceScorer scorer;
    private final LocatorComposer composer;
    private final CandidateCollector collector;

    public PinpointEngine(DocumentTree tree, DynamicInsertionDetector detector, EngineSettings settings) {
        this(tree, detector, settings, new DefaultResilienceScorer(), RoleInferenceRules.DEFAULT);
    }

    public PinpointEngine(
            DocumentTree tree,
            DynamicInsertionDetector detector,
            EngineSettings settings,
            ResilienceScorer scorer,
            RoleInferenceRules roles
    ) {
        Objects.requireNonNull(tree, "tree must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        Objects.requireNonNull(roles, "roles must not be null");

        UniquenessOracle oracle = new UniquenessOracle(tree);
        PlaywrightGrammar playwright = new PlaywrightGrammar(scorer, roles, settings);

        this.selectorSynthesizer = new SelectorSynthesizer(oracle, settings);
        this.pathSynthesizer = new PathLocatorSynthesizer();
        this.contextResolver = new SemanticContextResolver(settings);
        this.composer = new LocatorComposer(selectorSynthesizer, playwright, new SeleniumGrammar(scorer, oracle, settings));
        this.collector = new CandidateCollector(scorer, playwright);
    }

    public SynthesizedSelector synthesizeSelector(TreeNode node) {
        return selectorSynthesizer.synthesize(node);
    }

    public String synthesizePath(TreeNode node) {
        return pathSynthesizer.synthesizePath(node);
    }

    public int score(StrategyKind kind, String value) {
        return scorer.score(kind, value);
    }

    public SemanticContext resolveContext(TreeNode node) {
        return contextResolver.resolveContext(node);
    }

    public boolean isDynamic(TreeNode node) {
        return detector.isDynamic(node);
    }

    public ComposedLocators compose(TreeNode node, SemanticContext context, boolean dynamic) {
        return composer.compose(node, context, dynamic);
    }

    public SelectionRecord describe(TreeNode node) {
        return describe(node, selectorSynthesizer.synthesize(node));
    }

    /**
     * Builds the full record, reusing an already synthesized selector.
     */
    public SelectionRecord describe(TreeNode node, SynthesizedSelector selector) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(selector, "selector must not be null");

        boolean dynamic = detector.isDynamic(node);
        String path = pathSynthesizer.synthesizePath(node);
        SemanticContext context = contextResolver.resolveContext(node);
        ComposedLocators locators = composer.compose(node, context, dynamic, selector);
        List<Candidate> candidates = collector.collect(node, context, selector.getSelector(), path);

        return new SelectionRecord(
                selector.getSelector(),
                selector.isUnique(),
                path,
                ElementDescriptions.displayName(node, settings),
                node.outerHtml(),
                ElementDescriptions.attributes(node, settings),
                dynamic,
                locators.getPlaywrightLocator(),
                locators.getSeleniumLocator(),
                candidates
        );
    }

    public EngineSettings getSettings() {
        return settings;
    }
}
