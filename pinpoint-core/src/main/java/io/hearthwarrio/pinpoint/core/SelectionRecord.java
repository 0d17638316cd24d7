package io.hearthwarrio.pinpoint.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything produced for one selected element. Immutable; the engine keeps no reference to it.
 */
public final class SelectionRecord {

    private final String structuralSelector;
    private final boolean selectorUnique;
    private final String pathLocator;
    private final String displayName;
    private final String htmlSnapshot;
    private final Map<String, String> attributes;
    private final boolean dynamic;
    private final String playwrightLocator;
    private final String seleniumLocator;
    private final List<Candidate> candidates;

    public SelectionRecord(
            String structuralSelector,
            boolean selectorUnique,
            String pathLocator,
            String displayName,
            String htmlSnapshot,
            Map<String, String> attributes,
            boolean dynamic,
            String playwrightLocator,
            String seleniumLocator,
            List<Candidate> candidates
    ) {
        this.structuralSelector = Objects.requireNonNull(structuralSelector, "structuralSelector must not be null");
        this.selectorUnique = selectorUnique;
        this.pathLocator = normalizeNull(pathLocator);
        this.displayName = normalizeNull(displayName);
        this.htmlSnapshot = normalizeNull(htmlSnapshot);
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.dynamic = dynamic;
        this.playwrightLocator = normalizeNull(playwrightLocator);
        this.seleniumLocator = normalizeNull(seleniumLocator);
        this.candidates = candidates == null ? Collections.emptyList() : List.copyOf(candidates);
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    public String getStructuralSelector() {
        return structuralSelector;
    }

    /**
     * False when the selector is a degraded best effort that may match more than the element.
     */
    public boolean isSelectorUnique() {
        return selectorUnique;
    }

    public String getPathLocator() {
        return pathLocator;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getHtmlSnapshot() {
        return htmlSnapshot;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public boolean isDynamic() {
        return dynamic;
    }

    public String getPlaywrightLocator() {
        return playwrightLocator;
    }

    public String getSeleniumLocator() {
        return seleniumLocator;
    }

    /**
     * All strategies for the element, best first.
     */
    public List<Candidate> getCandidates() {
        return candidates;
    }

    @Override
    public String toString() {
        return "SelectionRecord{" +
                "selector='" + structuralSelector + '\'' +
                ", unique=" + selectorUnique +
                ", xpath='" + pathLocator + '\'' +
                ", name='" + displayName + '\'' +
                ", dynamic=" + dynamic +
                '}';
    }
}
