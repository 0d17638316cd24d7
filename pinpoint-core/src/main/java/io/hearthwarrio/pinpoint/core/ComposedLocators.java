package io.hearthwarrio.pinpoint.core;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The two locator strings of one element, with the candidates each was built from.
 */
public final class ComposedLocators {

    private final String playwrightLocator;
    private final String seleniumLocator;
    private final List<Candidate> playwrightCandidates;
    private final List<Candidate> seleniumCandidates;

    public ComposedLocators(
            String playwrightLocator,
            String seleniumLocator,
            List<Candidate> playwrightCandidates,
            List<Candidate> seleniumCandidates
    ) {
        this.playwrightLocator = Objects.requireNonNull(playwrightLocator, "playwrightLocator must not be null");
        this.seleniumLocator = Objects.requireNonNull(seleniumLocator, "seleniumLocator must not be null");
        this.playwrightCandidates = Collections.unmodifiableList(playwrightCandidates);
        this.seleniumCandidates = Collections.unmodifiableList(seleniumCandidates);
    }

    public String getPlaywrightLocator() {
        return playwrightLocator;
    }

    public String getSeleniumLocator() {
        return seleniumLocator;
    }

    /**
     * Ranked (best first), duplicates removed.
     */
    public List<Candidate> getPlaywrightCandidates() {
        return playwrightCandidates;
    }

    public List<Candidate> getSeleniumCandidates() {
        return seleniumCandidates;
    }
}
