package io.hearthwarrio.pinpoint.webdriver;

import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.session.InspectionSession;
import io.hearthwarrio.pinpoint.core.session.InspectionSessions;
import io.hearthwarrio.pinpoint.core.session.RecordLogDetail;
import io.hearthwarrio.pinpoint.core.session.SelectionListener;
import io.hearthwarrio.pinpoint.core.session.SelectionRecordLogger;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-and-click inspection of the page loaded in a {@link WebDriver}.
 * <p>
 * While inspecting, clicks in the page are swallowed and queued by an injected capture handler. {@link #poll()}
 * turns queued clicks into selections of the underlying {@link InspectionSession}; a second click on the same
 * element deselects it.
 * <p>
 * The in-page state does not survive navigation. {@link #start()} may be called again after a page change;
 * it reinstalls whatever is missing.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public final class WebDriverInspector {

    private static final Logger logger = LoggerFactory.getLogger(WebDriverInspector.class);

    static final String CAPTURE_SCRIPT =
            "if (!window.__pinpointClickCaptureInstalled) {" +
                    "  window.__pinpointClickCaptureInstalled = true;" +
                    "  window.__pinpointClicks = [];" +
                    "  document.addEventListener('click', function (e) {" +
                    "    if (!window.__pinpointInspecting) { return; }" +
                    "    e.preventDefault();" +
                    "    e.stopPropagation();" +
                    "    window.__pinpointClicks.push(e.target);" +
                    "  }, true);" +
                    "}" +
                    "window.__pinpointInspecting = true;";

    static final String PAUSE_SCRIPT = "window.__pinpointInspecting = false;";

    static final String TAKE_CLICKS_SCRIPT =
            "var q = window.__pinpointClicks || [];" +
                    "window.__pinpointClicks = [];" +
                    "return q;";

    private final WebDriverDocumentTree tree;
    private final InspectionSession session;
    private final WebDriverMutationFeed feed;

    public WebDriverInspector(WebDriver driver) {
        this(driver, new InspectionSessions());
    }

    public WebDriverInspector(WebDriver driver, InspectionSessions sessions) {
        this.tree = new WebDriverDocumentTree(driver);
        this.session = Objects.requireNonNull(sessions, "sessions must not be null").open(tree);
        this.feed = new WebDriverMutationFeed(tree);
    }

    // ----------- configuration -----------

    public WebDriverInspector withRecordLogger(SelectionRecordLogger logger) {
        session.withRecordLogger(logger);
        return this;
    }

    public WebDriverInspector withLoggingToStdOut(RecordLogDetail detail) {
        session.withLoggingToStdOut(detail);
        return this;
    }

    public WebDriverInspector withListener(SelectionListener listener) {
        session.withListener(listener);
        return this;
    }

    // ----------- state -----------

    public WebDriverInspector start() {
        session.start();
        feed.install();
        tree.js().executeScript(CAPTURE_SCRIPT);
        return this;
    }

    /**
     * Stops capturing clicks and insertions; the selection is kept.
     */
    public WebDriverInspector stop() {
        tree.js().executeScript(PAUSE_SCRIPT);
        feed.disconnect();
        session.stop();
        return this;
    }

    public WebDriverInspector reset() {
        session.reset();
        return this;
    }

    public WebDriverInspector clearAll() {
        stop();
        session.reset();
        return this;
    }

    /**
     * Replays pending page mutations, then processes queued clicks in click order. Does nothing while idle.
     *
     * @return records of elements that became selected; deselections yield nothing
     */
    public List<SelectionRecord> poll() {
        if (!session.isInspecting()) {
            return List.of();
        }
        feed.drain();

        Object raw = tree.js().executeScript(TAKE_CLICKS_SCRIPT);
        if (!(raw instanceof List)) {
            return List.of();
        }

        List<SelectionRecord> selected = new ArrayList<>();
        for (Object clicked : (List<?>) raw) {
            if (clicked instanceof WebElement) {
                session.select(tree.node((WebElement) clicked)).ifPresent(selected::add);
            }
        }
        logger.debug("Processed {} click(s), {} new selection(s)", ((List<?>) raw).size(), selected.size());
        return selected;
    }

    /**
     * Selects an element found by the caller, bypassing click capture.
     */
    public Optional<SelectionRecord> select(WebElement element) {
        Objects.requireNonNull(element, "element must not be null");
        if (!session.isInspecting()) {
            return Optional.empty();
        }
        feed.drain();
        return session.select(tree.node(element));
    }

    public List<SelectionRecord> getSelection() {
        return session.getSelection();
    }

    public InspectionSession session() {
        return session;
    }

    public WebDriverDocumentTree tree() {
        return tree;
    }

    public WebDriverMutationFeed feed() {
        return feed;
    }
}
