package io.hearthwarrio.pinpoint.webdriver;

import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bridges DOM mutations of the live page into {@link WebDriverDocumentTree} insertion listeners.
 * <p>
 * {@link #install()} injects a {@code MutationObserver} that queues every added element (descendants of an added
 * subtree included) with the browser's {@code Date.now()} as insertion time, and every removed element.
 * {@link #drain()} empties both queues and replays them to the tree's listeners.
 * <p>
 * The observer lives in the page, so it is gone after navigation. {@link #drain()} notices the missing window
 * flag and installs it again; insertions that happened in between are not seen.
 */
public final class WebDriverMutationFeed {

    private static final Logger logger = LoggerFactory.getLogger(WebDriverMutationFeed.class);

    static final String INSTALL_SCRIPT =
            "if (window.__pinpointObserverInstalled) { return false; }" +
                    "window.__pinpointObserverInstalled = true;" +
                    "window.__pinpointInsertions = [];" +
                    "window.__pinpointRemovals = [];" +
                    "window.__pinpointObserver = new MutationObserver(function (mutations) {" +
                    "  var at = Date.now();" +
                    "  mutations.forEach(function (m) {" +
                    "    m.addedNodes.forEach(function (n) {" +
                    "      if (n.nodeType !== 1) { return; }" +
                    "      window.__pinpointInsertions.push({node: n, at: at});" +
                    "      n.querySelectorAll('*').forEach(function (d) { window.__pinpointInsertions.push({node: d, at: at}); });" +
                    "    });" +
                    "    m.removedNodes.forEach(function (n) {" +
                    "      if (n.nodeType === 1) { window.__pinpointRemovals.push(n); }" +
                    "    });" +
                    "  });" +
                    "});" +
                    "window.__pinpointObserver.observe(document.documentElement, {childList: true, subtree: true});" +
                    "return true;";

    static final String DRAIN_SCRIPT =
            "if (!window.__pinpointObserverInstalled) { return null; }" +
                    "var q = {insertions: window.__pinpointInsertions || [], removals: window.__pinpointRemovals || []};" +
                    "window.__pinpointInsertions = [];" +
                    "window.__pinpointRemovals = [];" +
                    "return q;";

    static final String DISCONNECT_SCRIPT =
            "if (window.__pinpointObserver) { window.__pinpointObserver.disconnect(); }" +
                    "delete window.__pinpointObserver;" +
                    "delete window.__pinpointObserverInstalled;" +
                    "delete window.__pinpointInsertions;" +
                    "delete window.__pinpointRemovals;";

    private final WebDriverDocumentTree tree;

    public WebDriverMutationFeed(WebDriverDocumentTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
    }

    /**
     * Installs the observer in the current page unless it is already there.
     *
     * @return true when this call installed it
     */
    public boolean install() {
        Object installed = tree.js().executeScript(INSTALL_SCRIPT);
        boolean fresh = Boolean.TRUE.equals(installed);
        if (fresh) {
            logger.debug("Mutation observer installed");
        }
        return fresh;
    }

    /**
     * Replays queued insertions and removals to the tree's listeners.
     *
     * @return number of insertions replayed
     */
    public int drain() {
        Object raw = tree.js().executeScript(DRAIN_SCRIPT);
        if (!(raw instanceof Map)) {
            logger.debug("Mutation observer missing (page changed?), reinstalling");
            install();
            return 0;
        }

        Map<?, ?> queues = (Map<?, ?>) raw;
        int inserted = 0;
        for (Object entry : asList(queues.get("insertions"))) {
            if (!(entry instanceof Map)) {
                continue;
            }
            Object node = ((Map<?, ?>) entry).get("node");
            Object at = ((Map<?, ?>) entry).get("at");
            if (node instanceof WebElement && at instanceof Number) {
                tree.fireInsertion(tree.node((WebElement) node), Instant.ofEpochMilli(((Number) at).longValue()));
                inserted++;
            }
        }
        for (Object node : asList(queues.get("removals"))) {
            if (node instanceof WebElement) {
                tree.fireRemoval(tree.node((WebElement) node));
            }
        }

        if (inserted > 0) {
            logger.debug("Replayed {} insertion(s)", inserted);
        }
        return inserted;
    }

    public void disconnect() {
        tree.js().executeScript(DISCONNECT_SCRIPT);
        logger.debug("Mutation observer disconnected");
    }

    private static List<?> asList(Object v) {
        return v instanceof List ? (List<?>) v : List.of();
    }
}
