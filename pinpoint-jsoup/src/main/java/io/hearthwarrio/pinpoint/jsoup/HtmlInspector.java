package io.hearthwarrio.pinpoint.jsoup;

import io.hearthwarrio.pinpoint.core.PinpointEngine;
import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.session.InspectionSession;
import io.hearthwarrio.pinpoint.core.session.InspectionSessions;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Offline inspection of an HTML snapshot: point at elements with a CSS query, get their records.
 */
public final class HtmlInspector {

    private final JsoupDocumentTree tree;
    private final InspectionSession session;

    public HtmlInspector(JsoupDocumentTree tree, InspectionSessions sessions) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.session = Objects.requireNonNull(sessions, "sessions must not be null").open(tree);
    }

    public static HtmlInspector of(String html) {
        return new HtmlInspector(JsoupDocumentTree.parse(html), new InspectionSessions());
    }

    /**
     * Record for the first element matching {@code query}; empty when nothing matches.
     */
    public Optional<SelectionRecord> inspect(String query) {
        return tree.find(query).map(engine()::describe);
    }

    /**
     * Records for every element matching {@code query}, in document order.
     */
    public List<SelectionRecord> inspectAll(String query) {
        List<SelectionRecord> out = new ArrayList<>();
        for (TreeNode node : tree.findAll(query)) {
            out.add(engine().describe(node));
        }
        return out;
    }

    /**
     * Interactive-style selection through the session: toggles, and is ignored unless the session was started.
     */
    public Optional<SelectionRecord> select(String query) {
        return tree.find(query).flatMap(session::select);
    }

    public InspectionSession session() {
        return session;
    }

    public JsoupDocumentTree tree() {
        return tree;
    }

    private PinpointEngine engine() {
        return session.getEngine();
    }
}
