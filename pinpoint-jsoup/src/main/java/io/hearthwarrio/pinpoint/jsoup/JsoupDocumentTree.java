package io.hearthwarrio.pinpoint.jsoup;

import io.hearthwarrio.pinpoint.core.dynamic.CreationTimestamps;
import io.hearthwarrio.pinpoint.core.dynamic.WeakCreationTimestamps;
import io.hearthwarrio.pinpoint.core.tree.DocumentTree;
import io.hearthwarrio.pinpoint.core.tree.InsertionListener;
import io.hearthwarrio.pinpoint.core.tree.MalformedSelectorException;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link DocumentTree} over a parsed jsoup {@link Document}.
 * <p>
 * Mutations made through {@link #appendHtml(TreeNode, String)} and {@link #remove(TreeNode)} are reported to
 * insertion listeners, timestamped with this tree's clock. Direct edits of the underlying document are not.
 */
public final class JsoupDocumentTree implements DocumentTree {

    private static final Logger logger = LoggerFactory.getLogger(JsoupDocumentTree.class);

    private final Document document;
    private final Clock clock;
    private final List<InsertionListener> listeners = new CopyOnWriteArrayList<>();

    public JsoupDocumentTree(Document document) {
        this(document, Clock.systemUTC());
    }

    public JsoupDocumentTree(Document document, Clock clock) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static JsoupDocumentTree parse(String html) {
        return new JsoupDocumentTree(Jsoup.parse(Objects.requireNonNull(html, "html must not be null")));
    }

    public static JsoupDocumentTree parse(String html, Clock clock) {
        return new JsoupDocumentTree(Jsoup.parse(Objects.requireNonNull(html, "html must not be null")), clock);
    }

    @Override
    public List<TreeNode> querySelectorAll(String selector) {
        Elements found;
        try {
            found = document.select(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            // jsoup reports some syntax errors through Validate (IllegalArgumentException)
            throw new MalformedSelectorException("Invalid selector '" + selector + "': " + e.getMessage(), e);
        }
        List<TreeNode> out = new ArrayList<>(found.size());
        for (Element e : found) {
            out.add(new JsoupTreeNode(e));
        }
        return out;
    }

    /**
     * First element matching {@code selector}; empty when none matches or the selector is invalid.
     */
    public Optional<TreeNode> find(String selector) {
        try {
            List<TreeNode> all = querySelectorAll(selector);
            return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
        } catch (MalformedSelectorException e) {
            logger.debug("find('{}') failed: {}", selector, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * All elements matching {@code selector}; empty when the selector is invalid.
     */
    public List<TreeNode> findAll(String selector) {
        try {
            return querySelectorAll(selector);
        } catch (MalformedSelectorException e) {
            logger.debug("findAll('{}') failed: {}", selector, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Every element of the document body, in document order. The body itself is not included.
     */
    public List<TreeNode> bodyElements() {
        List<TreeNode> out = new ArrayList<>();
        for (Element e : document.body().getAllElements()) {
            if (e != document.body()) {
                out.add(new JsoupTreeNode(e));
            }
        }
        return out;
    }

    /**
     * Parses {@code html} and appends it to {@code parent}, notifying listeners of every inserted element.
     *
     * @return the inserted top-level elements
     */
    public List<TreeNode> appendHtml(TreeNode parent, String html) {
        Element target = unwrap(parent);
        int before = target.childNodeSize();
        target.append(html);

        Instant now = clock.instant();
        List<TreeNode> inserted = new ArrayList<>();
        List<Node> added = new ArrayList<>(target.childNodes().subList(before, target.childNodeSize()));
        for (Node node : added) {
            if (!(node instanceof Element)) {
                continue;
            }
            Element element = (Element) node;
            inserted.add(new JsoupTreeNode(element));
            for (Element e : element.getAllElements()) {
                fireInsertion(new JsoupTreeNode(e), now);
            }
        }
        logger.debug("Appended {} element(s) to <{}>", inserted.size(), target.normalName());
        return Collections.unmodifiableList(inserted);
    }

    /**
     * Detaches {@code node} from the document and reports it (and its descendants) as removed.
     */
    public void remove(TreeNode node) {
        Element element = unwrap(node);
        for (Element e : element.getAllElements()) {
            JsoupTreeNode removed = new JsoupTreeNode(e);
            for (InsertionListener l : listeners) {
                l.onRemoval(removed);
            }
        }
        element.remove();
    }

    private void fireInsertion(TreeNode node, Instant at) {
        for (InsertionListener l : listeners) {
            l.onInsertion(node, at);
        }
    }

    private static Element unwrap(TreeNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (!(node instanceof JsoupTreeNode)) {
            throw new IllegalArgumentException("node does not belong to a jsoup document: " + node);
        }
        return ((JsoupTreeNode) node).getElement();
    }

    public Document getDocument() {
        return document;
    }

    @Override
    public Object documentKey() {
        return document;
    }

    @Override
    public CreationTimestamps newTimestampStore(int capacity) {
        return new WeakCreationTimestamps();
    }

    @Override
    public void addInsertionListener(InsertionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void removeInsertionListener(InsertionListener listener) {
        listeners.remove(listener);
    }
}
