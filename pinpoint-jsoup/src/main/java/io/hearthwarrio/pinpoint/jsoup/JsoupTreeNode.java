package io.hearthwarrio.pinpoint.jsoup;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Objects;

/**
 * {@link TreeNode} over a jsoup {@link Element}. Equality is identity of the wrapped element.
 * <p>
 * Visible text is jsoup's whitespace-normalized {@link Element#text()}, so it is always a single line.
 */
public final class JsoupTreeNode implements TreeNode {

    private final Element element;

    public JsoupTreeNode(Element element) {
        this.element = Objects.requireNonNull(element, "element must not be null");
    }

    static JsoupTreeNode wrap(Element element) {
        return element == null ? null : new JsoupTreeNode(element);
    }

    public Element getElement() {
        return element;
    }

    @Override
    public String tagName() {
        return element.normalName();
    }

    @Override
    public String attribute(String name) {
        return element.attr(name).trim();
    }

    @Override
    public boolean hasAttribute(String name) {
        return element.hasAttr(name);
    }

    @Override
    public TreeNode parent() {
        Element parent = element.parent();
        if (parent == null || parent instanceof Document) {
            return null;
        }
        return new JsoupTreeNode(parent);
    }

    @Override
    public TreeNode previousSibling() {
        return wrap(element.previousElementSibling());
    }

    @Override
    public TreeNode nextSibling() {
        return wrap(element.nextElementSibling());
    }

    @Override
    public int childCount() {
        return element.childrenSize();
    }

    @Override
    public String visibleText() {
        return element.text();
    }

    @Override
    public String outerHtml() {
        return element.outerHtml();
    }

    @Override
    public Object nodeKey() {
        return element;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsoupTreeNode && ((JsoupTreeNode) o).element == element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return "JsoupTreeNode{<" + element.normalName() + ">}";
    }
}
