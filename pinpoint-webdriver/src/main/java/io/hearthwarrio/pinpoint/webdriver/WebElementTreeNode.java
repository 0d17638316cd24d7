package io.hearthwarrio.pinpoint.webdriver;

import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.RemoteWebElement;

import java.util.Locale;
import java.util.Objects;

/**
 * {@link TreeNode} over a live Selenium {@link WebElement}.
 * <p>
 * Every read goes to the browser. Reads of a stale or detached element yield empty values instead of failing.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public final class WebElementTreeNode implements TreeNode {

    private static final String PARENT_SCRIPT = "return arguments[0].parentElement;";
    private static final String PREVIOUS_SCRIPT = "return arguments[0].previousElementSibling;";
    private static final String NEXT_SCRIPT = "return arguments[0].nextElementSibling;";
    private static final String CHILD_COUNT_SCRIPT = "return arguments[0].childElementCount;";

    private final JavascriptExecutor js;
    private final WebElement element;

    public WebElementTreeNode(JavascriptExecutor js, WebElement element) {
        this.js = Objects.requireNonNull(js, "js must not be null");
        this.element = Objects.requireNonNull(element, "element must not be null");
    }

    public WebElement getElement() {
        return element;
    }

    @Override
    public String tagName() {
        try {
            String tag = element.getTagName();
            return tag == null ? "" : tag.toLowerCase(Locale.ROOT);
        } catch (RuntimeException e) {
            return "";
        }
    }

    @Override
    public String attribute(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        try {
            String v = element.getDomAttribute(name);
            return v == null ? "" : v.trim();
        } catch (RuntimeException e) {
            return "";
        }
    }

    @Override
    public boolean hasAttribute(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        try {
            return element.getDomAttribute(name) != null;
        } catch (RuntimeException e) {
            return false;
        }
    }

    @Override
    public TreeNode parent() {
        return relative(PARENT_SCRIPT);
    }

    @Override
    public TreeNode previousSibling() {
        return relative(PREVIOUS_SCRIPT);
    }

    @Override
    public TreeNode nextSibling() {
        return relative(NEXT_SCRIPT);
    }

    @Override
    public int childCount() {
        try {
            Object v = js.executeScript(CHILD_COUNT_SCRIPT, element);
            return v instanceof Number ? ((Number) v).intValue() : 0;
        } catch (RuntimeException e) {
            return 0;
        }
    }

    @Override
    public String visibleText() {
        try {
            String text = element.getText();
            return text == null ? "" : text;
        } catch (RuntimeException e) {
            return "";
        }
    }

    @Override
    public String outerHtml() {
        try {
            String html = element.getDomProperty("outerHTML");
            return html == null ? "" : html;
        } catch (RuntimeException e) {
            return "";
        }
    }

    /**
     * The W3C element reference when the driver exposes one; it stays the same for the same DOM element across
     * lookups within one page.
     */
    @Override
    public Object nodeKey() {
        if (element instanceof RemoteWebElement) {
            String id = ((RemoteWebElement) element).getId();
            if (id != null && !id.isBlank()) {
                return id;
            }
        }
        return element;
    }

    private TreeNode relative(String script) {
        try {
            Object v = js.executeScript(script, element);
            return v instanceof WebElement ? new WebElementTreeNode(js, (WebElement) v) : null;
        } catch (RuntimeException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WebElementTreeNode)) {
            return false;
        }
        return nodeKey().equals(((WebElementTreeNode) o).nodeKey());
    }

    @Override
    public int hashCode() {
        return nodeKey().hashCode();
    }

    @Override
    public String toString() {
        return "WebElementTreeNode{" + nodeKey() + '}';
    }
}
