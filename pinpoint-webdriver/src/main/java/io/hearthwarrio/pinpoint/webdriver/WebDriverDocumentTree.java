package io.hearthwarrio.pinpoint.webdriver;

import io.hearthwarrio.pinpoint.core.tree.DocumentTree;
import io.hearthwarrio.pinpoint.core.tree.InsertionListener;
import io.hearthwarrio.pinpoint.core.tree.MalformedSelectorException;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link DocumentTree} over the page currently loaded in a {@link WebDriver}.
 * <p>
 * The driver must also be a {@link JavascriptExecutor}. Insertions are not observed by this class itself;
 * they are fed in by {@link WebDriverMutationFeed}.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public final class WebDriverDocumentTree implements DocumentTree {

    private final WebDriver driver;
    private final JavascriptExecutor js;
    private final List<InsertionListener> listeners = new CopyOnWriteArrayList<>();

    public WebDriverDocumentTree(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor");
        }
        this.js = (JavascriptExecutor) driver;
    }

    @Override
    public List<TreeNode> querySelectorAll(String selector) {
        List<WebElement> found;
        try {
            found = driver.findElements(By.cssSelector(selector));
        } catch (InvalidSelectorException e) {
            throw new MalformedSelectorException("Invalid selector '" + selector + "'", e);
        }
        List<TreeNode> out = new ArrayList<>(found.size());
        for (WebElement element : found) {
            out.add(node(element));
        }
        return out;
    }

    public TreeNode node(WebElement element) {
        return new WebElementTreeNode(js, element);
    }

    /**
     * The driver: one inspection session per browser session.
     */
    @Override
    public Object documentKey() {
        return driver;
    }

    @Override
    public void addInsertionListener(InsertionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void removeInsertionListener(InsertionListener listener) {
        listeners.remove(listener);
    }

    void fireInsertion(TreeNode node, Instant insertedAt) {
        for (InsertionListener listener : listeners) {
            listener.onInsertion(node, insertedAt);
        }
    }

    void fireRemoval(TreeNode node) {
        for (InsertionListener listener : listeners) {
            listener.onRemoval(node);
        }
    }

    public WebDriver getDriver() {
        return driver;
    }

    JavascriptExecutor js() {
        return js;
    }
}
