package io.hearthwarrio.pinpoint.webdriver;

import io.hearthwarrio.pinpoint.core.UniquenessOracle;
import io.hearthwarrio.pinpoint.core.tree.MalformedSelectorException;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class WebDriverDocumentTreeTest {

    @Test
    void driverWithoutScriptingIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WebDriverDocumentTree(mock(WebDriver.class)));
    }

    @Test
    void invalidSelectorBecomesMalformedSelector() {
        BrowserDriver driver = mock(BrowserDriver.class);
        when(driver.findElements(By.cssSelector("a[["))).thenThrow(new InvalidSelectorException("bad"));
        WebDriverDocumentTree tree = new WebDriverDocumentTree(driver);

        assertThrows(MalformedSelectorException.class, () -> tree.querySelectorAll("a[["));
        assertFalse(new UniquenessOracle(tree).isUnique("a[[", tree.node(mock(WebElement.class))));
    }

    @Test
    void uniquenessComparesTheMatchedElement() {
        BrowserDriver driver = mock(BrowserDriver.class);
        WebElement pay = mock(WebElement.class);
        WebElement other = mock(WebElement.class);
        when(driver.findElements(By.cssSelector("#pay"))).thenReturn(List.of(pay));
        when(driver.findElements(By.cssSelector("button"))).thenReturn(List.of(other, pay));
        WebDriverDocumentTree tree = new WebDriverDocumentTree(driver);
        UniquenessOracle oracle = new UniquenessOracle(tree);

        assertTrue(oracle.isUnique("#pay", tree.node(pay)));
        assertFalse(oracle.isUnique("#pay", tree.node(other)));
        assertFalse(oracle.isUnique("button", tree.node(pay)));
    }

    @Test
    void documentKeyIsTheDriver() {
        BrowserDriver driver = mock(BrowserDriver.class);

        assertSame(driver, new WebDriverDocumentTree(driver).documentKey());
    }
}
