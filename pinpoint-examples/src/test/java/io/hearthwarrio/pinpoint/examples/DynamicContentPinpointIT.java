package io.hearthwarrio.pinpoint.examples;

import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.session.RecordLogDetail;
import io.hearthwarrio.pinpoint.testkit.TestPinpoint;
import io.hearthwarrio.pinpoint.webdriver.WebDriverInspector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class DynamicContentPinpointIT {

    private WebDriver driver;
    private WebDriverInspector inspector;

    @BeforeEach
    void setUp() {
        driver = TestPinpoint.headlessChrome();

        Path page = Paths.get("src", "test", "resources", "pages", "pinpoint-dynamic.html");
        driver.get(page.toUri().toString());

        inspector = TestPinpoint.stdout(driver, RecordLogDetail.LOCATORS).start();
    }

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    @Test
    void freshlyInsertedElementGetsWaiters() {
        ((JavascriptExecutor) driver).executeScript("addResult('First result');");

        SelectionRecord record = inspector.select(driver.findElement(By.cssSelector(".result"))).orElseThrow();

        assertTrue(record.isDynamic());
        assertTrue(record.getPlaywrightLocator().contains("waitForSelector('.result'"),
                "got: " + record.getPlaywrightLocator());
        assertTrue(record.getSeleniumLocator().startsWith("WebDriverWait wait"),
                "got: " + record.getSeleniumLocator());
    }

    @Test
    void elementPresentAtLoadIsStatic() {
        SelectionRecord record = inspector.select(driver.findElement(By.id("subscribe"))).orElseThrow();

        assertFalse(record.isDynamic());
        assertEquals("#subscribe", record.getStructuralSelector());
        assertTrue(record.getPlaywrightLocator().startsWith("page.locator('form').getByRole('button', { name: 'Subscribe' })"),
                "got: " + record.getPlaywrightLocator());
    }

    @Test
    void labelledInputPrefersLabel() {
        SelectionRecord record = inspector.select(driver.findElement(By.name("email"))).orElseThrow();

        assertTrue(record.getPlaywrightLocator().startsWith("page.locator('form').getByLabel('Email')"),
                "got: " + record.getPlaywrightLocator());
        assertEquals("input[name=\"email\"]", record.getStructuralSelector());
    }
}
