package io.hearthwarrio.pinpoint.examples;

import io.hearthwarrio.pinpoint.allure.AllureSelectionRecordLogger;
import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.session.RecordLogDetail;
import io.hearthwarrio.pinpoint.testkit.TestPinpoint;
import io.hearthwarrio.pinpoint.webdriver.WebDriverInspector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoginPagePinpointIT {
    private WebDriver driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    @Test
    void clickedLoginFieldGetsLabelLocator_withStdOutLogging() {
        driver = TestPinpoint.chrome();
        driver.get("https://the-internet.herokuapp.com/login");

        WebDriverInspector inspector = TestPinpoint.stdout(driver, RecordLogDetail.FULL).start();
        driver.findElement(By.id("username")).click();

        List<SelectionRecord> records = inspector.poll();

        assertEquals(1, records.size());
        SelectionRecord record = records.get(0);
        assertEquals("#username", record.getStructuralSelector());
        assertTrue(record.getPlaywrightLocator().startsWith("page.locator('form').getByLabel('Username')"),
                "Expected label locator scoped to the form, got: " + record.getPlaywrightLocator());
        assertTrue(record.getSeleniumLocator().contains("By.id(\"username\")"));
        assertFalse(record.isDynamic());
    }

    @Test
    void clickingTwiceDeselects_withAllureLogging() {
        driver = TestPinpoint.chrome();
        driver.get("https://the-internet.herokuapp.com/login");

        WebDriverInspector inspector = TestPinpoint.inspector(driver)
                .withRecordLogger(new AllureSelectionRecordLogger(driver, RecordLogDetail.LOCATORS, true))
                .start();

        driver.findElement(By.cssSelector("button[type='submit']")).click();
        assertEquals(1, inspector.poll().size());

        driver.findElement(By.cssSelector("button[type='submit']")).click();
        assertTrue(inspector.poll().isEmpty());
        assertTrue(inspector.getSelection().isEmpty());

        assertTrue(driver.getCurrentUrl().endsWith("/login"),
                "Captured clicks must not submit the form, got: " + driver.getCurrentUrl());
    }
}
