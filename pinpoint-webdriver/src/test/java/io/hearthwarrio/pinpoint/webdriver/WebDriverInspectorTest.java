package io.hearthwarrio.pinpoint.webdriver;

import io.hearthwarrio.pinpoint.core.EngineSettings;
import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.session.InspectionSessions;
import io.hearthwarrio.pinpoint.core.session.InspectionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WebDriverInspectorTest {

    private static final Instant NOW = Instant.ofEpochMilli(1_700_000_010_000L);

    private BrowserDriver driver;
    private WebElement pay;
    private WebDriverInspector inspector;

    @BeforeEach
    void setUp() {
        driver = mock(BrowserDriver.class);
        pay = mock(WebElement.class);
        when(pay.getTagName()).thenReturn("button");
        when(pay.getDomAttribute("id")).thenReturn("pay");
        when(pay.getText()).thenReturn("Pay now");
        when(driver.findElements(any(By.class))).thenReturn(List.of(pay));
        when(driver.executeScript(WebDriverMutationFeed.DRAIN_SCRIPT))
                .thenReturn(Map.of("insertions", List.of(), "removals", List.of()));

        InspectionSessions sessions = new InspectionSessions(EngineSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        inspector = new WebDriverInspector(driver, sessions);
    }

    @Test
    void startInstallsObserverAndClickCapture() {
        inspector.start();

        verify(driver).executeScript(WebDriverMutationFeed.INSTALL_SCRIPT);
        verify(driver).executeScript(WebDriverInspector.CAPTURE_SCRIPT);
        assertEquals(InspectionState.INSPECTING, inspector.session().getState());
    }

    @Test
    void clicksBecomeSelectionsAndSecondClickDeselects() {
        when(driver.executeScript(WebDriverInspector.TAKE_CLICKS_SCRIPT)).thenReturn(List.of(pay), List.of(pay));
        List<Integer> sizes = new ArrayList<>();
        inspector.withListener(selection -> sizes.add(selection.size())).start();

        List<SelectionRecord> first = inspector.poll();
        List<SelectionRecord> second = inspector.poll();

        assertEquals(1, first.size());
        SelectionRecord record = first.get(0);
        assertEquals("#pay", record.getStructuralSelector());
        assertEquals("//*[@id='pay']", record.getPathLocator());
        assertTrue(record.getSeleniumLocator().contains("By.id(\"pay\")"));
        assertFalse(record.isDynamic());

        assertTrue(second.isEmpty());
        assertEquals(List.of(1, 0), sizes);
    }

    @Test
    void elementInsertedJustBeforeTheClickIsDynamic() {
        when(driver.executeScript(WebDriverMutationFeed.DRAIN_SCRIPT)).thenReturn(Map.of(
                "insertions", List.of(Map.of("node", pay, "at", NOW.minusMillis(400).toEpochMilli())),
                "removals", List.of()));
        when(driver.executeScript(WebDriverInspector.TAKE_CLICKS_SCRIPT)).thenReturn(List.of(pay));
        inspector.start();

        SelectionRecord record = inspector.poll().get(0);

        assertTrue(record.isDynamic());
        assertTrue(record.getSeleniumLocator().startsWith("WebDriverWait wait = new WebDriverWait(driver, Duration.ofMillis(5000));"));
        assertTrue(record.getPlaywrightLocator().startsWith("// DYNAMIC ELEMENT WAITER"));
    }

    @Test
    void clicksAreIgnoredWhileIdle() {
        when(driver.executeScript(WebDriverInspector.TAKE_CLICKS_SCRIPT)).thenReturn(List.of(pay));

        assertTrue(inspector.poll().isEmpty());
        assertTrue(inspector.select(pay).isEmpty());
    }

    @Test
    void observerStaysOffAfterStop() {
        when(driver.executeScript(WebDriverMutationFeed.DRAIN_SCRIPT)).thenReturn(null);
        when(driver.executeScript(WebDriverInspector.TAKE_CLICKS_SCRIPT)).thenReturn(List.of(pay));
        inspector.start();
        inspector.stop();
        clearInvocations(driver);

        assertTrue(inspector.poll().isEmpty());
        assertTrue(inspector.select(pay).isEmpty());

        verify(driver, never()).executeScript(WebDriverMutationFeed.INSTALL_SCRIPT);
        verify(driver, never()).executeScript(WebDriverMutationFeed.DRAIN_SCRIPT);
    }

    @Test
    void stopKeepsSelectionAndClearAllDropsIt() {
        inspector.start();
        inspector.select(pay);

        inspector.stop();
        verify(driver).executeScript(WebDriverInspector.PAUSE_SCRIPT);
        verify(driver).executeScript(WebDriverMutationFeed.DISCONNECT_SCRIPT);
        assertEquals(1, inspector.getSelection().size());

        inspector.clearAll();
        assertTrue(inspector.getSelection().isEmpty());
        assertEquals(InspectionState.IDLE, inspector.session().getState());
    }
}
