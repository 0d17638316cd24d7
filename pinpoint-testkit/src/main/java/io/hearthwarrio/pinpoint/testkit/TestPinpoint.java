package io.hearthwarrio.pinpoint.testkit;

import io.hearthwarrio.pinpoint.core.EngineSettings;
import io.hearthwarrio.pinpoint.core.session.InspectionSessions;
import io.hearthwarrio.pinpoint.core.session.RecordLogDetail;
import io.hearthwarrio.pinpoint.webdriver.WebDriverInspector;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Convenience factory methods for browsers and Pinpoint inspectors in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestPinpoint {

    /**
     * Implicit wait of the browsers created here.
     */
    public static final Duration IMPLICIT_WAIT = Duration.ofSeconds(5);

    /**
     * System property that makes {@link #chrome()} headless.
     */
    public static final String HEADLESS_PROPERTY = "pinpoint.headless";

    private TestPinpoint() {
        // utility class
    }

    /**
     * Local Chrome; headless when {@value #HEADLESS_PROPERTY} is {@code true}.
     */
    public static WebDriver chrome() {
        return chrome(Boolean.getBoolean(HEADLESS_PROPERTY));
    }

    public static WebDriver headlessChrome() {
        return chrome(true);
    }

    private static WebDriver chrome(boolean headless) {
        WebDriver driver = new ChromeDriver(chromeOptions(headless));
        driver.manage().timeouts().implicitlyWait(IMPLICIT_WAIT);
        return driver;
    }

    static ChromeOptions chromeOptions(boolean headless) {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new", "--window-size=1280,1024");
        } else {
            options.addArguments("--start-maximized");
        }
        return options;
    }

    /**
     * Creates an inspector with default settings and no record logging.
     */
    public static WebDriverInspector inspector(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new WebDriverInspector(driver);
    }

    /**
     * Creates an inspector that prints every selection record to stdout.
     */
    public static WebDriverInspector stdout(WebDriver driver, RecordLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new WebDriverInspector(driver)
                .withLoggingToStdOut(detail);
    }

    /**
     * Creates an inspector with custom settings, logging to stdout.
     * <p>
     * The browser stamps insertions with its own clock, so the system clock is used for the dynamic window.
     */
    public static WebDriverInspector stdout(WebDriver driver, EngineSettings settings, RecordLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        return new WebDriverInspector(driver, new InspectionSessions(settings, Clock.systemUTC()))
                .withLoggingToStdOut(detail);
    }
}
