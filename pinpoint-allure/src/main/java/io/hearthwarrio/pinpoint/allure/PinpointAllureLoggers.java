package io.hearthwarrio.pinpoint.allure;

import io.hearthwarrio.pinpoint.core.session.RecordLogDetail;
import io.hearthwarrio.pinpoint.core.session.SelectionRecordLogger;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Pinpoint loggers.
 * <p>
 * This class lives in the pinpoint-allure module to avoid leaking Allure
 * dependencies into pinpoint-core or pinpoint-webdriver.
 */
public final class PinpointAllureLoggers {

    private PinpointAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger with both locator grammars and without screenshots.
     */
    public static SelectionRecordLogger selections() {
        return new AllureSelectionRecordLogger(null, RecordLogDetail.LOCATORS, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static SelectionRecordLogger selections(WebDriver driver, RecordLogDetail detail, boolean screenshots) {
        return new AllureSelectionRecordLogger(driver, detail, screenshots);
    }
}
