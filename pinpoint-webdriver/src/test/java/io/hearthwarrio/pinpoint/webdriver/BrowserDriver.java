package io.hearthwarrio.pinpoint.webdriver;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;

/**
 * Mockable driver that can also run scripts, like the real browser drivers.
 */
interface BrowserDriver extends WebDriver, JavascriptExecutor {
}
