package io.hearthwarrio.pinpoint.allure;

import io.hearthwarrio.pinpoint.core.SelectionRecord;
import io.hearthwarrio.pinpoint.core.session.RecordLogDetail;
import io.hearthwarrio.pinpoint.core.session.RecordLogText;
import io.hearthwarrio.pinpoint.core.session.SelectionRecordLogger;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Allure logger for selection records: one step per record with the record as a text attachment.
 * <p>
 * Lives in pinpoint-allure to avoid leaking Allure dependency into core/webdriver.
 */
public final class AllureSelectionRecordLogger implements SelectionRecordLogger {

    private final WebDriver driver;
    private final RecordLogDetail detail;
    private final boolean attachScreenshot;

    /**
     * @param driver           driver to take screenshots from; may be null for offline inspection
     * @param detail           how much of the record goes into the attachment
     * @param attachScreenshot attach a page screenshot when the driver can take one
     */
    public AllureSelectionRecordLogger(WebDriver driver, RecordLogDetail detail, boolean attachScreenshot) {
        this.driver = driver;
        this.detail = detail == null ? RecordLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public RecordLogDetail detail() {
        return detail;
    }

    @Override
    public void logSelection(SelectionRecord record) {
        if (record == null) {
            return;
        }

        String title = "Pinpoint: " + record.getDisplayName() + (record.isDynamic() ? " (dynamic)" : "");

        Allure.step(title, () -> {
            byte[] txt = RecordLogText.render(record, detail).getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(
                    "Selection record",
                    "text/plain",
                    new ByteArrayInputStream(txt),
                    ".txt"
            );

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }
}
