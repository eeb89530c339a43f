package io.hearthwarrio.outlinium.allure;

import io.hearthwarrio.outlinium.core.PageContext;
import io.hearthwarrio.outlinium.core.dom.ElementNode;
import io.hearthwarrio.outlinium.webdriver.ObservationLogDetail;
import io.hearthwarrio.outlinium.webdriver.OutlineLogFormat;
import io.hearthwarrio.outlinium.webdriver.OutlineLogger;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for observations and resolved identifiers.
 * <p>
 * Lives in outlinium-allure to avoid leaking Allure dependency into core/webdriver.
 */
public final class AllureOutlineLogger implements OutlineLogger {

    private final WebDriver driver;
    private final ObservationLogDetail detail;
    private final boolean attachScreenshot;

    public AllureOutlineLogger(WebDriver driver, ObservationLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? ObservationLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public ObservationLogDetail detail() {
        return detail;
    }

    @Override
    public void logObservation(PageContext context) {
        if (detail == ObservationLogDetail.NONE) {
            return;
        }

        Allure.step("Outlinium: observe page (" + OutlineLogFormat.summary(context) + ")", () -> {
            if (detail == ObservationLogDetail.FULL_OUTLINE) {
                attachText("Outline", context.getText());
            }
            if (attachScreenshot) {
                attachScreenshot();
            }
        });
    }

    @Override
    public void logResolvedIdentifier(String identifier, String xPath, ElementNode element) {
        Allure.step("Outlinium: " + identifier, () -> {
            StringBuilder sb = new StringBuilder(256);
            sb.append("identifier: ").append(identifier).append('\n')
                    .append("xpath: ").append(xPath).append('\n');
            if (element != null) {
                sb.append("tag: ").append(element.getTag()).append('\n');
                element.getAttributes().forEach((k, v) -> sb.append("attr.").append(k).append(": ").append(v).append('\n'));
                String text = element.getText();
                if (!text.isEmpty()) {
                    sb.append("text: ").append(text).append('\n');
                }
            }
            attachText("Resolved identifier", sb.toString());
        });
    }

    private static void attachText(String name, String text) {
        byte[] txt = text.getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment(
                name,
                "text/plain",
                new ByteArrayInputStream(txt),
                ".txt"
        );
    }

    private void attachScreenshot() {
        if (driver instanceof TakesScreenshot ts) {
            byte[] png = ts.getScreenshotAs(OutputType.BYTES);
            Allure.addAttachment(
                    "Screenshot",
                    "image/png",
                    new ByteArrayInputStream(png),
                    ".png"
            );
        }
    }
}
