package io.hearthwarrio.outlinium.testkit;

import io.hearthwarrio.outlinium.core.SnapshotMode;
import io.hearthwarrio.outlinium.webdriver.CdpSnapshotSource;
import io.hearthwarrio.outlinium.webdriver.ObservationLogDetail;
import io.hearthwarrio.outlinium.webdriver.OutliniumWebDriver;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chromium.HasCdp;

import java.util.Objects;

/**
 * Convenience factory methods for creating Outlinium instances in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestOutlinium {

    private TestOutlinium() {
        // utility class
    }

    /**
     * Creates a plain OutliniumWebDriver without logging.
     *
     * @param driver driver that also implements {@link HasCdp} (local Chrome/Edge or an augmented remote driver)
     */
    public static OutliniumWebDriver plain(WebDriver driver, SnapshotMode mode) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        return new OutliniumWebDriver(driver, new CdpSnapshotSource(cdp(driver)))
                .withMode(mode);
    }

    /**
     * Creates an OutliniumWebDriver with stdout logging enabled.
     */
    public static OutliniumWebDriver stdout(WebDriver driver, SnapshotMode mode, ObservationLogDetail detail) {
        return plain(driver, mode)
                .withLoggingToStdOut(detail);
    }

    private static HasCdp cdp(WebDriver driver) {
        if (driver instanceof HasCdp cdp) {
            return cdp;
        }
        throw new IllegalArgumentException(
                "Driver does not support the Chrome DevTools Protocol: " + driver.getClass().getName());
    }
}
