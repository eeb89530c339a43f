package io.hearthwarrio.outlinium.allure;

import io.hearthwarrio.outlinium.webdriver.ObservationLogDetail;
import io.hearthwarrio.outlinium.webdriver.OutlineLogger;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Outlinium loggers.
 * <p>
 * This class lives in the outlinium-allure module to avoid leaking Allure
 * dependencies into outlinium-core or outlinium-webdriver.
 */
public final class OutliniumAllureLoggers {

    private OutliniumAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that attaches the full outline of every observation, without screenshots.
     */
    public static OutlineLogger outlines(WebDriver driver) {
        return new AllureOutlineLogger(driver, ObservationLogDetail.FULL_OUTLINE, false);
    }

    /**
     * Creates an Allure logger with explicit observation detail and screenshot flag.
     */
    public static OutlineLogger outlines(WebDriver driver, ObservationLogDetail detail, boolean screenshots) {
        return new AllureOutlineLogger(driver, detail, screenshots);
    }
}
