package io.hearthwarrio.outlinium.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.Augmenter;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.time.Duration;
import java.util.Objects;

/**
 * Minimal WebDriver factory for tests.
 * <p>
 * Local Chrome by default; snapshots are captured over CDP, so Chromium-based browsers are required.
 * Testkit lives outside Outlinium core to avoid turning Outlinium into a test framework.
 */
public final class TestDrivers {
    /**
     * Default implicit wait used by the testkit.
     */
    public static final Duration DEFAULT_IMPLICIT_WAIT = Duration.ofSeconds(5);

    private TestDrivers() {
        // utility class
    }

    /**
     * Creates a local ChromeDriver with default settings.
     */
    public static ChromeDriver chrome() {
        return chrome(new ChromeOptions());
    }

    /**
     * Creates a local ChromeDriver with provided options.
     */
    public static ChromeDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        ChromeDriver driver = new ChromeDriver(options);
        applyDefaults(driver);
        return driver;
    }

    /**
     * Creates a headless local ChromeDriver, suitable for CI.
     */
    public static ChromeDriver headlessChrome() {
        return chrome(new ChromeOptions().addArguments("--headless=new", "--window-size=1366,900"));
    }

    /**
     * Creates a RemoteWebDriver with provided Selenium Grid URL and capabilities.
     * <p>
     * The driver is augmented so that a Chromium grid node exposes CDP
     * ({@link org.openqa.selenium.chromium.HasCdp}).
     */
    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        WebDriver driver = new Augmenter().augment(new RemoteWebDriver(remoteUrl, capabilities));
        applyDefaults(driver);
        return driver;
    }

    private static void applyDefaults(WebDriver driver) {
        driver.manage().timeouts().implicitlyWait(DEFAULT_IMPLICIT_WAIT);
        driver.manage().window().maximize();
    }
}
