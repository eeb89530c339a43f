package io.hearthwarrio.outlinium.webdriver;

import io.hearthwarrio.outlinium.core.*;
import io.hearthwarrio.outlinium.core.dom.ElementNode;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chromium.ChromiumDriver;

import java.util.List;
import java.util.Objects;

/**
 * High-level Outlinium entry point for Selenium WebDriver.
 * <p>
 * Typical flow:
 * <ol>
 *   <li>{@link #observe()} builds an outline of the current page and keeps it as the current context.</li>
 *   <li>A caller (often an LLM prompt) picks an identifier such as {@code button-0} from the outline text.</li>
 *   <li>{@link #click(String)}, {@link #sendKeys(String, CharSequence...)} or {@link #findElement(String)}
 *       resolve that identifier against the current context and act on the live element.</li>
 * </ol>
 * <p>
 * Identifiers are valid only for the observation that issued them. Every {@link #observe()} replaces the current
 * context as a whole; stale identifiers fail with {@link IdentifierNotFoundException}.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class OutliniumWebDriver {

    private final WebDriver driver;
    private final SnapshotSource snapshotSource;

    private ContextBuilder contextBuilder;
    private SnapshotMode mode = SnapshotMode.defaultMode();

    /**
     * Mutable to support runtime overrides.
     */
    private OutlineLogger logger;

    private PageContext context;

    public OutliniumWebDriver(ChromiumDriver driver) {
        this(driver, new CdpSnapshotSource(driver));
    }

    public OutliniumWebDriver(WebDriver driver, SnapshotSource snapshotSource) {
        this(driver, snapshotSource, new DefaultContextBuilder());
    }

    public OutliniumWebDriver(WebDriver driver, SnapshotSource snapshotSource, ContextBuilder contextBuilder) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.snapshotSource = Objects.requireNonNull(snapshotSource, "snapshotSource must not be null");
        this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder must not be null");
    }

    // ----------- configuration -----------

    public OutliniumWebDriver withMode(SnapshotMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        return this;
    }

    /**
     * Replaces the context builder with a {@link DefaultContextBuilder} using the given settings.
     */
    public OutliniumWebDriver withSettings(OutlineSettings settings) {
        this.contextBuilder = new DefaultContextBuilder(Objects.requireNonNull(settings, "settings must not be null"));
        return this;
    }

    public OutliniumWebDriver withContextBuilder(ContextBuilder contextBuilder) {
        this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder must not be null");
        return this;
    }

    public OutliniumWebDriver withLogger(OutlineLogger logger) {
        this.logger = logger;
        return this;
    }

    public OutliniumWebDriver withLoggingToStdOut() {
        return withLoggingToStdOut(ObservationLogDetail.SUMMARY);
    }

    public OutliniumWebDriver withLoggingToStdOut(ObservationLogDetail detail) {
        this.logger = new StdOutOutlineLogger(detail);
        return this;
    }

    public WebDriver getDriver() {
        return driver;
    }

    public SnapshotMode getMode() {
        return mode;
    }

    // ----------- observation -----------

    /**
     * Captures the page and replaces the current context.
     *
     * @return the new context
     */
    public PageContext observe() {
        PageContext built = contextBuilder.build(snapshotSource, mode);
        this.context = built;
        if (logger != null && logger.detail() != ObservationLogDetail.NONE) {
            logger.logObservation(built);
        }
        return built;
    }

    /**
     * @return context of the last {@link #observe()}
     * @throws IllegalStateException when the page was never observed
     */
    public PageContext currentContext() {
        if (context == null) {
            throw new IllegalStateException("Page has not been observed yet. Call observe() first.");
        }
        return context;
    }

    /**
     * @return outline text of the last observation
     */
    public String getOutline() {
        return currentContext().getText();
    }

    // ----------- identifier based API -----------

    /**
     * @return absolute XPath of the element behind {@code identifier}
     * @throws IdentifierNotFoundException when the identifier is not part of the current context
     */
    public String getXPath(String identifier) {
        return currentContext().resolve(identifier);
    }

    /**
     * Resolves the identifier and looks the element up on the live page.
     *
     * @throws IdentifierNotFoundException when the identifier is not part of the current context
     * @throws ElementLookupException      when the locator matches no element or several elements
     */
    public WebElement findElement(String identifier) {
        PageContext current = currentContext();
        String xPath = current.resolve(identifier);

        if (logger != null) {
            ElementNode element = current.getIdentifierMap().get(identifier);
            logger.logResolvedIdentifier(identifier, xPath, element);
        }

        List<WebElement> found = driver.findElements(By.xpath(xPath));
        if (found.size() != 1) {
            throw new ElementLookupException(
                    "Expected exactly one element for '" + identifier + "' at " + xPath + ", found " + found.size() +
                            ". The page may have changed since it was observed."
            );
        }
        return found.get(0);
    }

    public void click(String identifier) {
        findElement(identifier).click();
    }

    public void sendKeys(String identifier, CharSequence... keys) {
        findElement(identifier).sendKeys(keys);
    }

    public void clear(String identifier) {
        findElement(identifier).clear();
    }
}
