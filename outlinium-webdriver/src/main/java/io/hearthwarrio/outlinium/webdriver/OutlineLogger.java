package io.hearthwarrio.outlinium.webdriver;

import io.hearthwarrio.outlinium.core.PageContext;
import io.hearthwarrio.outlinium.core.dom.ElementNode;

/**
 * Receives information about observations and resolved identifiers.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface OutlineLogger {

    /**
     * Called after an identifier was resolved to a locator, before the element is looked up.
     *
     * @param identifier identifier from the current outline
     * @param xPath      resolved XPath
     * @param element    original DOM element behind the identifier
     */
    void logResolvedIdentifier(String identifier, String xPath, ElementNode element);

    /**
     * Called after a page was observed. Default does nothing.
     *
     * @param context freshly built context
     */
    default void logObservation(PageContext context) {
    }

    /**
     * Declares how much of an observation this logger wants.
     */
    default ObservationLogDetail detail() {
        return ObservationLogDetail.SUMMARY;
    }
}
