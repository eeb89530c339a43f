package io.hearthwarrio.outlinium.webdriver;

/**
 * Thrown when a resolved locator does not match exactly one element on the live page.
 */
public class ElementLookupException extends RuntimeException {
    public ElementLookupException(String message) {
        super(message);
    }
}
