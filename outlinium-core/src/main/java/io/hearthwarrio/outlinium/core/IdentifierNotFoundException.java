package io.hearthwarrio.outlinium.core;

/**
 * Thrown when an identifier is not part of the outline it is resolved against,
 * typically because it was issued by an earlier observation of the page.
 */
public class IdentifierNotFoundException extends RuntimeException {
    public IdentifierNotFoundException(String message) {
        super(message);
    }
}
