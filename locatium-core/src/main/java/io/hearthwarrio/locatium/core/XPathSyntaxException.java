package io.hearthwarrio.locatium.core;

/**
 * Thrown when the token sequence does not form a valid path.
 */
public class XPathSyntaxException extends XPathException {
    public XPathSyntaxException(String message, int offset) {
        super(message, offset);
    }
}
