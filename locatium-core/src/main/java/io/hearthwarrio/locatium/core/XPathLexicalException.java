package io.hearthwarrio.locatium.core;

/**
 * Thrown when the input cannot be split into tokens (unterminated string literal).
 */
public class XPathLexicalException extends XPathException {
    public XPathLexicalException(String message, int offset) {
        super(message, offset);
    }
}
