package io.hearthwarrio.locatium.core;

/**
 * Base class for failures while reading an XPath expression.
 * <p>
 * Always fatal for the current call: no partial result is produced.
 */
public class XPathException extends RuntimeException {

    private final int offset;

    public XPathException(String message, int offset) {
        super(message + " at pos " + offset);
        this.offset = offset;
    }

    /**
     * Zero-based source position the failure is reported at.
     */
    public int getOffset() {
        return offset;
    }
}
