package io.hearthwarrio.locatium.core;

/**
 * Controls which conversion data a {@link ConversionLogger} receives.
 */
public enum LogDetail {

    /**
     * Only the input path and the locator count.
     */
    NONE,

    /**
     * Input path and the UID chain.
     */
    UIDS,

    /**
     * Input path and the rendered declarations.
     */
    DECLARATIONS,

    /**
     * UID chain and rendered declarations.
     */
    BOTH;

    public boolean needsDeclarations() {
        return this == DECLARATIONS || this == BOTH;
    }

    public boolean needsUids() {
        return this == UIDS || this == BOTH;
    }
}
