package io.hearthwarrio.locatium.core;

import java.util.List;

/**
 * Receives information about a finished conversion.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 * <p>
 * Note: {@link #detail()} is used by {@link LocatorPipeline} to decide whether it should
 * render declarations at all when the caller only asked for locators.
 */
@FunctionalInterface
public interface ConversionLogger {

    /**
     * Called after a path has been converted.
     *
     * @param xpath        input path
     * @param locators     resulting locators
     * @param declarations rendered text (null if not requested and not needed)
     */
    void logConversion(String xpath, List<Locator> locators, String declarations);

    /**
     * Declares how much conversion info this logger needs.
     */
    default LogDetail detail() {
        return LogDetail.BOTH;
    }
}
