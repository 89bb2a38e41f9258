package io.hearthwarrio.locatium.allure;

import io.hearthwarrio.locatium.core.ConversionLogger;
import io.hearthwarrio.locatium.core.LogDetail;

/**
 * Factory methods for Allure-related Locatium loggers.
 * <p>
 * This class lives in the locatium-allure module to avoid leaking Allure
 * dependencies into locatium-core or locatium-webdriver.
 */
public final class LocatiumAllureLoggers {

    private LocatiumAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that attaches both the UID chain and the declarations.
     */
    public static ConversionLogger conversions() {
        return new AllureConversionLogger(LogDetail.BOTH);
    }

    /**
     * Creates an Allure logger with explicit detail.
     */
    public static ConversionLogger conversions(LogDetail detail) {
        return new AllureConversionLogger(detail);
    }
}
