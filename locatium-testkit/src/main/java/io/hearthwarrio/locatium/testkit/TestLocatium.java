package io.hearthwarrio.locatium.testkit;

import io.hearthwarrio.locatium.core.ConversionLogger;
import io.hearthwarrio.locatium.core.LocatorPipeline;
import io.hearthwarrio.locatium.core.LogDetail;
import io.hearthwarrio.locatium.webdriver.PageObjectLocators;

import java.util.Objects;

/**
 * Convenience factory methods for creating Locatium pipelines in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestLocatium {

    private TestLocatium() {
        // utility class
    }

    /**
     * Creates a default pipeline without logging.
     */
    public static LocatorPipeline plain() {
        return LocatorPipeline.defaults();
    }

    /**
     * Creates a default pipeline with stdout conversion logging enabled.
     */
    public static LocatorPipeline stdout(LogDetail detail) {
        Objects.requireNonNull(detail, "detail must not be null");
        return LocatorPipeline.defaults().withLoggingToStdOut(detail);
    }

    /**
     * Creates a default pipeline reporting to the given logger.
     */
    public static LocatorPipeline recording(ConversionLogger logger) {
        Objects.requireNonNull(logger, "logger must not be null");
        return LocatorPipeline.defaults().withLogger(logger);
    }

    /**
     * Creates a page-object scanner on top of the given pipeline.
     */
    public static PageObjectLocators pageObjects(LocatorPipeline pipeline) {
        Objects.requireNonNull(pipeline, "pipeline must not be null");
        return new PageObjectLocators(pipeline);
    }
}
