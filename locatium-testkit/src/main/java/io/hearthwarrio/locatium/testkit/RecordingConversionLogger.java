package io.hearthwarrio.locatium.testkit;

import io.hearthwarrio.locatium.core.ConversionLogger;
import io.hearthwarrio.locatium.core.Locator;
import io.hearthwarrio.locatium.core.LogDetail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Keeps every reported conversion in memory so tests can assert on it.
 * <p>
 * Thread-safe; entries are kept in arrival order.
 */
public final class RecordingConversionLogger implements ConversionLogger {

    /**
     * One reported conversion.
     */
    public static final class Entry {
        private final String xpath;
        private final List<Locator> locators;
        private final String declarations;

        Entry(String xpath, List<Locator> locators, String declarations) {
            this.xpath = xpath;
            this.locators = locators == null ? List.of() : List.copyOf(locators);
            this.declarations = declarations;
        }

        public String getXpath() {
            return xpath;
        }

        public List<Locator> getLocators() {
            return locators;
        }

        /**
         * Rendered text, null when the detail level did not ask for it.
         */
        public String getDeclarations() {
            return declarations;
        }
    }

    private final LogDetail detail;
    private final List<Entry> entries = Collections.synchronizedList(new ArrayList<>());

    public RecordingConversionLogger() {
        this(LogDetail.BOTH);
    }

    public RecordingConversionLogger(LogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logConversion(String xpath, List<Locator> locators, String declarations) {
        entries.add(new Entry(xpath, locators, declarations));
    }

    public List<Entry> getEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public void clear() {
        entries.clear();
    }
}
