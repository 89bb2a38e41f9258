package io.hearthwarrio.locatium.webdriver;

import io.hearthwarrio.locatium.core.Locator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of scanning one page-object class.
 */
public final class PageObjectDeclarations {

    private final Class<?> pageClass;
    private final Map<String, List<Locator>> locatorsByField;
    private final Map<String, String> skippedFields;
    private final String declarations;

    PageObjectDeclarations(
            Class<?> pageClass,
            Map<String, List<Locator>> locatorsByField,
            Map<String, String> skippedFields,
            String declarations
    ) {
        this.pageClass = pageClass;
        this.locatorsByField = Collections.unmodifiableMap(new LinkedHashMap<>(locatorsByField));
        this.skippedFields = Collections.unmodifiableMap(new LinkedHashMap<>(skippedFields));
        this.declarations = declarations;
    }

    public Class<?> getPageClass() {
        return pageClass;
    }

    /**
     * Converted fields in scan order; each value is the locator chain of that field.
     */
    public Map<String, List<Locator>> getLocatorsByField() {
        return locatorsByField;
    }

    /**
     * Annotated fields that could not be converted, with the reason.
     */
    public Map<String, String> getSkippedFields() {
        return skippedFields;
    }

    /**
     * Last locator of every converted field, i.e. the element the field points to.
     */
    public Map<String, Locator> getTargets() {
        Map<String, Locator> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<Locator>> e : locatorsByField.entrySet()) {
            List<Locator> chain = e.getValue();
            if (!chain.isEmpty()) {
                out.put(e.getKey(), chain.get(chain.size() - 1));
            }
        }
        return out;
    }

    /**
     * All locators of all fields, each UID once (first occurrence wins), in scan order.
     */
    public List<Locator> getDistinctLocators() {
        return distinct(locatorsByField);
    }

    /**
     * Rendered declarations of {@link #getDistinctLocators()}.
     */
    public String getDeclarations() {
        return declarations;
    }

    static List<Locator> distinct(Map<String, List<Locator>> locatorsByField) {
        Set<String> seen = new LinkedHashSet<>();
        List<Locator> out = new ArrayList<>();
        for (List<Locator> chain : locatorsByField.values()) {
            for (Locator l : chain) {
                if (seen.add(l.getUid())) {
                    out.add(l);
                }
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "PageObjectDeclarations{" +
                "page=" + pageClass.getSimpleName() +
                ", fields=" + locatorsByField.keySet() +
                ", skipped=" + skippedFields.keySet() +
                '}';
    }
}
