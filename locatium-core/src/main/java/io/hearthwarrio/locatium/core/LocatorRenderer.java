package io.hearthwarrio.locatium.core;

import java.util.List;

/**
 * Renders locators into a textual declaration.
 */
@FunctionalInterface
public interface LocatorRenderer {

    /**
     * @param locators locators in emission order
     * @return rendered text; purely textual, no validation
     */
    String render(List<Locator> locators);
}
