package io.hearthwarrio.locatium.webdriver;

/**
 * Thrown when a Selenium locator has no equivalent in the supported XPath subset
 * (CSS selectors, class names, link texts, chained locators, ...).
 */
public class UnsupportedLocatorException extends RuntimeException {
    public UnsupportedLocatorException(String message) {
        super(message);
    }
}
