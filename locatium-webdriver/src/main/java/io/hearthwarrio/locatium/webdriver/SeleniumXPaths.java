package io.hearthwarrio.locatium.webdriver;

import org.openqa.selenium.By;

import java.util.Objects;

/**
 * Converts Selenium {@link By} locators to XPath expressions understood by the core parser.
 * <p>
 * Detection relies on Selenium's {@link By#toString()} format, for example:
 * <ul>
 *   <li>"By.xpath: //div[@id='x']"</li>
 *   <li>"By.id: x"</li>
 *   <li>"By.name: x"</li>
 *   <li>"By.tagName: button"</li>
 * </ul>
 * Other strategies have no XPath form here and are rejected.
 */
public final class SeleniumXPaths {

    private static final String XPATH = "By.xpath: ";
    private static final String ID = "By.id: ";
    private static final String NAME = "By.name: ";
    private static final String TAG_NAME = "By.tagName: ";

    private SeleniumXPaths() {
        // utility class
    }

    /**
     * @param by Selenium locator
     * @return equivalent XPath
     * @throws UnsupportedLocatorException if the strategy cannot be expressed
     */
    public static String toXPath(By by) {
        Objects.requireNonNull(by, "by must not be null");
        String s = by.toString();

        if (s.startsWith(XPATH)) {
            return s.substring(XPATH.length());
        }
        if (s.startsWith(ID)) {
            return "//*[@id=" + quote(s.substring(ID.length())) + "]";
        }
        if (s.startsWith(NAME)) {
            return "//*[@name=" + quote(s.substring(NAME.length())) + "]";
        }
        if (s.startsWith(TAG_NAME)) {
            String tag = s.substring(TAG_NAME.length()).trim();
            if (tag.isEmpty()) {
                throw new UnsupportedLocatorException("Empty tag name in " + s);
            }
            return "//" + tag;
        }
        throw new UnsupportedLocatorException("No XPath form for locator: " + s);
    }

    /**
     * Quotes an attribute value for the core lexer, preferring the quote character the value
     * does not contain. Backslashes and the chosen quote are escaped with a backslash.
     */
    static String quote(String value) {
        char q = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(value.length() + 2).append(q);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == q) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append(q).toString();
    }
}
