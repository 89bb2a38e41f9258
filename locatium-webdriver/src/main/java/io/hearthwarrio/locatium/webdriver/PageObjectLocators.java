package io.hearthwarrio.locatium.webdriver;

import io.hearthwarrio.locatium.core.Locator;
import io.hearthwarrio.locatium.core.LocatorPipeline;
import org.openqa.selenium.By;
import org.openqa.selenium.support.FindAll;
import org.openqa.selenium.support.FindBy;
import org.openqa.selenium.support.FindBys;
import org.openqa.selenium.support.pagefactory.Annotations;

import java.lang.reflect.Field;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds locator declarations from a Selenium page-object class.
 * <p>
 * Every field annotated with {@link FindBy}, {@link FindBys} or {@link FindAll} is resolved
 * to a {@link By} through Selenium's own {@link Annotations}, converted to XPath with
 * {@link SeleniumXPaths} and run through the pipeline. Nothing is looked up in a browser.
 * <p>
 * Fields whose strategy has no XPath form are reported in
 * {@link PageObjectDeclarations#getSkippedFields()}. A field whose XPath does not parse
 * fails the whole scan with the pipeline's exception.
 */
public final class PageObjectLocators {

    private final LocatorPipeline pipeline;

    public PageObjectLocators() {
        this(LocatorPipeline.defaults());
    }

    public PageObjectLocators(LocatorPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /**
     * Scans the class and its superclasses (subclass fields first, each class's fields by
     * name, so the output does not depend on reflection order).
     *
     * @param pageClass page-object class
     * @return converted and skipped fields plus rendered declarations
     */
    public PageObjectDeclarations scan(Class<?> pageClass) {
        Objects.requireNonNull(pageClass, "pageClass must not be null");

        Map<String, List<Locator>> locators = new LinkedHashMap<>();
        Map<String, String> skipped = new LinkedHashMap<>();

        Class<?> cls = pageClass;
        while (cls != null && cls != Object.class) {
            Field[] fields = cls.getDeclaredFields();
            Arrays.sort(fields, Comparator.comparing(Field::getName));
            for (Field f : fields) {
                if (!isAnnotated(f) || locators.containsKey(f.getName()) || skipped.containsKey(f.getName())) {
                    continue;
                }
                String xpath;
                try {
                    xpath = SeleniumXPaths.toXPath(new Annotations(f).buildBy());
                } catch (UnsupportedLocatorException | IllegalArgumentException e) {
                    skipped.put(f.getName(), e.getMessage());
                    continue;
                }
                locators.put(f.getName(), pipeline.locate(xpath));
            }
            cls = cls.getSuperclass();
        }

        String declarations = pipeline.render(PageObjectDeclarations.distinct(locators));
        return new PageObjectDeclarations(pageClass, locators, skipped, declarations);
    }

    private static boolean isAnnotated(Field f) {
        return f.isAnnotationPresent(FindBy.class)
                || f.isAnnotationPresent(FindBys.class)
                || f.isAnnotationPresent(FindAll.class);
    }
}
