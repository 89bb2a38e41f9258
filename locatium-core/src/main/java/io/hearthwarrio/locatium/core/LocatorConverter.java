package io.hearthwarrio.locatium.core;

import java.util.List;

/**
 * Turns parsed steps into locators.
 */
@FunctionalInterface
public interface LocatorConverter {

    /**
     * Convert steps to locators, one per step, in step order.
     * <p>
     * Must not fail for any step list a {@link StepParser} can produce.
     *
     * @param steps parsed steps
     * @return freshly allocated locator list
     */
    List<Locator> convert(List<LocationStep> steps);
}
