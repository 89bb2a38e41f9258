package io.hearthwarrio.locatium.core.classify;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static io.hearthwarrio.locatium.core.classify.ClassificationRule.contains;
import static io.hearthwarrio.locatium.core.classify.ClassificationRule.exact;
import static io.hearthwarrio.locatium.core.classify.ClassificationRule.suffix;

/**
 * Classifies HTML-like tag names into Qt widget archetypes.
 * <p>
 * Rules run top to bottom and the first match wins: custom rules, then exact names, then
 * suffixes, then substrings, then the fallback label. The rule sets overlap ("textfield"
 * ends with "field" and also contains "text"), so the order is part of the contract.
 * <p>
 * A custom rule whose id equals a built-in rule's id (for example {@code "suffix:view"})
 * replaces that rule in its own slot instead of running first. When several custom rules
 * share an id, the last one given wins.
 * <p>
 * Immutable; {@code with...} methods return a new classifier.
 */
public final class HeuristicQtClassifier implements TagClassifier {

    /**
     * Built-in rules in evaluation order.
     */
    public static final List<ClassificationRule> DEFAULT_RULES = List.of(
            exact("button", QtArchetypes.PUSH_BUTTON),
            exact("container", QtArchetypes.SCROLL_VIEW),
            exact("form", QtArchetypes.MODULE),
            exact("textfield", QtArchetypes.TEXT_FIELD),

            suffix("button", QtArchetypes.PUSH_BUTTON),
            suffix("checkbox", QtArchetypes.CHECK_BOX),
            suffix("radiobutton", QtArchetypes.RADIO_BUTTON),
            suffix("combobox", QtArchetypes.COMBO_BOX),
            suffix("slider", QtArchetypes.SLIDER),
            suffix("label", QtArchetypes.LABEL),
            suffix("view", QtArchetypes.SCROLL_VIEW),
            suffix("field", QtArchetypes.TEXT_FIELD),

            contains("button", QtArchetypes.PUSH_BUTTON),
            contains("field", QtArchetypes.TEXT_FIELD),
            contains("text", QtArchetypes.TEXT_FIELD),
            contains("container", QtArchetypes.SCROLL_VIEW),
            contains("panel", QtArchetypes.SCROLL_VIEW),
            contains("form", QtArchetypes.MODULE)
    );

    private final List<ClassificationRule> customRules;
    private final List<ClassificationRule> rules;
    private final String fallbackLabel;

    public HeuristicQtClassifier() {
        this(List.of(), QtArchetypes.WIDGET);
    }

    private HeuristicQtClassifier(List<? extends ClassificationRule> customRules, String fallbackLabel) {
        this.customRules = withoutNulls(customRules);
        this.fallbackLabel = Objects.requireNonNull(fallbackLabel, "fallbackLabel must not be null");
        this.rules = effectiveRules(this.customRules);
    }

    private static List<ClassificationRule> withoutNulls(List<? extends ClassificationRule> rules) {
        List<ClassificationRule> out = new ArrayList<>();
        if (rules != null) {
            for (ClassificationRule r : rules) {
                if (r != null) {
                    out.add(r);
                }
            }
        }
        return List.copyOf(out);
    }

    private static List<ClassificationRule> effectiveRules(List<ClassificationRule> customRules) {
        Map<String, ClassificationRule> customById = new LinkedHashMap<>();
        for (ClassificationRule r : customRules) {
            customById.put(r.id(), r);
        }

        Map<String, ClassificationRule> overrides = new LinkedHashMap<>();
        for (ClassificationRule builtIn : DEFAULT_RULES) {
            ClassificationRule replacement = customById.remove(builtIn.id());
            if (replacement != null) {
                overrides.put(builtIn.id(), replacement);
            }
        }

        List<ClassificationRule> leading = new ArrayList<>(customById.values());
        leading.sort(Comparator.comparingInt(ClassificationRule::order).thenComparing(ClassificationRule::id));

        List<ClassificationRule> all = new ArrayList<>(leading);
        for (ClassificationRule builtIn : DEFAULT_RULES) {
            all.add(overrides.getOrDefault(builtIn.id(), builtIn));
        }
        return List.copyOf(all);
    }

    /**
     * Returns a classifier that evaluates the given rules before the built-in ones, except
     * for rules reusing a built-in id, which take that built-in rule's place.
     *
     * @param customRules project-specific rules (may be null/empty)
     * @return new classifier
     */
    public HeuristicQtClassifier withRules(List<? extends ClassificationRule> customRules) {
        return new HeuristicQtClassifier(customRules, fallbackLabel);
    }

    /**
     * Returns a classifier with a different label for tags no rule matches.
     */
    public HeuristicQtClassifier withFallbackLabel(String label) {
        return new HeuristicQtClassifier(customRules, label);
    }

    /**
     * Effective rules in evaluation order: new custom rules by order then id, then the
     * built-in list with overrides applied.
     */
    public List<ClassificationRule> getRules() {
        return rules;
    }

    public String getFallbackLabel() {
        return fallbackLabel;
    }

    @Override
    public String classify(String tagName) {
        if (tagName == null) {
            return fallbackLabel;
        }
        String tag = tagName.toLowerCase(Locale.ROOT);
        for (ClassificationRule rule : rules) {
            if (rule.matches(tag)) {
                return rule.label();
            }
        }
        return fallbackLabel;
    }
}
