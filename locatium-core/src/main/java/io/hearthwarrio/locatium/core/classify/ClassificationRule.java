package io.hearthwarrio.locatium.core.classify;

import java.util.Locale;
import java.util.Objects;

/**
 * Single classification rule: "lower-cased tag MATCHES fragment" yields {@link #label()}.
 * <p>
 * Rules are evaluated as an ordered list, first match wins. Custom rules may declare an
 * {@link #order()} (lower runs earlier) the same way selection heuristics do.
 */
public final class ClassificationRule {

    /**
     * How the fragment is compared with the lower-cased tag.
     */
    public enum Match {
        EXACT,
        SUFFIX,
        CONTAINS
    }

    private final String id;
    private final int order;
    private final Match match;
    private final String fragment;
    private final String label;

    public ClassificationRule(String id, int order, Match match, String fragment, String label) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.order = order;
        this.match = Objects.requireNonNull(match, "match must not be null");
        this.fragment = Objects.requireNonNull(fragment, "fragment must not be null").toLowerCase(Locale.ROOT);
        this.label = Objects.requireNonNull(label, "label must not be null");
    }

    public static ClassificationRule exact(String fragment, String label) {
        return of(Match.EXACT, fragment, label);
    }

    public static ClassificationRule suffix(String fragment, String label) {
        return of(Match.SUFFIX, fragment, label);
    }

    public static ClassificationRule contains(String fragment, String label) {
        return of(Match.CONTAINS, fragment, label);
    }

    private static ClassificationRule of(Match match, String fragment, String label) {
        return new ClassificationRule(match.name().toLowerCase(Locale.ROOT) + ":" + fragment, 0, match, fragment, label);
    }

    /**
     * Stable identifier used in diagnostics and for de-duplication.
     */
    public String id() {
        return id;
    }

    public int order() {
        return order;
    }

    public Match match() {
        return match;
    }

    public String fragment() {
        return fragment;
    }

    public String label() {
        return label;
    }

    /**
     * @param lowerTag tag name already lower-cased with {@link Locale#ROOT}
     */
    public boolean matches(String lowerTag) {
        return switch (match) {
            case EXACT -> lowerTag.equals(fragment);
            case SUFFIX -> lowerTag.endsWith(fragment);
            case CONTAINS -> lowerTag.contains(fragment);
        };
    }

    @Override
    public String toString() {
        return "ClassificationRule{" +
                "id=" + id +
                ", order=" + order +
                ", label=" + label +
                '}';
    }
}
