package io.hearthwarrio.locatium.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered conditions of one bracketed predicate.
 * <p>
 * {@code and}/{@code or} between conditions are accepted by the parser but not kept:
 * every condition applies.
 */
public final class Predicate {

    private final List<PredicateCondition> conditions;

    public Predicate(List<? extends PredicateCondition> conditions) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        this.conditions = List.copyOf(conditions);
    }

    public List<PredicateCondition> getConditions() {
        return conditions;
    }

    /**
     * Attribute conditions in source order.
     */
    public List<AttributeCondition> attributeConditions() {
        List<AttributeCondition> out = new ArrayList<>();
        for (PredicateCondition c : conditions) {
            switch (c.kind()) {
                case ATTRIBUTE -> out.add((AttributeCondition) c);
                case POSITION -> {
                }
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Predicate && ((Predicate) o).conditions.equals(conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return conditions.toString();
    }
}
