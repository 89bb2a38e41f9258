package io.hearthwarrio.locatium.core;

/**
 * One condition inside a step predicate.
 * <p>
 * Implemented by {@link AttributeCondition} and {@link PositionCondition}; consumers
 * switch over {@link #kind()} so that every variant is handled.
 */
public interface PredicateCondition {

    enum Kind {
        ATTRIBUTE,
        POSITION
    }

    Kind kind();
}
