package io.hearthwarrio.locatium.core;

import java.util.Objects;

/**
 * Attribute comparison, e.g. {@code @name='submit'} or the bare form {@code price>35}.
 */
public final class AttributeCondition implements PredicateCondition {

    private final String name;
    private final String value;
    private final ComparisonOperator operator;

    public AttributeCondition(String name, String value, ComparisonOperator operator) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
    }

    @Override
    public Kind kind() {
        return Kind.ATTRIBUTE;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeCondition)) {
            return false;
        }
        AttributeCondition other = (AttributeCondition) o;
        return name.equals(other.name) && value.equals(other.value) && operator == other.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, operator);
    }

    @Override
    public String toString() {
        return "@" + name + operator.symbol() + "'" + value + "'";
    }
}
