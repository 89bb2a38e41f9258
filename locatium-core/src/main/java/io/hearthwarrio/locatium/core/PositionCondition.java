package io.hearthwarrio.locatium.core;

/**
 * Positional condition, e.g. {@code [2]}.
 */
public final class PositionCondition implements PredicateCondition {

    private final int index;

    public PositionCondition(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        this.index = index;
    }

    @Override
    public Kind kind() {
        return Kind.POSITION;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PositionCondition && ((PositionCondition) o).index == index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "[" + index + "]";
    }
}
