package io.hearthwarrio.locatium.core;

import java.util.Objects;
import java.util.Optional;

/**
 * One parsed path step: axis, node test and optional predicate.
 * <p>
 * Steps carry no parent reference; their order in the parsed list is the only hierarchy.
 */
public final class LocationStep {

    public static final String DEFAULT_AXIS = "child";
    public static final String WILDCARD = "*";

    private final String axis;
    private final String nodeTest;
    private final Predicate predicate;
    private final boolean absolute;

    public LocationStep(String axis, String nodeTest, Predicate predicate, boolean absolute) {
        this.axis = Objects.requireNonNull(axis, "axis must not be null");
        this.nodeTest = Objects.requireNonNull(nodeTest, "nodeTest must not be null");
        this.predicate = predicate;
        this.absolute = absolute;
    }

    /**
     * Step produced by an empty segment between two separators ({@code ///}).
     */
    public static LocationStep descendantOrSelf() {
        return new LocationStep("descendant-or-self", WILDCARD, null, true);
    }

    public String getAxis() {
        return axis;
    }

    public String getNodeTest() {
        return nodeTest;
    }

    public boolean isWildcard() {
        return WILDCARD.equals(nodeTest);
    }

    public Optional<Predicate> getPredicate() {
        return Optional.ofNullable(predicate);
    }

    public boolean isAbsolute() {
        return absolute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocationStep)) {
            return false;
        }
        LocationStep other = (LocationStep) o;
        return absolute == other.absolute
                && axis.equals(other.axis)
                && nodeTest.equals(other.nodeTest)
                && Objects.equals(predicate, other.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axis, nodeTest, predicate, absolute);
    }

    @Override
    public String toString() {
        return "LocationStep{" +
                "axis=" + axis +
                ", nodeTest=" + nodeTest +
                ", predicate=" + predicate +
                ", absolute=" + absolute +
                '}';
    }
}
