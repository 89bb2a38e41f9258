package io.hearthwarrio.locatium.core;

/**
 * Comparison operators allowed inside an attribute condition.
 */
public enum ComparisonOperator {
    EQ("="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its source symbol.
     *
     * @param symbol operator text, e.g. "&lt;="
     * @return matching operator, or null when the symbol is not a comparison (e.g. a bare "!")
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
