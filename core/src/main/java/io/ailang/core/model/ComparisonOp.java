package io.ailang.core.model;

/** Comparison operators allowed in conditions. {@code =} and {@code ==} are both loose equality. */
public enum ComparisonOp {
    EQ("="),
    EQ_EQ("=="),
    GE(">="),
    LE("<="),
    GT(">"),
    LT("<");

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    /** The operator as written in source. */
    public String symbol() {
        return symbol;
    }

    /**
     * Resolves an operator from its source symbol.
     *
     * @throws IllegalArgumentException if the symbol is not a comparison operator
     */
    public static ComparisonOp fromSymbol(String symbol) {
        for (ComparisonOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: '" + symbol + "'");
    }
}
