package com.contextgraph.graph.range;

/**
 * Operators appearing in range expressions and temporary constructions.
 */
public enum Op {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    LT("<"),
    GT(">"),
    LTE("<="),
    GTE(">=");

    private final String symbol;

    Op(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return ordinal() >= EQ.ordinal();
    }

    /** The operator that holds after swapping the operands ({@code a < b} is {@code b > a}). */
    public Op flipped() {
        return switch (this) {
            case LT -> GT;
            case GT -> LT;
            case LTE -> GTE;
            case GTE -> LTE;
            default -> this;
        };
    }
}
