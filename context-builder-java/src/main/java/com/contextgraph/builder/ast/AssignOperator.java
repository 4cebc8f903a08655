package com.contextgraph.builder.ast;

/**
 * Compound assignment operators ({@code x op= y}).
 */
public enum AssignOperator {
    ASSIGN_ADD("+="),
    ASSIGN_SUBTRACT("-="),
    ASSIGN_MULTIPLY("*="),
    ASSIGN_DIVIDE("/="),
    ASSIGN_MODULO("%="),
    ASSIGN_SHIFT_LEFT("<<="),
    ASSIGN_SHIFT_RIGHT(">>="),
    ASSIGN_AND("&="),
    ASSIGN_OR("|="),
    ASSIGN_XOR("^=");

    private final String symbol;

    AssignOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
