package com.contextgraph.builder.ast;

public enum UnaryOperator {
    NOT("!"),
    NEGATE("-"),
    BITWISE_NOT("~"),
    PRE_INCREMENT("++"),
    PRE_DECREMENT("--"),
    POST_INCREMENT("++"),
    POST_DECREMENT("--"),
    DELETE("delete");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
