package com.contextgraph.graph.range;

public record RangeExpr(RangeElem lhs, Op op, RangeElem rhs) implements RangeElem {

    @Override
    public boolean isConcrete() {
        return lhs.isConcrete() && rhs.isConcrete();
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + op.symbol() + " " + rhs + ")";
    }
}
