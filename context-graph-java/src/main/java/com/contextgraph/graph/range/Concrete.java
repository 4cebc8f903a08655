package com.contextgraph.graph.range;

import com.contextgraph.graph.Loc;

import java.math.BigInteger;

public record Concrete(BigInteger value, Loc loc) implements RangeElem {

    public static Concrete of(long value, Loc loc) {
        return new Concrete(BigInteger.valueOf(value), loc);
    }

    @Override
    public boolean isConcrete() {
        return true;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
