package com.contextgraph.graph.range;

import com.contextgraph.graph.Loc;

import java.math.BigInteger;

/**
 * Inclusive value range of one variable version.
 */
public record SolcRange(RangeElem min, RangeElem max) {

    public static SolcRange exact(BigInteger value, Loc loc) {
        Concrete c = new Concrete(value, loc);
        return new SolcRange(c, c);
    }

    public static SolcRange between(BigInteger min, BigInteger max, Loc loc) {
        return new SolcRange(new Concrete(min, loc), new Concrete(max, loc));
    }

    public SolcRange withMin(RangeElem newMin) {
        return new SolcRange(newMin, max);
    }

    public SolcRange withMax(RangeElem newMax) {
        return new SolcRange(min, newMax);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
