package com.contextgraph.graph.range;

/**
 * One endpoint of a {@link SolcRange}: a concrete number, a deferred reference to another
 * node's endpoint, or an arithmetic expression over endpoints. Resolution happens in a later
 * pass; nothing here evaluates.
 */
public interface RangeElem {

    /** True when the element, and everything it is built from, is concrete. */
    boolean isConcrete();
}
