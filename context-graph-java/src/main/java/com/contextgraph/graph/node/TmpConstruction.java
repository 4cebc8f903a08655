package com.contextgraph.graph.node;

import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.range.Op;

/**
 * Records how a temporary was produced: {@code lhs op rhs}.
 */
public record TmpConstruction(NodeIdx lhs, Op op, NodeIdx rhs) {

    @Override
    public String toString() {
        return lhs + " " + op.symbol() + " " + rhs;
    }
}
