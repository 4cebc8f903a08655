package com.contextgraph.graph.range;

import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;

/**
 * Deferred endpoint: equal to whatever {@code side} of {@code node}'s range resolves to.
 */
public record Dynamic(NodeIdx node, DynamicRangeSide side, Loc loc) implements RangeElem {

    @Override
    public boolean isConcrete() {
        return false;
    }

    @Override
    public String toString() {
        return side.name().toLowerCase() + "(" + node + ")";
    }
}
