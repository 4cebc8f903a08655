package com.contextgraph.builder.exprs;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.Node;
import com.contextgraph.graph.range.Dynamic;
import com.contextgraph.graph.range.DynamicRangeSide;
import com.contextgraph.graph.range.RangeElem;
import com.contextgraph.graph.range.SolcRange;

/**
 * Endpoint of a node as seen from another range: its own bound when the node has a range,
 * otherwise a deferred reference to it.
 */
final class Bounds {

    private Bounds() {}

    static RangeElem min(ContextGraph graph, NodeIdx idx, Loc loc) {
        return side(graph, idx, DynamicRangeSide.MIN, loc);
    }

    static RangeElem max(ContextGraph graph, NodeIdx idx, Loc loc) {
        return side(graph, idx, DynamicRangeSide.MAX, loc);
    }

    private static RangeElem side(ContextGraph graph, NodeIdx idx, DynamicRangeSide side, Loc loc) {
        Node node = graph.node(idx);
        if (node instanceof ContextVar && ((ContextVar) node).getRange() != null) {
            SolcRange range = ((ContextVar) node).getRange();
            return side == DynamicRangeSide.MIN ? range.min() : range.max();
        }
        return new Dynamic(idx, side, loc);
    }
}
