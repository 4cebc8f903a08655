package com.contextgraph.graph;

import com.contextgraph.graph.node.*;
import com.contextgraph.graph.range.Concrete;
import com.contextgraph.graph.range.Dynamic;
import com.contextgraph.graph.range.DynamicRangeSide;
import com.contextgraph.graph.range.SolcRange;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextVarNodeTest {

    private static final Loc LOC = Loc.of(0, 5, 6);

    @Test
    void versionWalksInBothDirections() {
        ContextGraph graph = new ContextGraph();
        ContextVarNode v0 = new ContextVarNode(graph.addNode(ContextVar.named("x", LOC, null, null)));
        ContextVarNode v1 = new ContextVarNode(graph.addNode(ContextVar.named("x", LOC, null, null)));
        ContextVarNode v2 = new ContextVarNode(graph.addNode(ContextVar.named("x", LOC, null, null)));
        graph.addEdge(v1.idx(), v0.idx(), Edge.PREV);
        graph.addEdge(v2.idx(), v1.idx(), Edge.PREV);

        assertEquals(v2, v0.latestVersion(graph));
        assertEquals(v2, v1.latestVersion(graph));
        assertEquals(v0, v2.firstVersion(graph));
        assertEquals(Optional.of(v0), v1.prevVersion(graph));
        assertEquals(Optional.of(v2), v1.nextVersion(graph));
        assertFalse(v0.isLatest(graph));
        assertTrue(v2.isLatest(graph));
        assertEquals(v2, v2.latestVersion(graph));
    }

    @Test
    void settingOneBoundKeepsTheOther() {
        ContextGraph graph = new ContextGraph();
        ContextVarNode v = new ContextVarNode(graph.addNode(
                ContextVar.named("x", LOC, null, SolcRange.between(BigInteger.ZERO, BigInteger.TEN, LOC))));

        v.setRangeMax(graph, Concrete.of(5, LOC));
        SolcRange range = v.range(graph).orElseThrow();
        assertEquals(Concrete.of(0, LOC), range.min());
        assertEquals(Concrete.of(5, LOC), range.max());
    }

    @Test
    void settingBoundOnUnknownRangeUsesItForBothEnds() {
        ContextGraph graph = new ContextGraph();
        NodeIdx y = graph.addNode(ContextVar.named("y", LOC, null, null));
        ContextVarNode x = new ContextVarNode(graph.addNode(ContextVar.named("x", LOC, null, null)));
        assertTrue(x.range(graph).isEmpty());

        Dynamic min = new Dynamic(y, DynamicRangeSide.MIN, LOC);
        Dynamic max = new Dynamic(y, DynamicRangeSide.MAX, LOC);
        x.setRangeMin(graph, min);
        x.setRangeMax(graph, max);

        assertEquals(new SolcRange(min, max), x.range(graph).orElseThrow());
        assertEquals("x", x.name(graph));
    }

    @Test
    void handleOverWrongKindFails() {
        ContextGraph graph = new ContextGraph();
        NodeIdx ctx = graph.addNode(new Context(LOC, false));

        IrException e = assertThrows(IrException.class, () -> new ContextVarNode(ctx).underlying(graph));
        assertEquals(IrException.Kind.NODE_KIND_MISMATCH, e.getKind());
    }
}
