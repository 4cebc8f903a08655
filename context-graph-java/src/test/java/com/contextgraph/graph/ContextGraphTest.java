package com.contextgraph.graph;

import com.contextgraph.graph.node.Context;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.Function;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextGraphTest {

    private static final Loc LOC = Loc.of(0, 1, 2);

    @Test
    void nodeIndicesAreStableAcrossInsertions() {
        ContextGraph graph = new ContextGraph();
        NodeIdx first = graph.addNode(new Function("f", LOC));
        NodeIdx second = graph.addNode(new Context(LOC, false));
        for (int i = 0; i < 10; i++) {
            graph.addNode(new Context(LOC, false));
        }
        assertEquals(0, first.index());
        assertEquals(1, second.index());
        assertEquals("f", graph.node(first, Function.class).name());
        assertEquals(12, graph.nodeCount());
    }

    @Test
    void typedLookupOfWrongKindThrowsNodeKindMismatch() {
        ContextGraph graph = new ContextGraph();
        NodeIdx fn = graph.addNode(new Function("f", LOC));

        IrException e = assertThrows(IrException.class, () -> graph.node(fn, Context.class));
        assertEquals(IrException.Kind.NODE_KIND_MISMATCH, e.getKind());
        assertFalse(e.isRecoverable());
        assertTrue(e.getMessage().contains("Context"), e.getMessage());
    }

    @Test
    void incomingEdgesFilteredByTagInInsertionOrder() {
        ContextGraph graph = new ContextGraph();
        NodeIdx ctx = graph.addNode(new Context(LOC, false));
        NodeIdx a = graph.addNode(ContextVar.named("a", LOC, null, null));
        NodeIdx b = graph.addNode(ContextVar.named("b", LOC, null, null));
        NodeIdx c = graph.addNode(ContextVar.named("c", LOC, null, null));
        graph.addEdge(b, ctx, Edge.VARIABLE);
        graph.addEdge(c, ctx, Edge.RETURN);
        graph.addEdge(a, ctx, Edge.VARIABLE);

        assertEquals(List.of(b, a), graph.sources(ctx, Edge.VARIABLE));
        assertEquals(List.of(c), graph.sources(ctx, Edge.RETURN));
        assertTrue(graph.sources(ctx, Edge.CALL).isEmpty());
        assertEquals(List.of(ctx), graph.targets(a, Edge.VARIABLE));
    }

    @Test
    void parallelEdgesAreKept() {
        ContextGraph graph = new ContextGraph();
        NodeIdx ctx = graph.addNode(new Context(LOC, false));
        NodeIdx v = graph.addNode(ContextVar.named("v", LOC, null, null));
        graph.addEdge(v, ctx, Edge.CALL);
        graph.addEdge(v, ctx, Edge.CALL);
        graph.addEdge(v, ctx, Edge.RETURN);

        assertEquals(3, graph.edgeCount());
        assertEquals(2, graph.sources(ctx, Edge.CALL).size());
    }

    @Test
    void ancestorSearchFollowsOutgoingEdgesBreadthFirst() {
        ContextGraph graph = new ContextGraph();
        NodeIdx fn = graph.addNode(new Function("f", LOC));
        NodeIdx outer = graph.addNode(new Context(LOC, false));
        NodeIdx middle = graph.addNode(new Context(LOC, false));
        NodeIdx inner = graph.addNode(new Context(LOC, false));
        graph.addEdge(outer, fn, Edge.CONTEXT);
        graph.addEdge(middle, outer, Edge.SUBCONTEXT);
        graph.addEdge(inner, middle, Edge.SUBCONTEXT);

        assertEquals(Optional.of(fn), graph.searchForAncestor(inner, Edge.CONTEXT));
        assertEquals(Optional.of(middle), graph.searchForAncestor(inner, Edge.SUBCONTEXT));
        assertTrue(graph.searchForAncestor(fn, Edge.CONTEXT).isEmpty());
    }

    @Test
    void ancestorSearchTerminatesOnCycles() {
        ContextGraph graph = new ContextGraph();
        NodeIdx a = graph.addNode(new Context(LOC, false));
        NodeIdx b = graph.addNode(new Context(LOC, false));
        graph.addEdge(a, b, Edge.SUBCONTEXT);
        graph.addEdge(b, a, Edge.SUBCONTEXT);

        assertTrue(graph.searchForAncestor(a, Edge.CONTEXT).isEmpty());
    }

    @Test
    void edgeToUnknownNodeIsRejected() {
        ContextGraph graph = new ContextGraph();
        NodeIdx ctx = graph.addNode(new Context(LOC, false));
        assertThrows(IndexOutOfBoundsException.class, () -> graph.addEdge(ctx, new NodeIdx(7), Edge.SUBCONTEXT));
    }
}
