package com.contextgraph.builder;

import com.contextgraph.builder.ast.AssignOperator;
import com.contextgraph.builder.ast.BinaryOperator;
import com.contextgraph.builder.ast.Expression;
import com.contextgraph.builder.ast.Expression.CompoundAssign;
import com.contextgraph.builder.config.BuilderConfig;
import com.contextgraph.builder.context.ContextBuilder;
import com.contextgraph.builder.context.VariableVersioning;
import com.contextgraph.builder.exprs.ExpressionDispatcher;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.*;
import com.contextgraph.graph.range.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.contextgraph.builder.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class VariableVersioningTest {

    private ContextGraph graph;
    private ExpressionDispatcher dispatcher;
    private VariableVersioning versioning;
    private ContextNode body;

    @BeforeEach
    void setUp() {
        graph = new ContextGraph();
        NodeIdx fn = graph.addNode(new Function("f", loc()));
        List<String> names = List.of("x", "y");
        for (int i = 0; i < names.size(); i++) {
            NodeIdx p = graph.addNode(new FunctionParam(loc(), "uint", names.get(i), i));
            graph.addEdge(p, fn, Edge.FUNCTION_PARAM);
        }
        ContextBuilder builder = new ContextBuilder(graph, new BuiltinRegistry(), BuilderConfig.defaults());
        dispatcher = builder.dispatcher();
        versioning = dispatcher.versioning();
        body = new ContextNode(builder.build(block(), fn, "f").getContexts().get(0));
    }

    @Test
    void assigningUnknownValueDefersBothBounds() {
        ContextVarNode y = latest("y");
        Expression assignment = assign(var("x"), var("y"));

        dispatcher.evaluate(assignment, body);

        SolcRange range = latest("x").range(graph).orElseThrow();
        Dynamic min = (Dynamic) range.min();
        Dynamic max = (Dynamic) range.max();
        assertEquals(y.idx(), min.node());
        assertEquals(DynamicRangeSide.MIN, min.side());
        assertEquals(y.idx(), max.node());
        assertEquals(DynamicRangeSide.MAX, max.side());
        assertEquals(assignment.loc(), min.loc());
        assertEquals(assignment.loc(), max.loc());
    }

    @Test
    void assigningKnownRangeCopiesIt() {
        NodeIdx result = dispatcher.evaluateSingle(assign(var("x"), num(5)), body, "assignment");

        ContextVarNode x1 = latest("x");
        assertEquals(x1.idx(), result);
        SolcRange range = x1.range(graph).orElseThrow();
        assertEquals(BigInteger.valueOf(5), ((Concrete) range.min()).value());
        assertEquals(range.min(), range.max());
    }

    @Test
    void newVersionCarriesAssignmentLocation() {
        var assignment = assign(var("x"), num(1));

        dispatcher.evaluate(assignment, body);

        assertEquals(assignment.loc(), latest("x").underlying(graph).getLoc());
        assertEquals(body.varByName(graph, "x").orElseThrow(), latest("x").firstVersion(graph));
    }

    @Test
    void repeatedWritesFormAcyclicChain() {
        for (int i = 0; i < 4; i++) {
            dispatcher.evaluate(assign(var("x"), bin(var("x"), BinaryOperator.ADD, num(1))), body);
        }

        Set<NodeIdx> seen = new HashSet<>();
        Optional<ContextVarNode> current = Optional.of(latest("x"));
        while (current.isPresent()) {
            assertTrue(seen.add(current.get().idx()), "cycle at " + current.get().idx());
            current = current.get().prevVersion(graph);
        }
        assertEquals(5, seen.size());
    }

    @Test
    void writingSupersededVersionIsStale() {
        ContextVarNode x0 = latest("x");
        dispatcher.evaluate(assign(var("x"), num(1)), body);

        IrException e = assertThrows(IrException.class, () -> versioning.advanceVar(x0, loc()));
        assertEquals(IrException.Kind.STALE_VERSION_WRITE, e.getKind());
        assertFalse(e.isRecoverable());
    }

    @Test
    void compoundAssignmentWritesOperatorResult() {
        ContextVarNode x0 = latest("x");

        NodeIdx written = dispatcher.evaluateSingle(
                new CompoundAssign(loc(), AssignOperator.ASSIGN_ADD, var("x"), num(2)), body, "compound");

        ContextVarNode x1 = latest("x");
        assertEquals(x1.idx(), written);
        assertEquals(x0, x1.prevVersion(graph).orElseThrow());
        RangeExpr min = (RangeExpr) x1.range(graph).orElseThrow().min();
        assertEquals(Op.ADD, min.op());
        assertEquals(new Dynamic(x0.idx(), DynamicRangeSide.MIN, ((Dynamic) min.lhs()).loc()), min.lhs());
    }

    @Test
    void unsupportedCompoundOperator() {
        IrException e = assertThrows(IrException.class, () -> dispatcher.evaluate(
                new CompoundAssign(loc(), AssignOperator.ASSIGN_XOR, var("x"), num(2)), body));
        assertEquals(IrException.Kind.UNSUPPORTED_CONSTRUCT, e.getKind());
        assertTrue(latest("x").prevVersion(graph).isEmpty());
    }

    @Test
    void assigningToFunctionIsUnsupported() {
        graph.addNode(new Function("g", loc()));

        IrException e = assertThrows(IrException.class, () -> dispatcher.evaluate(assign(var("g"), num(1)), body));
        assertEquals(IrException.Kind.UNSUPPORTED_CONSTRUCT, e.getKind());
    }

    private ContextVarNode latest(String name) {
        return body.latestVarByName(graph, name).orElseThrow();
    }
}
