package com.contextgraph.graph;

import com.contextgraph.graph.node.*;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextVarFactoryTest {

    private static final Loc LOC = Loc.of(0, 3, 9);

    @Test
    void namedBuiltinParamBecomesVariableWithoutRange() {
        ContextGraph graph = new ContextGraph();
        BuiltinRegistry builtins = new BuiltinRegistry();
        ContextVarFactory factory = new ContextVarFactory(builtins);

        ContextVar x = factory.fromFunctionParam(graph, new FunctionParam(LOC, "uint", "x", 0)).orElseThrow();

        assertEquals("x", x.getName());
        assertEquals(LOC, x.getLoc());
        assertNull(x.getRange());
        assertFalse(x.isTmp());
        assertEquals(builtins.get(Builtin.UINT256).orElseThrow(), x.getTy());
    }

    @Test
    void paramsAndReturnsShareInternedTypes() {
        ContextGraph graph = new ContextGraph();
        BuiltinRegistry builtins = new BuiltinRegistry();
        ContextVarFactory factory = new ContextVarFactory(builtins);

        ContextVar x = factory.fromFunctionParam(graph, new FunctionParam(LOC, "uint256", "x", 0)).orElseThrow();
        ContextVar y = factory.fromFunctionReturn(graph, new FunctionReturn(LOC, "uint", "y")).orElseThrow();

        assertEquals(x.getTy(), y.getTy());
        assertEquals(1, builtins.size());
    }

    @Test
    void declinesUnnamedAndNonElementaryDeclarations() {
        ContextGraph graph = new ContextGraph();
        ContextVarFactory factory = new ContextVarFactory(new BuiltinRegistry());

        assertEquals(Optional.empty(), factory.fromFunctionParam(graph, new FunctionParam(LOC, "uint", null, 0)));
        assertEquals(Optional.empty(), factory.fromFunctionReturn(graph, new FunctionReturn(LOC, "bool", "")));
        assertEquals(Optional.empty(), factory.fromFunctionParam(graph, new FunctionParam(LOC, "Vault", "v", 1)));
        assertEquals(0, graph.nodeCount());
    }
}
