package com.contextgraph.builder.exprs;

import com.contextgraph.builder.ast.Expression;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.Builtin;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.Node;

import java.util.List;

/**
 * Array type references ({@code uint[]}) and indexed reads ({@code a[i]}).
 */
class ArrayHandler {

    private final ContextGraph graph;
    private final BuiltinRegistry builtins;
    private final ExpressionDispatcher dispatcher;

    ArrayHandler(ContextGraph graph, BuiltinRegistry builtins, ExpressionDispatcher dispatcher) {
        this.graph = graph;
        this.builtins = builtins;
        this.dispatcher = dispatcher;
    }

    List<NodeIdx> arrayTy(Loc loc, Expression elementExpr, ContextNode ctx) {
        NodeIdx element = dispatcher.evaluateSingle(elementExpr, ctx, "array element type");
        Node node = graph.node(element);
        if (!(node instanceof Builtin)) {
            throw IrException.unsupported("array of " + node.label(), loc);
        }
        return List.of(builtins.intern(graph, new Builtin.Array((Builtin) node)));
    }

    /**
     * Creates the accessed element. It points at the array through {@code INDEX_ACCESS} and at
     * the index value through {@code INDEX}.
     */
    List<NodeIdx> indexIntoArray(Loc loc, Expression baseExpr, Expression indexExpr, ContextNode ctx) {
        NodeIdx base = dispatcher.evaluateSingle(baseExpr, ctx, "indexed expression");
        NodeIdx index = dispatcher.evaluateSingle(indexExpr, ctx, "index");

        NodeIdx elementTy = null;
        Node baseNode = graph.node(base);
        NodeIdx baseTy = baseNode instanceof ContextVar ? ((ContextVar) baseNode).getTy() : null;
        if (baseTy != null && graph.node(baseTy) instanceof Builtin.Array) {
            elementTy = builtins.intern(graph, ((Builtin.Array) graph.node(baseTy)).inner());
        }

        String name = MemberAccessHandler.displayName(graph.node(base))
                + "[" + MemberAccessHandler.displayName(graph.node(index)) + "]";
        NodeIdx access = graph.addNode(ContextVar.named(name, loc, elementTy, null));
        graph.addEdge(access, base, Edge.INDEX_ACCESS);
        graph.addEdge(access, index, Edge.INDEX);
        return List.of(access);
    }
}
