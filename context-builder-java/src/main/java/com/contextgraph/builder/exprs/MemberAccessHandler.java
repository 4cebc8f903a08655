package com.contextgraph.builder.exprs;

import com.contextgraph.builder.ast.Expression;
import com.contextgraph.builder.ast.Identifier;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.Function;
import com.contextgraph.graph.node.Node;

import java.util.List;

/**
 * {@code base.member}: a new value linked to its base by {@code ATTR_ACCESS}. Member types and
 * ranges are not tracked.
 */
class MemberAccessHandler {

    private final ContextGraph graph;
    private final ExpressionDispatcher dispatcher;

    MemberAccessHandler(ContextGraph graph, ExpressionDispatcher dispatcher) {
        this.graph = graph;
        this.dispatcher = dispatcher;
    }

    List<NodeIdx> memberAccess(Loc loc, Expression baseExpr, Identifier member, ContextNode ctx) {
        NodeIdx base = dispatcher.evaluateSingle(baseExpr, ctx, "member access base");
        String name = displayName(graph.node(base)) + "." + member.name();
        NodeIdx attr = graph.addNode(ContextVar.named(name, loc, null, null));
        graph.addEdge(attr, base, Edge.ATTR_ACCESS);
        return List.of(attr);
    }

    static String displayName(Node node) {
        if (node instanceof ContextVar) {
            return ((ContextVar) node).getDisplayName();
        }
        if (node instanceof Function) {
            return ((Function) node).name();
        }
        return node.label();
    }
}
