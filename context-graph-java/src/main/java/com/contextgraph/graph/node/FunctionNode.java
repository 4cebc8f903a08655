package com.contextgraph.graph.node;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.NodeIdx;

import java.util.List;
import java.util.Optional;

public record FunctionNode(NodeIdx idx) {

    public Function underlying(ContextGraph graph) {
        return graph.node(idx, Function.class);
    }

    public String name(ContextGraph graph) {
        return underlying(graph).name();
    }

    /** Contract the function is declared in; empty for a free function. */
    public Optional<NodeIdx> contract(ContextGraph graph) {
        return graph.firstTarget(idx, Edge.FUNC);
    }

    public List<NodeIdx> params(ContextGraph graph) {
        return graph.sources(idx, Edge.FUNCTION_PARAM);
    }

    public List<NodeIdx> returns(ContextGraph graph) {
        return graph.sources(idx, Edge.FUNCTION_RETURN);
    }

    /** Top-level body scope, if the body has been built. */
    public Optional<ContextNode> body(ContextGraph graph) {
        return graph.sources(idx, Edge.CONTEXT).stream().findFirst().map(ContextNode::new);
    }
}
