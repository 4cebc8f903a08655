package com.contextgraph.graph.node;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.NodeIdx;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Index handle for a {@link Context} node. All queries go through the graph passed in.
 */
public record ContextNode(NodeIdx idx) {

    public Context underlying(ContextGraph graph) {
        return graph.node(idx, Context.class);
    }

    /**
     * @throws IrException MISSING_ENCLOSING_FUNCTION when no {@code CONTEXT} edge is reachable
     */
    public FunctionNode associatedFn(ContextGraph graph) {
        return graph.searchForAncestor(idx, Edge.CONTEXT)
                .map(FunctionNode::new)
                .orElseThrow(() -> IrException.missingEnclosingFunction(idx));
    }

    public String associatedFnName(ContextGraph graph) {
        return associatedFn(graph).name(graph);
    }

    /** Enclosing scope for nested blocks; empty for a function's top-level body. */
    public Optional<ContextNode> parentContext(ContextGraph graph) {
        return graph.firstTarget(idx, Edge.SUBCONTEXT).map(ContextNode::new);
    }

    public List<ContextVarNode> vars(ContextGraph graph) {
        return graph.sources(idx, Edge.VARIABLE).stream()
                .map(ContextVarNode::new)
                .collect(Collectors.toList());
    }

    /** First variable attached to this scope with the given name, in edge insertion order. */
    public Optional<ContextVarNode> varByName(ContextGraph graph, String name) {
        for (NodeIdx source : graph.sources(idx, Edge.VARIABLE)) {
            ContextVarNode cvar = new ContextVarNode(source);
            if (cvar.underlying(graph).getName().equals(name)) {
                return Optional.of(cvar);
            }
        }
        return Optional.empty();
    }

    public Optional<ContextVarNode> latestVarByName(ContextGraph graph, String name) {
        return varByName(graph, name).map(v -> v.latestVersion(graph));
    }

    /** Mints a fresh temporary id unique within this context. */
    public int newTmp(ContextGraph graph) {
        return underlying(graph).nextTmp();
    }

    public List<NodeIdx> returnNodes(ContextGraph graph) {
        return graph.sources(idx, Edge.RETURN);
    }

    public List<NodeIdx> callNodes(ContextGraph graph) {
        return graph.sources(idx, Edge.CALL);
    }
}
