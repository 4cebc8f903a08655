package com.contextgraph.graph.node;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.NodeIdx;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Interning table from builtin type descriptor to its single graph node. One registry is shared
 * by every function of an analysis, so node identity can stand in for type equality.
 */
public class BuiltinRegistry {

    private final Map<Builtin, NodeIdx> builtins = new LinkedHashMap<>();

    public Optional<NodeIdx> get(Builtin builtin) {
        return Optional.ofNullable(builtins.get(builtin));
    }

    /**
     * Returns the node registered for a structurally equal descriptor, creating and registering
     * one on first use.
     */
    public NodeIdx intern(ContextGraph graph, Builtin builtin) {
        NodeIdx existing = builtins.get(builtin);
        if (existing != null) {
            return existing;
        }
        NodeIdx idx = graph.addNode(builtin);
        builtins.put(builtin, idx);
        return idx;
    }

    public int size() {
        return builtins.size();
    }
}
