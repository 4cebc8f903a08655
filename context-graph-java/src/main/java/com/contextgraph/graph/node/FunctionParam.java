package com.contextgraph.graph.node;

import com.contextgraph.graph.Loc;

/**
 * Declared input of a function. {@code name} is null for unnamed parameters.
 */
public record FunctionParam(Loc loc, String typeName, String name, int order) implements Node {

    @Override
    public String label() {
        return "param " + typeName + (name != null ? " " + name : "");
    }
}
