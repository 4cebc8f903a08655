package com.contextgraph.graph.node;

import com.contextgraph.graph.Loc;

/**
 * Declared output slot of a function. {@code name} is null for unnamed returns.
 */
public record FunctionReturn(Loc loc, String typeName, String name) implements Node {

    @Override
    public String label() {
        return "return " + typeName + (name != null ? " " + name : "");
    }
}
