package com.contextgraph.graph.node;

import com.contextgraph.graph.Loc;

/**
 * A declared function. Global functions such as {@code require} carry {@link Loc#IMPLICIT}.
 */
public record Function(String name, Loc loc) implements Node {

    @Override
    public String label() {
        return "function " + name;
    }
}
