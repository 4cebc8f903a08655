package com.contextgraph.graph.node;

import com.contextgraph.graph.Loc;

public record Contract(String name, Loc loc) implements Node {

    @Override
    public String label() {
        return "contract " + name;
    }
}
