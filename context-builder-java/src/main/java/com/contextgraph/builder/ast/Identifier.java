package com.contextgraph.builder.ast;

import com.contextgraph.graph.Loc;

public record Identifier(Loc loc, String name) {

    @Override
    public String toString() {
        return name;
    }
}
