package com.contextgraph.graph;

import org.jgrapht.graph.DefaultEdge;

/**
 * JGraphT edge object carrying an {@link Edge} tag. A fresh instance is created per insertion,
 * so parallel edges between the same pair of nodes stay distinct.
 */
public class GraphEdge extends DefaultEdge {

    private final Edge kind;

    public GraphEdge(Edge kind) {
        this.kind = kind;
    }

    public Edge getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return String.format("%s ---%s---> %s", getSource(), kind, getTarget());
    }
}
