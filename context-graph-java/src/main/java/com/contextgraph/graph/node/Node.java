package com.contextgraph.graph.node;

/**
 * Marker for everything stored in a {@link com.contextgraph.graph.ContextGraph}.
 */
public interface Node {

    /** Short human-readable label used in logs and graph exports. */
    String label();
}
