package com.contextgraph.graph;

/**
 * Stable handle of a node inside a {@link ContextGraph}. Indices are assigned on insertion
 * and never reused.
 */
public record NodeIdx(int index) implements Comparable<NodeIdx> {

    @Override
    public int compareTo(NodeIdx other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
