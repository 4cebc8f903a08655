package com.contextgraph.graph.range;

public enum DynamicRangeSide {
    MIN,
    MAX
}
