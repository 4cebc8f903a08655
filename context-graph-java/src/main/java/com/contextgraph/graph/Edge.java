package com.contextgraph.graph;

/**
 * Tags carried by directed edges of the context graph.
 */
public enum Edge {
    // Declarations
    FUNC,
    FUNCTION_PARAM,
    FUNCTION_RETURN,

    // Control flow
    CONTEXT,
    SUBCONTEXT,
    CALL,

    // Context variables
    VARIABLE,
    INHERITED_VARIABLE,

    ATTR_ACCESS,
    INDEX,
    INDEX_ACCESS,

    // Variable incoming edges
    ASSIGN,
    STORAGE_ASSIGN,
    MEMORY_ASSIGN,
    PREV,

    RETURN,

    // Range analysis
    RANGE;

    public boolean isContextEdge() {
        return ordinal() >= CONTEXT.ordinal();
    }
}
