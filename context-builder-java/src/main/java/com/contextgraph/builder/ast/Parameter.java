package com.contextgraph.builder.ast;

import com.contextgraph.graph.Loc;

/**
 * Declared parameter or return slot. {@code name} is null when unnamed.
 */
public record Parameter(Loc loc, String typeName, Identifier name) {}
