package com.contextgraph.builder.ast;

import com.contextgraph.graph.Loc;

import java.util.List;

/**
 * {@code body} is null for functions without an implementation.
 */
public record FunctionDefinition(
        Loc loc,
        String name,
        List<Parameter> params,
        List<Parameter> returns,
        Statement body
) {}
