package com.contextgraph.builder.ast;

import com.contextgraph.graph.Loc;

import java.util.List;

public record ContractDefinition(Loc loc, String name, List<FunctionDefinition> functions) {}
