package com.contextgraph.graph.node;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Turns declared function inputs and outputs into initial variable versions.
 * Declines unnamed declarations (nothing can refer to them) and non-elementary types.
 */
public class ContextVarFactory {

    private static final Logger LOG = LogManager.getLogger(ContextVarFactory.class);

    private final BuiltinRegistry builtins;

    public ContextVarFactory(BuiltinRegistry builtins) {
        this.builtins = builtins;
    }

    public Optional<ContextVar> fromFunctionParam(ContextGraph graph, FunctionParam param) {
        return fromDeclaration(graph, param.name(), param.typeName(), param.loc(), param.label());
    }

    public Optional<ContextVar> fromFunctionReturn(ContextGraph graph, FunctionReturn ret) {
        return fromDeclaration(graph, ret.name(), ret.typeName(), ret.loc(), ret.label());
    }

    private Optional<ContextVar> fromDeclaration(ContextGraph graph, String name, String typeName, Loc loc, String label) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        Optional<Builtin> builtin = Builtin.tryFromKeyword(typeName);
        if (builtin.isEmpty()) {
            LOG.debug("declining {}: no builtin for type '{}'", label, typeName);
            return Optional.empty();
        }
        NodeIdx ty = builtins.intern(graph, builtin.get());
        // Inputs are unknown at entry: no range until something constrains them.
        return Optional.of(ContextVar.named(name, loc, ty, null));
    }
}
