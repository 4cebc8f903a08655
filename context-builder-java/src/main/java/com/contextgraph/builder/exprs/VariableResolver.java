package com.contextgraph.builder.exprs;

import com.contextgraph.builder.ast.Identifier;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.ContextVarNode;
import com.contextgraph.graph.node.Function;
import com.contextgraph.graph.node.FunctionNode;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves identifiers: innermost scope outwards, then functions of the enclosing contract by
 * name. Code outside any contract sees the free functions.
 */
class VariableResolver {

    private final ContextGraph graph;

    VariableResolver(ContextGraph graph) {
        this.graph = graph;
    }

    NodeIdx resolve(Identifier ident, ContextNode ctx) {
        String name = ident.name();

        Optional<ContextNode> scope = Optional.of(ctx);
        while (scope.isPresent()) {
            Optional<ContextVarNode> found = scope.get().latestVarByName(graph, name);
            if (found.isPresent()) {
                return found.get().idx();
            }
            scope = scope.get().parentContext(graph);
        }

        Optional<NodeIdx> function = firstNamed(visibleFunctions(ctx), name);
        if (function.isPresent()) {
            return function.get();
        }
        if (ExpressionDispatcher.ASSERTION_FUNCTIONS.contains(name)) {
            // Global functions get a node on first use; later lookups find it among the free functions.
            return firstNamed(freeFunctions(), name)
                    .orElseGet(() -> graph.addNode(new Function(name, Loc.IMPLICIT)));
        }
        throw IrException.unresolved(name, ident.loc());
    }

    /** Functions declared in the contract owning {@code ctx}, in declaration order. */
    private List<NodeIdx> visibleFunctions(ContextNode ctx) {
        Optional<NodeIdx> contract = graph.searchForAncestor(ctx.idx(), Edge.CONTEXT)
                .flatMap(fn -> new FunctionNode(fn).contract(graph));
        if (contract.isPresent()) {
            return graph.sources(contract.get(), Edge.FUNC);
        }
        return freeFunctions();
    }

    private List<NodeIdx> freeFunctions() {
        return graph.nodesOfKind(Function.class).stream()
                .filter(fn -> new FunctionNode(fn).contract(graph).isEmpty())
                .collect(Collectors.toList());
    }

    private Optional<NodeIdx> firstNamed(List<NodeIdx> functions, String name) {
        return functions.stream()
                .filter(fn -> graph.node(fn, Function.class).name().equals(name))
                .findFirst();
    }
}
