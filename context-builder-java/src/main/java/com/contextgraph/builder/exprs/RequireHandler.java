package com.contextgraph.builder.exprs;

import com.contextgraph.builder.ast.Expression;
import com.contextgraph.builder.context.VariableVersioning;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.ContextVarNode;
import com.contextgraph.graph.node.Node;
import com.contextgraph.graph.node.TmpConstruction;
import com.contextgraph.graph.range.Concrete;
import com.contextgraph.graph.range.Op;
import com.contextgraph.graph.range.RangeElem;
import com.contextgraph.graph.range.RangeExpr;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Installs the constraint stated by {@code require(cond)} / {@code assert(cond)}.
 *
 * When the condition is a comparison with a declared variable on one side, a new version of that
 * variable is written whose range is narrowed by the other side. Any other condition is only
 * evaluated.
 */
class RequireHandler {

    private static final Logger LOG = LogManager.getLogger(RequireHandler.class);

    private final ContextGraph graph;
    private final ExpressionDispatcher dispatcher;
    private final VariableVersioning versioning;

    RequireHandler(ContextGraph graph, ExpressionDispatcher dispatcher, VariableVersioning versioning) {
        this.graph = graph;
        this.dispatcher = dispatcher;
        this.versioning = versioning;
    }

    void handleRequire(Loc loc, List<Expression> args, ContextNode ctx) {
        List<List<NodeIdx>> evaluated = new ArrayList<>();
        for (Expression arg : args) {
            evaluated.add(dispatcher.evaluate(arg, ctx));
        }
        if (evaluated.isEmpty() || evaluated.get(0).isEmpty()) {
            return;
        }
        Node condNode = graph.node(evaluated.get(0).get(0));
        if (!(condNode instanceof ContextVar) || ((ContextVar) condNode).getTmpOf() == null) {
            LOG.debug("condition at {} is not a comparison; nothing to install", loc);
            return;
        }
        TmpConstruction construction = ((ContextVar) condNode).getTmpOf();
        if (!construction.op().isComparison()) {
            return;
        }
        if (isDeclaredVar(construction.lhs())) {
            narrow(loc, new ContextVarNode(construction.lhs()), construction.op(), construction.rhs());
        } else if (isDeclaredVar(construction.rhs())) {
            narrow(loc, new ContextVarNode(construction.rhs()), construction.op().flipped(), construction.lhs());
        }
    }

    /** Writes a new version of {@code var} constrained by {@code var op bound}. */
    private void narrow(Loc loc, ContextVarNode var, Op op, NodeIdx bound) {
        ContextVarNode current = var.latestVersion(graph);
        RangeElem min = Bounds.min(graph, current.idx(), loc);
        RangeElem max = Bounds.max(graph, current.idx(), loc);
        RangeElem boundMin = Bounds.min(graph, bound, loc);
        RangeElem boundMax = Bounds.max(graph, bound, loc);
        Concrete one = Concrete.of(1, loc);

        switch (op) {
            case LT -> max = new RangeExpr(boundMax, Op.SUB, one);
            case LTE -> max = boundMax;
            case GT -> min = new RangeExpr(boundMin, Op.ADD, one);
            case GTE -> min = boundMin;
            case EQ -> {
                min = boundMin;
                max = boundMax;
            }
            default -> {
                return;
            }
        }

        ContextVarNode constrained = versioning.advanceVar(current, loc);
        constrained.setRangeMin(graph, min);
        constrained.setRangeMax(graph, max);
        LOG.debug("installed {} {} {} at {}", current.name(graph), op.symbol(), bound, loc);
    }

    /** A version of a variable some scope declares, as opposed to a literal or temporary. */
    private boolean isDeclaredVar(NodeIdx idx) {
        Node node = graph.node(idx);
        if (!(node instanceof ContextVar) || ((ContextVar) node).isTmp()) {
            return false;
        }
        NodeIdx declaration = new ContextVarNode(idx).firstVersion(graph).idx();
        return !graph.targets(declaration, Edge.VARIABLE).isEmpty();
    }
}
