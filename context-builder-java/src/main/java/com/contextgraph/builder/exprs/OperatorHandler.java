package com.contextgraph.builder.exprs;

import com.contextgraph.builder.ast.Expression;
import com.contextgraph.builder.context.VariableVersioning;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.Builtin;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.ContextVarNode;
import com.contextgraph.graph.node.Node;
import com.contextgraph.graph.node.TmpConstruction;
import com.contextgraph.graph.range.Op;
import com.contextgraph.graph.range.RangeExpr;
import com.contextgraph.graph.range.SolcRange;

import java.math.BigInteger;
import java.util.List;

/**
 * Arithmetic and comparison. Both forms produce a fresh temporary in the current context and
 * leave the operands untouched; only the compound-assignment form writes, through
 * {@link VariableVersioning}.
 */
class OperatorHandler {

    private final ContextGraph graph;
    private final BuiltinRegistry builtins;
    private final ExpressionDispatcher dispatcher;
    private final VariableVersioning versioning;

    OperatorHandler(ContextGraph graph, BuiltinRegistry builtins,
                    ExpressionDispatcher dispatcher, VariableVersioning versioning) {
        this.graph = graph;
        this.builtins = builtins;
        this.dispatcher = dispatcher;
        this.versioning = versioning;
    }

    /**
     * {@code lhs op rhs}, or {@code lhs op= rhs} when {@code assign} is set. The compound form
     * returns the new version of the left-hand variable instead of the temporary.
     */
    List<NodeIdx> opExpr(Loc loc, Expression lhsExpr, Expression rhsExpr, ContextNode ctx, Op op, boolean assign) {
        NodeIdx lhs = dispatcher.evaluateSingle(lhsExpr, ctx, "left operand of " + op.symbol());
        NodeIdx rhs = dispatcher.evaluateSingle(rhsExpr, ctx, "right operand of " + op.symbol());
        ContextVar lhsVar = operand(lhs, op, loc);
        ContextVar rhsVar = operand(rhs, op, loc);

        SolcRange range = new SolcRange(
                new RangeExpr(Bounds.min(graph, lhs, loc), op, Bounds.min(graph, rhs, loc)),
                new RangeExpr(Bounds.max(graph, lhs, loc), op, Bounds.max(graph, rhs, loc)));
        NodeIdx ty = lhsVar.getTy() != null ? lhsVar.getTy() : rhsVar.getTy();
        NodeIdx tmp = addTmp(ctx, loc, lhs, lhsVar, op, rhs, rhsVar, ty, range);

        if (!assign) {
            return List.of(tmp);
        }
        ContextVarNode written = versioning.assignNodes(loc, new ContextVarNode(lhs), tmp);
        return List.of(written.idx());
    }

    List<NodeIdx> cmp(Loc loc, Expression lhsExpr, Op op, Expression rhsExpr, ContextNode ctx) {
        NodeIdx lhs = dispatcher.evaluateSingle(lhsExpr, ctx, "left operand of " + op.symbol());
        NodeIdx rhs = dispatcher.evaluateSingle(rhsExpr, ctx, "right operand of " + op.symbol());
        ContextVar lhsVar = operand(lhs, op, loc);
        ContextVar rhsVar = operand(rhs, op, loc);

        NodeIdx boolTy = builtins.intern(graph, new Builtin.Bool());
        SolcRange range = SolcRange.between(BigInteger.ZERO, BigInteger.ONE, loc);
        return List.of(addTmp(ctx, loc, lhs, lhsVar, op, rhs, rhsVar, boolTy, range));
    }

    private NodeIdx addTmp(ContextNode ctx, Loc loc, NodeIdx lhs, ContextVar lhsVar, Op op,
                           NodeIdx rhs, ContextVar rhsVar, NodeIdx ty, SolcRange range) {
        String name = "tmp" + ctx.newTmp(graph);
        String display = lhsVar.getDisplayName() + " " + op.symbol() + " " + rhsVar.getDisplayName();
        ContextVar tmp = ContextVar.tmp(name, display, loc, ty, range, new TmpConstruction(lhs, op, rhs));
        return graph.addNode(tmp);
    }

    private ContextVar operand(NodeIdx idx, Op op, Loc loc) {
        Node node = graph.node(idx);
        if (node instanceof ContextVar) {
            return (ContextVar) node;
        }
        throw IrException.unsupported("operator " + op.symbol() + " applied to " + node.label(), loc);
    }
}
