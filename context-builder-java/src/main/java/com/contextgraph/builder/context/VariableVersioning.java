package com.contextgraph.builder.context;

import com.contextgraph.builder.ast.Expression;
import com.contextgraph.builder.exprs.ExpressionDispatcher;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.ContextVarNode;
import com.contextgraph.graph.node.Node;
import com.contextgraph.graph.range.Dynamic;
import com.contextgraph.graph.range.DynamicRangeSide;
import com.contextgraph.graph.range.RangeElem;
import com.contextgraph.graph.range.SolcRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Single-assignment writes. A write never edits a version: it clones the current one into a new
 * node linked back with {@code PREV}, then installs the written range on the clone.
 */
public class VariableVersioning {

    private static final Logger LOG = LogManager.getLogger(VariableVersioning.class);

    private final ContextGraph graph;
    private final ExpressionDispatcher dispatcher;

    public VariableVersioning(ContextGraph graph, ExpressionDispatcher dispatcher) {
        this.graph = graph;
        this.dispatcher = dispatcher;
    }

    /**
     * {@code lhs = rhs}. Evaluates the left side, then the right side, and writes a new version
     * of the left-hand variable.
     *
     * @return the new version's node id
     * @throws IrException EMPTY_EVALUATION_RESULT when either side yields no value
     */
    public List<NodeIdx> assign(Loc loc, Expression lhsExpr, Expression rhsExpr, ContextNode ctx) {
        NodeIdx lhs = dispatcher.evaluateSingle(lhsExpr, ctx, "left-hand side of assignment");
        NodeIdx rhs = dispatcher.evaluateSingle(rhsExpr, ctx, "right-hand side of assignment");
        return List.of(assignNodes(loc, new ContextVarNode(lhs), rhs).idx());
    }

    /**
     * Writes {@code rhs} into a new version of {@code lhs}. A right side with a known range is
     * copied verbatim; otherwise both bounds are deferred to the right-hand node.
     */
    public ContextVarNode assignNodes(Loc loc, ContextVarNode lhs, NodeIdx rhs) {
        Node target = graph.node(lhs.idx());
        if (!(target instanceof ContextVar)) {
            throw IrException.unsupported("assignment to " + target.label(), loc);
        }

        RangeElem newMin;
        RangeElem newMax;
        Node rhsNode = graph.node(rhs);
        Optional<SolcRange> rhsRange = rhsNode instanceof ContextVar
                ? Optional.ofNullable(((ContextVar) rhsNode).getRange())
                : Optional.empty();
        if (rhsRange.isPresent()) {
            newMin = rhsRange.get().min();
            newMax = rhsRange.get().max();
        } else {
            newMin = new Dynamic(rhs, DynamicRangeSide.MIN, loc);
            newMax = new Dynamic(rhs, DynamicRangeSide.MAX, loc);
        }

        // Evaluating the right side may itself have written the variable.
        ContextVarNode current = lhs.latestVersion(graph);
        ContextVarNode newLhs = advanceVar(current, loc);
        newLhs.setRangeMin(graph, newMin);
        newLhs.setRangeMax(graph, newMax);
        return newLhs;
    }

    /**
     * Clones {@code cvarNode} at {@code loc} into a new node and links new -> old with
     * {@code PREV}.
     *
     * @throws IrException STALE_VERSION_WRITE if {@code cvarNode} already has a newer version
     */
    public ContextVarNode advanceVar(ContextVarNode cvarNode, Loc loc) {
        Optional<ContextVarNode> successor = cvarNode.nextVersion(graph);
        if (successor.isPresent()) {
            throw IrException.staleWrite(cvarNode.idx(), successor.get().idx(), loc);
        }
        ContextVar newCvar = cvarNode.underlying(graph).copyAt(loc);
        NodeIdx newIdx = graph.addNode(newCvar);
        graph.addEdge(newIdx, cvarNode.idx(), Edge.PREV);
        LOG.trace("advanced {} {} -> {}", newCvar.getName(), cvarNode.idx(), newIdx);
        return new ContextVarNode(newIdx);
    }
}
