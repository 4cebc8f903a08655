package com.contextgraph.graph.node;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.range.RangeElem;
import com.contextgraph.graph.range.SolcRange;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Index handle for a {@link ContextVar} version. {@code PREV} edges run from a newer version to
 * the one it replaced.
 */
public record ContextVarNode(NodeIdx idx) {

    public ContextVar underlying(ContextGraph graph) {
        return graph.node(idx, ContextVar.class);
    }

    public String name(ContextGraph graph) {
        return underlying(graph).getName();
    }

    public Optional<SolcRange> range(ContextGraph graph) {
        return Optional.ofNullable(underlying(graph).getRange());
    }

    public void setRangeMin(ContextGraph graph, RangeElem min) {
        ContextVar cvar = underlying(graph);
        SolcRange current = cvar.getRange();
        cvar.setRange(current != null ? current.withMin(min) : new SolcRange(min, min));
    }

    public void setRangeMax(ContextGraph graph, RangeElem max) {
        ContextVar cvar = underlying(graph);
        SolcRange current = cvar.getRange();
        cvar.setRange(current != null ? current.withMax(max) : new SolcRange(max, max));
    }

    public Optional<ContextVarNode> prevVersion(ContextGraph graph) {
        return graph.firstTarget(idx, Edge.PREV).map(ContextVarNode::new);
    }

    public Optional<ContextVarNode> nextVersion(ContextGraph graph) {
        List<NodeIdx> newer = graph.sources(idx, Edge.PREV);
        return newer.isEmpty() ? Optional.empty() : Optional.of(new ContextVarNode(newer.get(0)));
    }

    public boolean isLatest(ContextGraph graph) {
        return graph.sources(idx, Edge.PREV).isEmpty();
    }

    /** Walks forward through {@code PREV} edges to the most recent write. */
    public ContextVarNode latestVersion(ContextGraph graph) {
        ContextVarNode current = this;
        Set<NodeIdx> seen = new HashSet<>();
        while (seen.add(current.idx)) {
            Optional<ContextVarNode> next = current.nextVersion(graph);
            if (next.isEmpty()) break;
            current = next.get();
        }
        return current;
    }

    /** Walks backward to the declaration, the version with no outgoing {@code PREV}. */
    public ContextVarNode firstVersion(ContextGraph graph) {
        ContextVarNode current = this;
        Set<NodeIdx> seen = new HashSet<>();
        while (seen.add(current.idx)) {
            Optional<ContextVarNode> prev = current.prevVersion(graph);
            if (prev.isEmpty()) break;
            current = prev.get();
        }
        return current;
    }
}
