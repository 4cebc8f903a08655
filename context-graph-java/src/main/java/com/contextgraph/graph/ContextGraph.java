package com.contextgraph.graph;

import com.contextgraph.graph.node.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.graph.DirectedPseudograph;

import java.util.*;

/**
 * Append-only arena holding every node of an analysis plus a directed multigraph of tagged edges.
 * Nodes are addressed by {@link NodeIdx}; indices stay stable across insertions.
 *
 * Edge iteration (incoming and outgoing) follows insertion order.
 */
public class ContextGraph {

    private static final Logger LOG = LogManager.getLogger(ContextGraph.class);

    private final List<Node> nodes = new ArrayList<>();
    private final Graph<NodeIdx, GraphEdge> graph = new DirectedPseudograph<>(GraphEdge.class);

    public NodeIdx addNode(Node node) {
        NodeIdx idx = new NodeIdx(nodes.size());
        nodes.add(node);
        graph.addVertex(idx);
        LOG.trace("add node {}: {}", idx, node);
        return idx;
    }

    public void addEdge(NodeIdx from, NodeIdx to, Edge kind) {
        checkBounds(from);
        checkBounds(to);
        graph.addEdge(from, to, new GraphEdge(kind));
        LOG.trace("add edge {} ---{}---> {}", from, kind, to);
    }

    public Node node(NodeIdx idx) {
        checkBounds(idx);
        return nodes.get(idx.index());
    }

    /**
     * Typed lookup.
     *
     * @throws IrException of kind NODE_KIND_MISMATCH when the stored node is not a {@code type}
     */
    public <T extends Node> T node(NodeIdx idx, Class<T> type) {
        Node node = node(idx);
        if (!type.isInstance(node)) {
            throw IrException.nodeKindMismatch(idx, type.getSimpleName(), node);
        }
        return type.cast(node);
    }

    /** Sources of incoming edges of {@code target} tagged {@code kind}. */
    public List<NodeIdx> sources(NodeIdx target, Edge kind) {
        List<NodeIdx> result = new ArrayList<>();
        for (GraphEdge e : graph.incomingEdgesOf(target)) {
            if (e.getKind() == kind) {
                result.add(graph.getEdgeSource(e));
            }
        }
        return result;
    }

    /** Targets of outgoing edges of {@code source} tagged {@code kind}. */
    public List<NodeIdx> targets(NodeIdx source, Edge kind) {
        List<NodeIdx> result = new ArrayList<>();
        for (GraphEdge e : graph.outgoingEdgesOf(source)) {
            if (e.getKind() == kind) {
                result.add(graph.getEdgeTarget(e));
            }
        }
        return result;
    }

    public Optional<NodeIdx> firstTarget(NodeIdx source, Edge kind) {
        for (GraphEdge e : graph.outgoingEdgesOf(source)) {
            if (e.getKind() == kind) {
                return Optional.of(graph.getEdgeTarget(e));
            }
        }
        return Optional.empty();
    }

    /**
     * Breadth-first walk over outgoing edges starting at {@code start}. Returns the target of the
     * first edge tagged {@code kind} that the walk meets.
     */
    public Optional<NodeIdx> searchForAncestor(NodeIdx start, Edge kind) {
        Set<NodeIdx> seen = new HashSet<>();
        Deque<NodeIdx> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            NodeIdx current = queue.poll();
            for (GraphEdge e : graph.outgoingEdgesOf(current)) {
                NodeIdx target = graph.getEdgeTarget(e);
                if (e.getKind() == kind) {
                    return Optional.of(target);
                }
                if (seen.add(target)) {
                    queue.add(target);
                }
            }
        }
        return Optional.empty();
    }

    /** Every node index of the given kind, in insertion order. */
    public List<NodeIdx> nodesOfKind(Class<? extends Node> type) {
        List<NodeIdx> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (type.isInstance(nodes.get(i))) {
                result.add(new NodeIdx(i));
            }
        }
        return result;
    }

    public Set<GraphEdge> edges() {
        return Collections.unmodifiableSet(graph.edgeSet());
    }

    public NodeIdx edgeSource(GraphEdge e) { return graph.getEdgeSource(e); }

    public NodeIdx edgeTarget(GraphEdge e) { return graph.getEdgeTarget(e); }

    public int nodeCount() { return nodes.size(); }

    public int edgeCount() { return graph.edgeSet().size(); }

    private void checkBounds(NodeIdx idx) {
        if (idx.index() < 0 || idx.index() >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node " + idx + " in graph of " + nodes.size() + " nodes");
        }
    }
}
