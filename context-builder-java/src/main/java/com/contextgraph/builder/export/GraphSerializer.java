package com.contextgraph.builder.export;

import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.GraphEdge;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.Builtin;
import com.contextgraph.graph.node.Context;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.Contract;
import com.contextgraph.graph.node.Function;
import com.contextgraph.graph.node.FunctionParam;
import com.contextgraph.graph.node.FunctionReturn;
import com.contextgraph.graph.node.Node;
import com.contextgraph.graph.range.SolcRange;
import com.google.gson.GsonBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes a context graph to {@code context_graph.json}.
 * Output is deterministic: nodes by index, edges by source, target, then kind.
 */
public class GraphSerializer {

    private static final Logger LOG = LogManager.getLogger(GraphSerializer.class);

    static final String FILE_NAME = "context_graph.json";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code graph} to {@code outputDir/context_graph.json}.
     *
     * @param outputDir directory to write into (created if absent)
     * @return path of the written file
     */
    public Path write(ContextGraph graph, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        var gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

        Path out = outputDir.resolve(FILE_NAME);
        try (Writer w = new FileWriter(out.toFile())) {
            gson.toJson(toModel(graph), w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + FILE_NAME + ": " + e.getMessage(), e);
        }
        LOG.info("{} written: {}", FILE_NAME, out);
        return out;
    }

    public GraphModel.GraphRoot toModel(ContextGraph graph) {
        List<GraphModel.GraphNode> nodes = new ArrayList<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            nodes.add(toNode(i, graph.node(new NodeIdx(i))));
        }

        List<GraphModel.GraphEdgeEntry> edges = new ArrayList<>();
        for (GraphEdge e : graph.edges()) {
            GraphModel.GraphEdgeEntry entry = new GraphModel.GraphEdgeEntry();
            entry.source = graph.edgeSource(e).index();
            entry.target = graph.edgeTarget(e).index();
            entry.kind = e.getKind().name();
            edges.add(entry);
        }
        edges.sort(Comparator.comparingInt((GraphModel.GraphEdgeEntry e) -> e.source)
                .thenComparingInt(e -> e.target)
                .thenComparing(e -> e.kind));

        GraphModel.GraphRoot root = new GraphModel.GraphRoot();
        root.formatVersion = "0.1";
        root.nodeCount = nodes.size();
        root.edgeCount = edges.size();
        root.nodes = nodes;
        root.edges = edges;
        return root;
    }

    private GraphModel.GraphNode toNode(int index, Node node) {
        GraphModel.GraphNode out = new GraphModel.GraphNode();
        out.index = index;
        out.kind = kindOf(node);
        out.label = node.label();
        out.loc = locString(locOf(node));
        if (node instanceof ContextVar) {
            ContextVar cvar = (ContextVar) node;
            out.range = cvar.getRange() != null ? cvar.getRange().toString() : null;
            out.type = cvar.getTy() != null ? cvar.getTy().index() : null;
        }
        if (node instanceof Builtin) {
            out.range = ((Builtin) node).naturalRange(Loc.IMPLICIT).map(SolcRange::toString).orElse(null);
        }
        return out;
    }

    private static String kindOf(Node node) {
        if (node instanceof Builtin) return "Builtin";
        return node.getClass().getSimpleName();
    }

    private static Loc locOf(Node node) {
        if (node instanceof Context) return ((Context) node).getLoc();
        if (node instanceof ContextVar) return ((ContextVar) node).getLoc();
        if (node instanceof Function) return ((Function) node).loc();
        if (node instanceof FunctionParam) return ((FunctionParam) node).loc();
        if (node instanceof FunctionReturn) return ((FunctionReturn) node).loc();
        if (node instanceof Contract) return ((Contract) node).loc();
        return null;
    }

    private static String locString(Loc loc) {
        return loc != null ? loc.toString() : null;
    }
}
