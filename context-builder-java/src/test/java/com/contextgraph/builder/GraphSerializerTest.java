package com.contextgraph.builder;

import com.contextgraph.builder.analysis.AnalysisResult;
import com.contextgraph.builder.analysis.ContractAnalyzer;
import com.contextgraph.builder.ast.BinaryOperator;
import com.contextgraph.builder.ast.FunctionDefinition;
import com.contextgraph.builder.config.BuilderConfig;
import com.contextgraph.builder.export.GraphModel;
import com.contextgraph.builder.export.GraphSerializer;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.Context;
import com.contextgraph.graph.node.Function;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.contextgraph.builder.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphSerializerTest {

    @Test
    void edgesSortedBySourceThenTarget(@TempDir Path tmp) throws Exception {
        ContextGraph graph = new ContextGraph();
        NodeIdx fn = graph.addNode(new Function("f", Loc.of(0, 0, 50)));
        NodeIdx outer = graph.addNode(new Context(Loc.of(0, 10, 40), false));
        NodeIdx inner = graph.addNode(new Context(Loc.of(0, 20, 30), true));
        graph.addEdge(inner, outer, Edge.SUBCONTEXT);
        graph.addEdge(outer, fn, Edge.CONTEXT);

        Path out = new GraphSerializer().write(graph, tmp);

        assertEquals(tmp.resolve("context_graph.json"), out);
        GraphModel.GraphRoot root;
        try (FileReader r = new FileReader(out.toFile())) {
            root = new Gson().fromJson(r, GraphModel.GraphRoot.class);
        }
        assertEquals(3, root.nodeCount);
        assertEquals(2, root.edgeCount);
        assertEquals(1, root.edges.get(0).source);
        assertEquals("CONTEXT", root.edges.get(0).kind);
        assertEquals(2, root.edges.get(1).source);
        assertEquals("SUBCONTEXT", root.edges.get(1).kind);
        assertEquals("Function", root.nodes.get(0).kind);
        assertEquals("0:10-40", root.nodes.get(1).loc);
    }

    @Test
    void variablesCarryRangeAndType() {
        FunctionDefinition f = function("f", List.of(param("uint", "x")), List.of(),
                block(exprStmt(bin(var("x"), BinaryOperator.LESS, num(7)))));
        AnalysisResult result = new ContractAnalyzer(BuilderConfig.defaults()).analyze(contract("C", f));

        GraphModel.GraphRoot root = new GraphSerializer().toModel(result.graph());

        GraphModel.GraphNode literal = root.nodes.stream()
                .filter(n -> n.kind.equals("ContextVar") && n.label.startsWith("7"))
                .findFirst().orElseThrow();
        assertEquals("7 [7, 7]", literal.label);
        assertEquals("[7, 7]", literal.range);
        assertEquals("Builtin", root.nodes.get(literal.type).kind);
        assertEquals("uint256", root.nodes.get(literal.type).label);
        assertEquals("[0, 115792089237316195423570985008687907853269984665640564039457584007913129639935]", root.nodes.get(literal.type).range);

        GraphModel.GraphNode bool = root.nodes.stream()
                .filter(n -> n.kind.equals("Builtin") && n.label.equals("bool"))
                .findFirst().orElseThrow();
        assertEquals("[0, 1]", bool.range);

        GraphModel.GraphNode param = root.nodes.stream()
                .filter(n -> n.kind.equals("ContextVar") && n.label.equals("x"))
                .findFirst().orElseThrow();
        assertNull(param.range);
    }

    @Test
    void createsMissingOutputDirectory(@TempDir Path tmp) {
        Path nested = tmp.resolve("a").resolve("b");

        new GraphSerializer().write(new ContextGraph(), nested);

        assertTrue(Files.exists(nested.resolve("context_graph.json")));
    }
}
