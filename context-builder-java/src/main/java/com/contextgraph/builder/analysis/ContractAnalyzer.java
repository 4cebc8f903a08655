package com.contextgraph.builder.analysis;

import com.contextgraph.builder.ast.ContractDefinition;
import com.contextgraph.builder.ast.FunctionDefinition;
import com.contextgraph.builder.ast.Parameter;
import com.contextgraph.builder.config.BuilderConfig;
import com.contextgraph.builder.config.BuilderConfigReader;
import com.contextgraph.builder.context.ContextBuilder;
import com.contextgraph.builder.export.GraphSerializer;
import com.contextgraph.builder.report.BuildReport;
import com.contextgraph.builder.report.Diagnostic;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.node.Contract;
import com.contextgraph.graph.node.Function;
import com.contextgraph.graph.node.FunctionNode;
import com.contextgraph.graph.node.FunctionParam;
import com.contextgraph.graph.node.FunctionReturn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates the build of one contract into a shared context graph.
 *
 * All functions are declared first so bodies can refer to functions declared later. Each body
 * is then built as its own pass; a failed pass is recorded in that function's report and the
 * next function is still built.
 */
public class ContractAnalyzer {

    private static final Logger LOG = LogManager.getLogger(ContractAnalyzer.class);

    private final BuilderConfig config;
    private final ContextGraph graph;
    private final BuiltinRegistry builtins;
    private final ContextBuilder builder;

    public ContractAnalyzer(BuilderConfig config) {
        this(config, new ContextGraph(), new BuiltinRegistry());
    }

    /**
     * Analyzer configured from a JSON file.
     *
     * @throws BuilderConfigReader.ConfigReadException if the file is missing or malformed
     */
    public static ContractAnalyzer fromConfigFile(Path configPath) {
        LOG.info("Reading builder config: {}", configPath);
        return new ContractAnalyzer(new BuilderConfigReader().read(configPath));
    }

    /** Shares {@code graph} and {@code builtins} with earlier analyses, e.g. other contracts of one source unit. */
    public ContractAnalyzer(BuilderConfig config, ContextGraph graph, BuiltinRegistry builtins) {
        this.config = config;
        this.graph = graph;
        this.builtins = builtins;
        this.builder = new ContextBuilder(graph, builtins, config);
    }

    public AnalysisResult analyze(ContractDefinition contract) {
        LOG.info("Analysing contract {} ({} functions)", contract.name(), contract.functions().size());
        NodeIdx contractNode = graph.addNode(new Contract(contract.name(), contract.loc()));

        // 1. Declare functions with their parameters and returns
        Map<String, FunctionNode> functions = new LinkedHashMap<>();
        for (FunctionDefinition def : contract.functions()) {
            FunctionNode fn = declare(def, contractNode);
            if (functions.putIfAbsent(def.name(), fn) != null) {
                LOG.warn("Overloaded function {} in {}: only the first is addressable by name",
                        def.name(), contract.name());
            }
        }

        // 2. Build bodies
        Map<String, BuildReport> reports = new LinkedHashMap<>();
        for (FunctionDefinition def : contract.functions()) {
            if (def.body() == null || reports.containsKey(def.name())) {
                continue;
            }
            BuildReport report = buildBody(def, functions.get(def.name()));
            reports.put(def.name(), report);

            if (!report.isComplete() && config.isStopOnFirstError()) {
                LOG.warn("Stopping after {}: {} diagnostics", def.name(), report.getDiagnostics().size());
                break;
            }
        }

        LOG.info("Analysis of {} complete: {} nodes, {} edges, {} builtins",
                contract.name(), graph.nodeCount(), graph.edgeCount(), builtins.size());

        // 3. Optional export
        if (config.isExportGraph()) {
            new GraphSerializer().write(graph, Paths.get(config.getOutputDir()));
        }
        return new AnalysisResult(graph, builtins, functions, reports);
    }

    private FunctionNode declare(FunctionDefinition def, NodeIdx contractNode) {
        NodeIdx fnIdx = graph.addNode(new Function(def.name(), def.loc()));
        graph.addEdge(fnIdx, contractNode, Edge.FUNC);

        List<Parameter> params = def.params();
        for (int i = 0; i < params.size(); i++) {
            Parameter p = params.get(i);
            NodeIdx paramIdx = graph.addNode(new FunctionParam(p.loc(), p.typeName(), nameOf(p), i));
            graph.addEdge(paramIdx, fnIdx, Edge.FUNCTION_PARAM);
        }
        for (Parameter r : def.returns()) {
            NodeIdx retIdx = graph.addNode(new FunctionReturn(r.loc(), r.typeName(), nameOf(r)));
            graph.addEdge(retIdx, fnIdx, Edge.FUNCTION_RETURN);
        }
        return new FunctionNode(fnIdx);
    }

    private BuildReport buildBody(FunctionDefinition def, FunctionNode fn) {
        BuildReport report = builder.build(def.body(), fn.idx(), def.name());
        if (report.isFailed()) {
            LOG.error("Building {} failed: {}", def.name(), report.getFailure().getMessage());
        }
        for (Diagnostic d : report.getDiagnostics()) {
            LOG.warn("[{}] {}", def.name(), d);
        }
        return report;
    }

    private static String nameOf(Parameter p) {
        return p.name() != null ? p.name().name() : null;
    }
}
