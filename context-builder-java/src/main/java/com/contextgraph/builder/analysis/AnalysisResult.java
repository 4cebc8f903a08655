package com.contextgraph.builder.analysis;

import com.contextgraph.builder.report.BuildReport;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.node.FunctionNode;

import java.util.Map;
import java.util.Optional;

/**
 * Aggregate result of analysing one contract. {@code reports} is keyed by function name in
 * declaration order and only holds functions that were built.
 */
public record AnalysisResult(
    ContextGraph graph,
    BuiltinRegistry builtins,
    Map<String, FunctionNode> functions,
    Map<String, BuildReport> reports
) {

    public Optional<BuildReport> report(String functionName) {
        return Optional.ofNullable(reports.get(functionName));
    }

    public boolean isComplete() {
        return reports.values().stream().allMatch(BuildReport::isComplete);
    }
}
