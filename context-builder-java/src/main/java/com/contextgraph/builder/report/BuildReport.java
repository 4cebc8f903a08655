package com.contextgraph.builder.report;

import com.contextgraph.graph.IrException;
import com.contextgraph.graph.NodeIdx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one build pass over a statement tree.
 *
 * The graph is not transactional: whatever was created before a failure stays in it. A report
 * with diagnostics therefore describes a usable partial graph, and {@link #isComplete()} is
 * false for it.
 */
public class BuildReport {

    private final String subject;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<NodeIdx> contexts = new ArrayList<>();
    private IrException failure;

    public BuildReport(String subject) {
        this.subject = subject;
    }

    /** What was built, typically the function name. */
    public String getSubject() { return subject; }

    public void record(IrException e) {
        diagnostics.add(Diagnostic.of(e));
    }

    /** Marks the pass as aborted by a non-recoverable error. */
    public void fail(IrException e) {
        failure = e;
        diagnostics.add(Diagnostic.of(e));
    }

    public void contextCreated(NodeIdx ctx) {
        contexts.add(ctx);
    }

    public List<Diagnostic> getDiagnostics() { return Collections.unmodifiableList(diagnostics); }

    public List<Diagnostic> diagnosticsOfKind(IrException.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    /** Contexts created by this pass, in creation order. */
    public List<NodeIdx> getContexts() { return Collections.unmodifiableList(contexts); }

    /** The error that aborted the pass, or null. */
    public IrException getFailure() { return failure; }

    public boolean isFailed() { return failure != null; }

    public boolean isComplete() { return diagnostics.isEmpty(); }

    @Override
    public String toString() {
        return "BuildReport{" + subject + ", contexts=" + contexts.size()
                + ", diagnostics=" + diagnostics.size() + (failure != null ? ", FAILED" : "") + "}";
    }
}
