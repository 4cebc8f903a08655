package com.contextgraph.builder.context;

import com.contextgraph.builder.ast.Statement;
import com.contextgraph.builder.ast.Statement.*;
import com.contextgraph.builder.ast.StatementVisitor;
import com.contextgraph.builder.config.BuilderConfig;
import com.contextgraph.builder.config.ParamSeeding;
import com.contextgraph.builder.exprs.ExpressionDispatcher;
import com.contextgraph.builder.report.BuildReport;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.Edge;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.node.Context;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.ContextVar;
import com.contextgraph.graph.node.ContextVarFactory;
import com.contextgraph.graph.node.Function;
import com.contextgraph.graph.node.FunctionNode;
import com.contextgraph.graph.node.FunctionParam;
import com.contextgraph.graph.node.FunctionReturn;
import com.contextgraph.graph.node.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Turns a statement tree into contexts and context variables.
 *
 * Each block becomes one {@link Context} linked to its parent: {@code CONTEXT} when the parent
 * is a function, {@code SUBCONTEXT} when it is another context. Sub-statements are built one
 * at a time; a recoverable failure in one of them is recorded in the pass's
 * {@link BuildReport} and the next sibling is built anyway.
 *
 * Statement kinds without semantics yet mutate nothing and report UNSUPPORTED_CONSTRUCT.
 */
public class ContextBuilder implements StatementVisitor<Void, BuildFrame> {

    private static final Logger LOG = LogManager.getLogger(ContextBuilder.class);

    private final ContextGraph graph;
    private final ContextVarFactory varFactory;
    private final ExpressionDispatcher dispatcher;
    private final BuilderConfig config;

    private BuildReport report;

    public ContextBuilder(ContextGraph graph, BuiltinRegistry builtins, BuilderConfig config) {
        this(graph, new ContextVarFactory(builtins), new ExpressionDispatcher(graph, builtins), config);
    }

    public ContextBuilder(ContextGraph graph, ContextVarFactory varFactory,
                          ExpressionDispatcher dispatcher, BuilderConfig config) {
        this.graph = graph;
        this.varFactory = varFactory;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    public ExpressionDispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Builds {@code stmt} under {@code parent} as one pass.
     *
     * Recoverable failures are listed in the report and the pass goes on. A failure that is not
     * recoverable ends the pass; the report is then marked failed. Either way the nodes created
     * so far stay in the graph.
     *
     * @param parent a function or context node, or null for a detached tree
     */
    public BuildReport build(Statement stmt, NodeIdx parent, String subject) {
        BuildReport previous = report;
        report = new BuildReport(subject);
        try {
            buildChild(stmt, new BuildFrame(parent, false));
        } catch (IrException e) {
            LOG.error("build of {} aborted: {}", subject, e.getMessage());
            report.fail(e);
        }
        BuildReport result = report;
        report = previous;
        return result;
    }

    private void buildChild(Statement stmt, BuildFrame frame) {
        try {
            stmt.accept(this, frame);
        } catch (IrException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            LOG.warn("skipping statement at {}: {}", stmt.loc(), e.getMessage());
            report.record(e);
        }
    }

    // --- Blocks ---

    @Override
    public Void visitBlock(Block block, BuildFrame frame) {
        boolean unchecked = block.unchecked() || frame.unchecked();
        NodeIdx ctxNode = graph.addNode(new Context(block.loc(), unchecked));
        report.contextCreated(ctxNode);

        NodeIdx parent = frame.parent();
        if (parent != null) {
            Node parentNode = graph.node(parent);
            if (parentNode instanceof Function) {
                graph.addEdge(ctxNode, parent, Edge.CONTEXT);
            } else if (parentNode instanceof Context) {
                graph.addEdge(ctxNode, parent, Edge.SUBCONTEXT);
            } else {
                LOG.debug("block at {} has a {} parent; left unlinked", block.loc(), parentNode.label());
            }
            seedDeclarations(parent, ctxNode);
        }

        BuildFrame inner = new BuildFrame(ctxNode, unchecked);
        for (Statement stmt : block.statements()) {
            buildChild(stmt, inner);
        }
        return null;
    }

    /**
     * Gives the new scope fresh versions of the function's named parameters and returns. Which
     * scopes get them depends on {@link ParamSeeding}.
     */
    private void seedDeclarations(NodeIdx parent, NodeIdx ctxNode) {
        Optional<FunctionNode> function = seedingSource(parent);
        if (function.isEmpty()) {
            return;
        }
        FunctionNode fn = function.get();
        for (NodeIdx paramIdx : fn.params(graph)) {
            FunctionParam param = graph.node(paramIdx, FunctionParam.class);
            varFactory.fromFunctionParam(graph, param).ifPresent(cvar -> attachVariable(cvar, ctxNode));
        }
        for (NodeIdx retIdx : fn.returns(graph)) {
            FunctionReturn ret = graph.node(retIdx, FunctionReturn.class);
            varFactory.fromFunctionReturn(graph, ret).ifPresent(cvar -> attachVariable(cvar, ctxNode));
        }
    }

    private Optional<FunctionNode> seedingSource(NodeIdx parent) {
        Node parentNode = graph.node(parent);
        if (parentNode instanceof Function) {
            return Optional.of(new FunctionNode(parent));
        }
        if (parentNode instanceof Context && config.getParamSeeding() == ParamSeeding.EVERY_BLOCK) {
            return Optional.of(new ContextNode(parent).associatedFn(graph));
        }
        return Optional.empty();
    }

    private void attachVariable(ContextVar cvar, NodeIdx ctxNode) {
        NodeIdx cvarNode = graph.addNode(cvar);
        graph.addEdge(cvarNode, ctxNode, Edge.VARIABLE);
    }

    // --- Expression and return statements ---

    @Override
    public Void visitExpression(ExpressionStatement stmt, BuildFrame frame) {
        if (frame.parent() == null) {
            return null;
        }
        ContextNode ctx = enclosingContext(frame);
        List<NodeIdx> exprNodes = dispatcher.evaluate(stmt.expression(), ctx);
        if (!exprNodes.isEmpty()) {
            graph.addEdge(exprNodes.get(0), ctx.idx(), Edge.CALL);
        }
        return null;
    }

    @Override
    public Void visitReturn(Return stmt, BuildFrame frame) {
        if (stmt.expression() == null || frame.parent() == null) {
            return null;
        }
        ContextNode ctx = enclosingContext(frame);
        NodeIdx exprNode = dispatcher.evaluateSingle(stmt.expression(), ctx, "returned expression");
        graph.addEdge(exprNode, ctx.idx(), Edge.RETURN);
        return null;
    }

    private ContextNode enclosingContext(BuildFrame frame) {
        graph.node(frame.parent(), Context.class);
        return new ContextNode(frame.parent());
    }

    // --- Extension points: no semantics yet ---

    @Override
    public Void visitVariableDefinition(VariableDefinition stmt, BuildFrame frame) {
        return unsupported("variable definition", stmt.loc());
    }

    @Override
    public Void visitAssembly(Assembly stmt, BuildFrame frame) {
        return unsupported("inline assembly", stmt.loc());
    }

    @Override
    public Void visitArgs(Args stmt, BuildFrame frame) {
        return unsupported("argument list", stmt.loc());
    }

    @Override
    public Void visitIf(If stmt, BuildFrame frame) {
        return unsupported("if", stmt.loc());
    }

    @Override
    public Void visitWhile(While stmt, BuildFrame frame) {
        return unsupported("while", stmt.loc());
    }

    @Override
    public Void visitFor(For stmt, BuildFrame frame) {
        return unsupported("for", stmt.loc());
    }

    @Override
    public Void visitDoWhile(DoWhile stmt, BuildFrame frame) {
        return unsupported("do-while", stmt.loc());
    }

    @Override
    public Void visitContinue(Continue stmt, BuildFrame frame) {
        return unsupported("continue", stmt.loc());
    }

    @Override
    public Void visitBreak(Break stmt, BuildFrame frame) {
        return unsupported("break", stmt.loc());
    }

    @Override
    public Void visitRevert(Revert stmt, BuildFrame frame) {
        return unsupported("revert", stmt.loc());
    }

    @Override
    public Void visitRevertNamedArgs(RevertNamedArgs stmt, BuildFrame frame) {
        return unsupported("revert with named arguments", stmt.loc());
    }

    @Override
    public Void visitEmit(Emit stmt, BuildFrame frame) {
        return unsupported("emit", stmt.loc());
    }

    @Override
    public Void visitTry(Try stmt, BuildFrame frame) {
        return unsupported("try", stmt.loc());
    }

    @Override
    public Void visitError(ErrorStatement stmt, BuildFrame frame) {
        return unsupported("unparsable statement", stmt.loc());
    }

    private Void unsupported(String construct, Loc loc) {
        throw IrException.unsupported(construct, loc);
    }
}
