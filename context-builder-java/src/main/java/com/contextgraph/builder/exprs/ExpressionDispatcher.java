package com.contextgraph.builder.exprs;

import com.contextgraph.builder.ast.Expression;
import com.contextgraph.builder.ast.Expression.*;
import com.contextgraph.builder.ast.ExpressionVisitor;
import com.contextgraph.builder.context.VariableVersioning;
import com.contextgraph.graph.ContextGraph;
import com.contextgraph.graph.IrException;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.node.Builtin;
import com.contextgraph.graph.node.BuiltinRegistry;
import com.contextgraph.graph.node.ContextNode;
import com.contextgraph.graph.node.Function;
import com.contextgraph.graph.node.Node;
import com.contextgraph.graph.range.Op;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Routes each expression to the handler that produces its value nodes.
 *
 * The result is the ordered list of node ids the expression evaluates to. It is empty only for
 * expressions that produce no value, which today means {@code require(...)} and
 * {@code assert(...)}.
 */
public class ExpressionDispatcher implements ExpressionVisitor<List<NodeIdx>, ContextNode> {

    private static final Logger LOG = LogManager.getLogger(ExpressionDispatcher.class);

    static final Set<String> ASSERTION_FUNCTIONS = Set.of("require", "assert");

    private final ContextGraph graph;
    private final BuiltinRegistry builtins;
    private final VariableResolver resolver;
    private final LiteralHandler literals;
    private final OperatorHandler operators;
    private final MemberAccessHandler members;
    private final ArrayHandler arrays;
    private final RequireHandler requires;
    private final VariableVersioning versioning;

    public ExpressionDispatcher(ContextGraph graph, BuiltinRegistry builtins) {
        this.graph = graph;
        this.builtins = builtins;
        this.versioning = new VariableVersioning(graph, this);
        this.resolver = new VariableResolver(graph);
        this.literals = new LiteralHandler(graph, builtins);
        this.operators = new OperatorHandler(graph, builtins, this, versioning);
        this.members = new MemberAccessHandler(graph, this);
        this.arrays = new ArrayHandler(graph, builtins, this);
        this.requires = new RequireHandler(graph, this, versioning);
    }

    public List<NodeIdx> evaluate(Expression expr, ContextNode ctx) {
        return expr.accept(this, ctx);
    }

    /**
     * Evaluates {@code expr} and returns its first result.
     *
     * @throws IrException EMPTY_EVALUATION_RESULT when the expression yields nothing
     */
    public NodeIdx evaluateSingle(Expression expr, ContextNode ctx, String role) {
        List<NodeIdx> result = evaluate(expr, ctx);
        if (result.isEmpty()) {
            throw IrException.emptyResult(role, expr.loc());
        }
        return result.get(0);
    }

    public VariableVersioning versioning() {
        return versioning;
    }

    // --- Identifiers and literals ---

    @Override
    public List<NodeIdx> visitVariable(Variable expr, ContextNode ctx) {
        return List.of(resolver.resolve(expr.identifier(), ctx));
    }

    @Override
    public List<NodeIdx> visitNumberLiteral(NumberLiteral expr, ContextNode ctx) {
        return List.of(literals.numberLiteral(expr.loc(), expr.value(), expr.exponent()));
    }

    @Override
    public List<NodeIdx> visitAddressLiteral(AddressLiteral expr, ContextNode ctx) {
        return List.of(literals.addressLiteral(expr.loc(), expr.address()));
    }

    @Override
    public List<NodeIdx> visitStringLiteral(StringLiteral expr, ContextNode ctx) {
        List<NodeIdx> parts = new ArrayList<>();
        for (StringPart part : expr.parts()) {
            parts.add(literals.stringLiteral(part.loc(), part.text()));
        }
        return parts;
    }

    @Override
    public List<NodeIdx> visitBoolLiteral(BoolLiteral expr, ContextNode ctx) {
        return List.of(literals.boolLiteral(expr.loc(), expr.value()));
    }

    // --- Operators ---

    @Override
    public List<NodeIdx> visitBinary(Binary expr, ContextNode ctx) {
        Op op = switch (expr.operator()) {
            case ADD -> Op.ADD;
            case SUBTRACT -> Op.SUB;
            case MULTIPLY -> Op.MUL;
            case DIVIDE -> Op.DIV;
            case MODULO -> Op.MOD;
            case EQUAL -> Op.EQ;
            case LESS -> Op.LT;
            case MORE -> Op.GT;
            case LESS_EQUAL -> Op.LTE;
            case MORE_EQUAL -> Op.GTE;
            default -> throw IrException.unsupported("binary operator " + expr.operator().symbol(), expr.loc());
        };
        if (op.isComparison()) {
            return operators.cmp(expr.loc(), expr.lhs(), op, expr.rhs(), ctx);
        }
        return operators.opExpr(expr.loc(), expr.lhs(), expr.rhs(), ctx, op, false);
    }

    @Override
    public List<NodeIdx> visitCompoundAssign(CompoundAssign expr, ContextNode ctx) {
        Op op = switch (expr.operator()) {
            case ASSIGN_ADD -> Op.ADD;
            case ASSIGN_SUBTRACT -> Op.SUB;
            case ASSIGN_MULTIPLY -> Op.MUL;
            case ASSIGN_DIVIDE -> Op.DIV;
            case ASSIGN_MODULO -> Op.MOD;
            default -> throw IrException.unsupported("assignment operator " + expr.operator().symbol(), expr.loc());
        };
        return operators.opExpr(expr.loc(), expr.lhs(), expr.rhs(), ctx, op, true);
    }

    @Override
    public List<NodeIdx> visitAssign(Assign expr, ContextNode ctx) {
        return versioning.assign(expr.loc(), expr.lhs(), expr.rhs(), ctx);
    }

    // --- Types, arrays, members ---

    @Override
    public List<NodeIdx> visitArraySubscript(ArraySubscript expr, ContextNode ctx) {
        if (expr.index() == null) {
            return arrays.arrayTy(expr.loc(), expr.base(), ctx);
        }
        return arrays.indexIntoArray(expr.loc(), expr.base(), expr.index(), ctx);
    }

    @Override
    public List<NodeIdx> visitElementaryType(ElementaryType expr, ContextNode ctx) {
        Optional<Builtin> builtin = Builtin.tryFromKeyword(expr.keyword());
        if (builtin.isEmpty()) {
            throw IrException.unsupported("type " + expr.keyword(), expr.loc());
        }
        return List.of(builtins.intern(graph, builtin.get()));
    }

    @Override
    public List<NodeIdx> visitMemberAccess(MemberAccess expr, ContextNode ctx) {
        return members.memberAccess(expr.loc(), expr.base(), expr.member(), ctx);
    }

    // --- Calls ---

    @Override
    public List<NodeIdx> visitFunctionCall(FunctionCall expr, ContextNode ctx) {
        NodeIdx funcIdx = evaluateSingle(expr.callee(), ctx, "callee");

        Node callee = graph.node(funcIdx);
        if (callee instanceof Function && ASSERTION_FUNCTIONS.contains(((Function) callee).name())) {
            requires.handleRequire(expr.loc(), expr.args(), ctx);
            return List.of();
        }

        // Arguments are evaluated for the nodes and versions they create.
        for (Expression arg : expr.args()) {
            evaluate(arg, ctx);
        }

        // TODO: model call return values as their own nodes instead of reusing the callee
        LOG.debug("call to {} at {} yields the callee node", callee.label(), expr.loc());
        return List.of(funcIdx);
    }

    // --- Not supported yet ---

    @Override
    public List<NodeIdx> visitUnary(Unary expr, ContextNode ctx) {
        throw IrException.unsupported("unary operator " + expr.operator().symbol(), expr.loc());
    }

    @Override
    public List<NodeIdx> visitConditional(Conditional expr, ContextNode ctx) {
        throw IrException.unsupported("conditional expression", expr.loc());
    }

    @Override
    public List<NodeIdx> visitTuple(Tuple expr, ContextNode ctx) {
        throw IrException.unsupported("tuple expression", expr.loc());
    }
}
