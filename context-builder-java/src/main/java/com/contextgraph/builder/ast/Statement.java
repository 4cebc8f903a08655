package com.contextgraph.builder.ast;

import com.contextgraph.graph.Loc;

import java.util.List;

/**
 * Statement shapes produced by the parser.
 */
public interface Statement {

    Loc loc();

    <R, P> R accept(StatementVisitor<R, P> visitor, P arg);

    record Block(Loc loc, boolean unchecked, List<Statement> statements) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitBlock(this, arg); }
    }

    /** {@code initializer} is null for a bare declaration. */
    record VariableDefinition(Loc loc, String typeName, Identifier name, Expression initializer) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitVariableDefinition(this, arg); }
    }

    record Assembly(Loc loc, String dialect) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitAssembly(this, arg); }
    }

    record Args(Loc loc, List<Expression> args) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitArgs(this, arg); }
    }

    /** {@code elseBranch} is null when absent. */
    record If(Loc loc, Expression condition, Statement thenBranch, Statement elseBranch) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitIf(this, arg); }
    }

    record While(Loc loc, Expression condition, Statement body) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitWhile(this, arg); }
    }

    record ExpressionStatement(Loc loc, Expression expression) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitExpression(this, arg); }
    }

    /** Every part may be null. */
    record For(Loc loc, Statement init, Expression condition, Expression update, Statement body) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitFor(this, arg); }
    }

    record DoWhile(Loc loc, Statement body, Expression condition) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitDoWhile(this, arg); }
    }

    record Continue(Loc loc) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitContinue(this, arg); }
    }

    record Break(Loc loc) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitBreak(this, arg); }
    }

    /** {@code expression} is null for a bare {@code return;}. */
    record Return(Loc loc, Expression expression) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitReturn(this, arg); }
    }

    record Revert(Loc loc, String errorPath, List<Expression> args) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitRevert(this, arg); }
    }

    record RevertNamedArgs(Loc loc, String errorPath, List<NamedArgument> args) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitRevertNamedArgs(this, arg); }
    }

    record Emit(Loc loc, Expression event) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitEmit(this, arg); }
    }

    record Try(Loc loc, Expression expression, List<Statement> clauses) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitTry(this, arg); }
    }

    /** Placeholder the parser emits for a statement it could not recover. */
    record ErrorStatement(Loc loc) implements Statement {
        public <R, P> R accept(StatementVisitor<R, P> v, P arg) { return v.visitError(this, arg); }
    }

    record NamedArgument(Identifier name, Expression value) {}
}
