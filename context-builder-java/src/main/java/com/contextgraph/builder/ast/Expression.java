package com.contextgraph.builder.ast;

import com.contextgraph.graph.Loc;

import java.util.List;

/**
 * Expression shapes produced by the parser.
 */
public interface Expression {

    Loc loc();

    <R, P> R accept(ExpressionVisitor<R, P> visitor, P arg);

    record Variable(Identifier identifier) implements Expression {
        public Loc loc() { return identifier.loc(); }
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitVariable(this, arg); }
    }

    /** {@code exponent} is null when the literal has no scientific suffix. */
    record NumberLiteral(Loc loc, String value, String exponent) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitNumberLiteral(this, arg); }
    }

    record AddressLiteral(Loc loc, String address) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitAddressLiteral(this, arg); }
    }

    /** Adjacent string literals ({@code "a" "b"}) arrive as several parts. */
    record StringLiteral(List<StringPart> parts) implements Expression {
        public Loc loc() { return parts.isEmpty() ? Loc.IMPLICIT : parts.get(0).loc(); }
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitStringLiteral(this, arg); }
    }

    record StringPart(Loc loc, String text) {}

    record BoolLiteral(Loc loc, boolean value) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitBoolLiteral(this, arg); }
    }

    record Binary(Loc loc, BinaryOperator operator, Expression lhs, Expression rhs) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitBinary(this, arg); }
    }

    record CompoundAssign(Loc loc, AssignOperator operator, Expression lhs, Expression rhs) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitCompoundAssign(this, arg); }
    }

    record Assign(Loc loc, Expression lhs, Expression rhs) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitAssign(this, arg); }
    }

    /** {@code index} is null for an array type reference such as {@code uint[]}. */
    record ArraySubscript(Loc loc, Expression base, Expression index) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitArraySubscript(this, arg); }
    }

    /** Elementary type used as an expression, e.g. the {@code uint8} in {@code uint8(x)}. */
    record ElementaryType(Loc loc, String keyword) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitElementaryType(this, arg); }
    }

    record MemberAccess(Loc loc, Expression base, Identifier member) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitMemberAccess(this, arg); }
    }

    record FunctionCall(Loc loc, Expression callee, List<Expression> args) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitFunctionCall(this, arg); }
    }

    record Unary(Loc loc, UnaryOperator operator, Expression operand) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitUnary(this, arg); }
    }

    record Conditional(Loc loc, Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitConditional(this, arg); }
    }

    /** Parenthesised list such as {@code (a, b)}; null entries are omitted slots. */
    record Tuple(Loc loc, List<Expression> elements) implements Expression {
        public <R, P> R accept(ExpressionVisitor<R, P> v, P arg) { return v.visitTuple(this, arg); }
    }
}
