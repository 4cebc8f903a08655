package com.contextgraph.builder.ast;

import com.contextgraph.builder.ast.Expression.*;

/**
 * Visitor over {@link Expression} shapes.
 */
public interface ExpressionVisitor<R, P> {
    R visitVariable(Variable expr, P arg);
    R visitNumberLiteral(NumberLiteral expr, P arg);
    R visitAddressLiteral(AddressLiteral expr, P arg);
    R visitStringLiteral(StringLiteral expr, P arg);
    R visitBoolLiteral(BoolLiteral expr, P arg);
    R visitBinary(Binary expr, P arg);
    R visitCompoundAssign(CompoundAssign expr, P arg);
    R visitAssign(Assign expr, P arg);
    R visitArraySubscript(ArraySubscript expr, P arg);
    R visitElementaryType(ElementaryType expr, P arg);
    R visitMemberAccess(MemberAccess expr, P arg);
    R visitFunctionCall(FunctionCall expr, P arg);
    R visitUnary(Unary expr, P arg);
    R visitConditional(Conditional expr, P arg);
    R visitTuple(Tuple expr, P arg);
}
