package com.contextgraph.builder;

import com.contextgraph.builder.ast.*;
import com.contextgraph.builder.ast.Expression.*;
import com.contextgraph.builder.ast.Statement.*;
import com.contextgraph.graph.Loc;

import java.util.Arrays;
import java.util.List;

/**
 * Small builders for hand-written syntax trees. Every node gets a distinct location in file 0
 * unless one is passed explicitly.
 */
final class AstFixtures {

    private static int offset = 0;

    private AstFixtures() {}

    static Loc loc() {
        int start = offset;
        offset += 10;
        return Loc.of(0, start, start + 5);
    }

    static Identifier id(String name) {
        return new Identifier(loc(), name);
    }

    static Expression var(String name) {
        return new Variable(id(name));
    }

    static Expression num(long value) {
        return new NumberLiteral(loc(), Long.toString(value), null);
    }

    static Expression bin(Expression lhs, BinaryOperator op, Expression rhs) {
        return new Binary(loc(), op, lhs, rhs);
    }

    static Expression assign(Expression lhs, Expression rhs) {
        return new Assign(loc(), lhs, rhs);
    }

    static Expression call(String callee, Expression... args) {
        return new FunctionCall(loc(), var(callee), Arrays.asList(args));
    }

    static Statement exprStmt(Expression expr) {
        return new ExpressionStatement(loc(), expr);
    }

    static Statement ret(Expression expr) {
        return new Return(loc(), expr);
    }

    static Block block(Statement... statements) {
        return new Block(loc(), false, Arrays.asList(statements));
    }

    static Block uncheckedBlock(Statement... statements) {
        return new Block(loc(), true, Arrays.asList(statements));
    }

    static Statement whileLoop(Expression condition, Statement body) {
        return new While(loc(), condition, body);
    }

    static Parameter param(String typeName, String name) {
        return new Parameter(loc(), typeName, name != null ? id(name) : null);
    }

    static FunctionDefinition function(String name, List<Parameter> params, List<Parameter> returns, Statement body) {
        return new FunctionDefinition(loc(), name, params, returns, body);
    }

    static ContractDefinition contract(String name, FunctionDefinition... functions) {
        return new ContractDefinition(loc(), name, Arrays.asList(functions));
    }
}
