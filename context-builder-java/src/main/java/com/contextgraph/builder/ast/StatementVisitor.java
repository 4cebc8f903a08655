package com.contextgraph.builder.ast;

import com.contextgraph.builder.ast.Statement.*;

/**
 * Visitor over {@link Statement} shapes. {@code P} is a caller-supplied argument threaded
 * through the traversal.
 */
public interface StatementVisitor<R, P> {
    R visitBlock(Block block, P arg);
    R visitVariableDefinition(VariableDefinition stmt, P arg);
    R visitAssembly(Assembly stmt, P arg);
    R visitArgs(Args stmt, P arg);
    R visitIf(If stmt, P arg);
    R visitWhile(While stmt, P arg);
    R visitExpression(ExpressionStatement stmt, P arg);
    R visitFor(For stmt, P arg);
    R visitDoWhile(DoWhile stmt, P arg);
    R visitContinue(Continue stmt, P arg);
    R visitBreak(Break stmt, P arg);
    R visitReturn(Return stmt, P arg);
    R visitRevert(Revert stmt, P arg);
    R visitRevertNamedArgs(RevertNamedArgs stmt, P arg);
    R visitEmit(Emit stmt, P arg);
    R visitTry(Try stmt, P arg);
    R visitError(ErrorStatement stmt, P arg);
}
