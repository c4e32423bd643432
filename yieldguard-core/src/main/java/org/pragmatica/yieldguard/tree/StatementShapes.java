package org.pragmatica.yieldguard.tree;

import org.pragmatica.yieldguard.tree.Expression.AwaitExpression;
import org.pragmatica.yieldguard.tree.Expression.CallExpression;
import org.pragmatica.yieldguard.tree.Expression.ThrowExpression;
import org.pragmatica.yieldguard.tree.Statement.ExpressionStatement;
import org.pragmatica.yieldguard.tree.Statement.ReturnStatement;
import org.pragmatica.yieldguard.tree.Statement.VariableDeclarationStatement;

import java.util.Optional;

/// Structural queries over statements shared by rules and fixes.
public final class StatementShapes {
    private StatementShapes() {}

    /// Call performed inline by an expression statement or a variable initializer.
    /// Return statements are left to [#returnedCall(Statement)].
    public static Optional<CallExpression> inlineCall(Statement statement) {
        if (statement instanceof ExpressionStatement expressionStatement) {
            return performedCall(expressionStatement.expression());
        }
        if (statement instanceof VariableDeclarationStatement declaration) {
            return declaration.variables()
                              .stream()
                              .flatMap(variable -> variable.initializer()
                                                           .flatMap(StatementShapes::performedCall)
                                                           .stream())
                              .findFirst();
        }
        return Optional.empty();
    }

    /// Call whose result is returned directly, `return await call()` or `return call()`.
    public static Optional<CallExpression> returnedCall(Statement statement) {
        if (statement instanceof ReturnStatement returnStatement) {
            return returnStatement.expression()
                                  .flatMap(StatementShapes::performedCall);
        }
        return Optional.empty();
    }

    /// Expression of a `return` statement, if any.
    public static Optional<Expression> returnedExpression(Statement statement) {
        if (statement instanceof ReturnStatement returnStatement) {
            return returnStatement.expression();
        }
        return Optional.empty();
    }

    public static boolean isThrow(Statement statement) {
        return statement instanceof ExpressionStatement expressionStatement
               && expressionStatement.expression() instanceof ThrowExpression;
    }

    /// Either a bare call or an awaited call.
    public static Optional<CallExpression> performedCall(Expression expression) {
        if (expression instanceof AwaitExpression awaitExpression) {
            return awaitExpression.expression() instanceof CallExpression call
                   ? Optional.of(call)
                   : Optional.empty();
        }
        if (expression instanceof CallExpression call) {
            return Optional.of(call);
        }
        return Optional.empty();
    }
}
