package org.pragmatica.yieldguard.tree;

import java.util.Optional;

/// Expression variants relevant to call classification.
public sealed interface Expression extends SyntaxNode {

    /// Method or function invocation, e.g. `isar.users.findAll()` has name `findAll`
    /// and receiver `isar.users`.
    record CallExpression(SourceRange range, String name, Optional<Expression> receiver) implements Expression, HasReceiver {}

    /// Suspension point over an asynchronous operation (`await x`, or a blocking `join()` on a call).
    record AwaitExpression(SourceRange range, Expression expression) implements Expression {}

    record ThrowExpression(SourceRange range, Expression expression) implements Expression {}

    record Identifier(SourceRange range, String name) implements Expression {}

    /// Member access `target.name` that is not an invocation.
    record PropertyAccess(SourceRange range, Expression target, String name) implements Expression, HasReceiver {
        @Override
        public Optional<Expression> receiver() {
            return Optional.of(target);
        }
    }

    record OtherExpression(SourceRange range) implements Expression {}
}
