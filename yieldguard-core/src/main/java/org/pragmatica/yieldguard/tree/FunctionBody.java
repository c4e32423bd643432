package org.pragmatica.yieldguard.tree;

import org.pragmatica.yieldguard.tree.Statement.Block;

/// Body of a function or method as handed over by the host.
public sealed interface FunctionBody {

    record BlockBody(Block block) implements FunctionBody {}

    /// Arrow/expression body. Rules that need statement adjacency skip it.
    record ExpressionBody(Expression expression) implements FunctionBody {}
}
