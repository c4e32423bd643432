package org.pragmatica.yieldguard.tree;

import java.util.List;
import java.util.Optional;

/// Statement variants.
///
/// Only the control-flow wrappers the linearizer descends into get their own
/// variants; everything else the host cannot express is an [OtherStatement].
public sealed interface Statement extends SyntaxNode {

    /// Braced statement list.
    record Block(SourceRange range, List<Statement> statements) implements Statement {
        public Block {
            statements = List.copyOf(statements);
        }
    }

    record ExpressionStatement(SourceRange range, Expression expression) implements Statement {}

    record VariableDeclarationStatement(SourceRange range, List<VariableDeclarator> variables) implements Statement {
        public VariableDeclarationStatement {
            variables = List.copyOf(variables);
        }
    }

    /// One declared name with its optional initializer.
    record VariableDeclarator(String name, Optional<Expression> initializer) {}

    record ReturnStatement(SourceRange range, Optional<Expression> expression) implements Statement {}

    record TryStatement(SourceRange range,
                        Block body,
                        List<Block> catchBlocks,
                        Optional<Block> finallyBlock) implements Statement {
        public TryStatement {
            catchBlocks = List.copyOf(catchBlocks);
        }
    }

    record IfStatement(SourceRange range,
                       Statement thenStatement,
                       Optional<Statement> elseStatement) implements Statement {}

    /// Any counted or iterating loop (`for`, for-each).
    record ForStatement(SourceRange range, Statement body) implements Statement {}

    /// Condition-driven loop (`while`, `do`/`while`).
    record WhileStatement(SourceRange range, Statement body) implements Statement {}

    /// Statement shape the analysis treats as opaque.
    record OtherStatement(SourceRange range) implements Statement {}
}
