package org.pragmatica.yieldguard.tree;

/// Root of the closed set of node variants the analysis consumes.
///
/// Hosts translate their own parse trees into these records; the analysis never
/// sees host-specific node types. Every node carries the character range it
/// occupies in the source buffer.
public sealed interface SyntaxNode permits Statement, Expression {
    SourceRange range();
}
