package org.pragmatica.yieldguard.tree;

/// Named function, method or constructor with its full source range.
public record FunctionDeclaration(String name, SourceRange range, FunctionBody body) {
    public static FunctionDeclaration functionDeclaration(String name, SourceRange range, FunctionBody body) {
        return new FunctionDeclaration(name, range, body);
    }
}
