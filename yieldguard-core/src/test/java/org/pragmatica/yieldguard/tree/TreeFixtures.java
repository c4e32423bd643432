package org.pragmatica.yieldguard.tree;

import org.pragmatica.yieldguard.source.SourceDialect;
import org.pragmatica.yieldguard.source.SourceUnit;
import org.pragmatica.yieldguard.tree.Expression.AwaitExpression;
import org.pragmatica.yieldguard.tree.Expression.CallExpression;
import org.pragmatica.yieldguard.tree.Expression.Identifier;
import org.pragmatica.yieldguard.tree.Expression.OtherExpression;
import org.pragmatica.yieldguard.tree.Expression.ThrowExpression;
import org.pragmatica.yieldguard.tree.FunctionBody.BlockBody;
import org.pragmatica.yieldguard.tree.Statement.Block;
import org.pragmatica.yieldguard.tree.Statement.ExpressionStatement;
import org.pragmatica.yieldguard.tree.Statement.ReturnStatement;
import org.pragmatica.yieldguard.tree.Statement.TryStatement;
import org.pragmatica.yieldguard.tree.Statement.VariableDeclarationStatement;
import org.pragmatica.yieldguard.tree.Statement.VariableDeclarator;

import java.util.List;
import java.util.Optional;

/// Builds trees over a source text the way a Dart host would hand them over.
///
/// Ranges are located by searching the text from a cursor that only moves forward, so
/// nodes must be created in source order: a statement before its parts, and statements
/// in the order they appear.
public final class TreeFixtures {
    private final String content;
    private int cursor;

    private TreeFixtures(String content) {
        this.content = content;
    }

    public static TreeFixtures treeFixtures(String content) {
        return new TreeFixtures(content);
    }

    public String content() {
        return content;
    }

    public SourceRange find(String snippet) {
        var offset = content.indexOf(snippet, cursor);
        if (offset < 0) {
            throw new IllegalArgumentException("'" + snippet + "' not found after offset " + cursor);
        }
        cursor = offset;
        return SourceRange.sourceRange(offset, snippet.length());
    }

    /// `await receiver.name(args);`, or `await name(args);` when `receiver` is null.
    public ExpressionStatement awaitCall(String receiver, String name, String args) {
        var callText = callText(receiver, name, args);
        var statementRange = find("await " + callText + ";");
        var awaitRange = SourceRange.sourceRange(statementRange.offset(), statementRange.length() - 1);
        return new ExpressionStatement(statementRange, new AwaitExpression(awaitRange, call(receiver, name, args)));
    }

    /// `name(args);` without await.
    public ExpressionStatement plainCall(String receiver, String name, String args) {
        var statementRange = find(callText(receiver, name, args) + ";");
        return new ExpressionStatement(statementRange, call(receiver, name, args));
    }

    /// `final variable = await receiver.name(args);`
    public VariableDeclarationStatement awaitDeclaration(String variable, String receiver, String name, String args) {
        var callText = callText(receiver, name, args);
        var statementRange = find("final " + variable + " = await " + callText + ";");
        var awaitRange = find("await " + callText);
        var initializer = new AwaitExpression(awaitRange, call(receiver, name, args));
        return new VariableDeclarationStatement(statementRange,
                                                List.of(new VariableDeclarator(variable, Optional.of(initializer))));
    }

    /// `return await receiver.name(args);`
    public ReturnStatement returnAwait(String receiver, String name, String args) {
        var callText = callText(receiver, name, args);
        var statementRange = find("return await " + callText + ";");
        var awaitRange = find("await " + callText);
        return new ReturnStatement(statementRange,
                                   Optional.of(new AwaitExpression(awaitRange, call(receiver, name, args))));
    }

    /// `return value;`
    public ReturnStatement returnValue(String value) {
        var statementRange = find("return " + value + ";");
        return new ReturnStatement(statementRange, Optional.of(new Identifier(find(value), value)));
    }

    /// `throw text;`
    public ExpressionStatement throwing(String text) {
        var statementRange = find("throw " + text + ";");
        var throwRange = SourceRange.sourceRange(statementRange.offset(), statementRange.length() - 1);
        return new ExpressionStatement(statementRange, new ThrowExpression(throwRange, new OtherExpression(find(text))));
    }

    public Block block(Statement... statements) {
        var first = statements[0].range();
        var last = statements[statements.length - 1].range();
        return new Block(SourceRange.between(first.offset(), last.end()), List.of(statements));
    }

    public TryStatement tryCatch(Block body, Block catchBlock) {
        return new TryStatement(SourceRange.between(body.range().offset(), catchBlock.range().end()),
                                body,
                                List.of(catchBlock),
                                Optional.empty());
    }

    public FunctionDeclaration function(String name, Statement... statements) {
        return FunctionDeclaration.functionDeclaration(name,
                                                       SourceRange.sourceRange(0, content.length()),
                                                       new BlockBody(block(statements)));
    }

    public SourceUnit unit(FunctionDeclaration... functions) {
        return SourceUnit.sourceUnit("lib/repository.dart", content, SourceDialect.DART, List.of(functions));
    }

    private CallExpression call(String receiver, String name, String args) {
        var callRange = find(callText(receiver, name, args));
        Optional<Expression> receiverNode = receiver == null
                                            ? Optional.empty()
                                            : Optional.of(new Identifier(find(receiver), receiver));
        return new CallExpression(callRange, name, receiverNode);
    }

    private static String callText(String receiver, String name, String args) {
        return (receiver == null ? "" : receiver + ".") + name + "(" + args + ")";
    }
}
