package org.pragmatica.yieldguard.source;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import org.pragmatica.yieldguard.shared.LintError;
import org.pragmatica.yieldguard.shared.LintException;
import org.pragmatica.yieldguard.shared.SourceFile;
import org.pragmatica.yieldguard.tree.Expression;
import org.pragmatica.yieldguard.tree.Expression.AwaitExpression;
import org.pragmatica.yieldguard.tree.Expression.CallExpression;
import org.pragmatica.yieldguard.tree.Expression.Identifier;
import org.pragmatica.yieldguard.tree.Expression.OtherExpression;
import org.pragmatica.yieldguard.tree.Expression.PropertyAccess;
import org.pragmatica.yieldguard.tree.Expression.ThrowExpression;
import org.pragmatica.yieldguard.tree.FunctionBody.BlockBody;
import org.pragmatica.yieldguard.tree.FunctionDeclaration;
import org.pragmatica.yieldguard.tree.SourceRange;
import org.pragmatica.yieldguard.tree.Statement;
import org.pragmatica.yieldguard.tree.Statement.Block;
import org.pragmatica.yieldguard.tree.Statement.ExpressionStatement;
import org.pragmatica.yieldguard.tree.Statement.ForStatement;
import org.pragmatica.yieldguard.tree.Statement.IfStatement;
import org.pragmatica.yieldguard.tree.Statement.OtherStatement;
import org.pragmatica.yieldguard.tree.Statement.ReturnStatement;
import org.pragmatica.yieldguard.tree.Statement.TryStatement;
import org.pragmatica.yieldguard.tree.Statement.VariableDeclarationStatement;
import org.pragmatica.yieldguard.tree.Statement.VariableDeclarator;
import org.pragmatica.yieldguard.tree.Statement.WhileStatement;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/// Host adapter turning Java sources into [SourceUnit]s with JavaParser.
///
/// Java has no `await`; a blocking `join()`/`await()` on the result of another call is
/// modelled as an [AwaitExpression] over that call, everything else is a direct
/// invocation.
public final class JavaSourceParser {
    private static final Set<String> BLOCKING_JOINS = Set.of("join", "await");

    private final JavaParser parser;

    private JavaSourceParser() {
        this.parser = createParser();
    }

    public static JavaSourceParser javaSourceParser() {
        return new JavaSourceParser();
    }

    /// Parse a file into a [SourceUnit].
    ///
    /// @throws LintException carrying [LintError.ParseError] when the source is not valid Java
    public SourceUnit parse(SourceFile source) {
        var compilationUnit = parseCompilationUnit(source);
        var lineIndex = LineIndex.lineIndex(source.content());
        var converter = new TreeConverter(lineIndex);
        var functions = Stream.<CallableDeclaration<?>>concat(compilationUnit.findAll(MethodDeclaration.class).stream(),
                                                              compilationUnit.findAll(ConstructorDeclaration.class).stream())
                              .sorted(Comparator.comparingInt(converter::startOffset))
                              .flatMap(callable -> converter.function(callable).stream())
                              .toList();

        return new SourceUnit(source.fileName(), source.content(), lineIndex, SourceDialect.JAVA, functions);
    }

    private CompilationUnit parseCompilationUnit(SourceFile source) {
        ParseResult<CompilationUnit> result = parser.parse(source.content());

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }

        var problem = result.getProblems().stream()
                .findFirst();
        var location = problem.flatMap(p -> p.getLocation())
                .flatMap(l -> l.getBegin().getRange());
        int line = location.map(r -> r.begin.line).orElse(1);
        int column = location.map(r -> r.begin.column).orElse(1);
        var detail = problem.map(p -> p.getMessage()).orElse("Unknown parse error");

        throw new LintException(LintError.parseError(source.fileName(), line, column, detail));
    }

    private static JavaParser createParser() {
        var configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return new JavaParser(configuration);
    }

    /// Converts JavaParser nodes into the analysis tree for one compilation unit.
    private record TreeConverter(LineIndex lineIndex) {

        Optional<FunctionDeclaration> function(CallableDeclaration<?> callable) {
            Optional<BlockStmt> body = callable instanceof MethodDeclaration method
                                       ? method.getBody()
                                       : Optional.of(((ConstructorDeclaration) callable).getBody());

            return body.map(block -> FunctionDeclaration.functionDeclaration(callable.getNameAsString(),
                                                                             range(callable),
                                                                             new BlockBody(block(block))));
        }

        int startOffset(Node node) {
            return range(node).offset();
        }

        Block block(BlockStmt block) {
            return new Block(range(block),
                             block.getStatements()
                                  .stream()
                                  .map(this::statement)
                                  .toList());
        }

        Statement statement(Node node) {
            if (node instanceof BlockStmt block) {
                return block(block);
            }
            if (node instanceof ExpressionStmt expressionStmt) {
                return expressionStatement(expressionStmt);
            }
            if (node instanceof ReturnStmt returnStmt) {
                return new ReturnStatement(range(returnStmt), returnStmt.getExpression().map(this::expression));
            }
            if (node instanceof ThrowStmt throwStmt) {
                return new ExpressionStatement(range(throwStmt),
                                               new ThrowExpression(range(throwStmt),
                                                                   expression(throwStmt.getExpression())));
            }
            if (node instanceof TryStmt tryStmt) {
                return new TryStatement(range(tryStmt),
                                        block(tryStmt.getTryBlock()),
                                        tryStmt.getCatchClauses()
                                               .stream()
                                               .map(CatchClause::getBody)
                                               .map(this::block)
                                               .toList(),
                                        tryStmt.getFinallyBlock().map(this::block));
            }
            if (node instanceof IfStmt ifStmt) {
                return new IfStatement(range(ifStmt),
                                       statement(ifStmt.getThenStmt()),
                                       ifStmt.getElseStmt().map(this::statement));
            }
            if (node instanceof ForStmt forStmt) {
                return new ForStatement(range(forStmt), statement(forStmt.getBody()));
            }
            if (node instanceof ForEachStmt forEachStmt) {
                return new ForStatement(range(forEachStmt), statement(forEachStmt.getBody()));
            }
            if (node instanceof WhileStmt whileStmt) {
                return new WhileStatement(range(whileStmt), statement(whileStmt.getBody()));
            }
            if (node instanceof DoStmt doStmt) {
                return new WhileStatement(range(doStmt), statement(doStmt.getBody()));
            }
            if (node instanceof LabeledStmt labeledStmt) {
                return statement(labeledStmt.getStatement());
            }
            return new OtherStatement(range(node));
        }

        private Statement expressionStatement(ExpressionStmt expressionStmt) {
            if (expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration) {
                return new VariableDeclarationStatement(range(expressionStmt),
                                                        declaration.getVariables()
                                                                   .stream()
                                                                   .map(variable -> new VariableDeclarator(variable.getNameAsString(),
                                                                                                           variable.getInitializer()
                                                                                                                   .map(this::expression)))
                                                                   .toList());
            }
            return new ExpressionStatement(range(expressionStmt), expression(expressionStmt.getExpression()));
        }

        Expression expression(Node node) {
            if (node instanceof MethodCallExpr call) {
                return call(call);
            }
            if (node instanceof NameExpr name) {
                return new Identifier(range(name), name.getNameAsString());
            }
            if (node instanceof FieldAccessExpr fieldAccess) {
                return new PropertyAccess(range(fieldAccess),
                                          expression(fieldAccess.getScope()),
                                          fieldAccess.getNameAsString());
            }
            if (node instanceof EnclosedExpr enclosed) {
                return expression(enclosed.getInner());
            }
            return new OtherExpression(range(node));
        }

        private Expression call(MethodCallExpr call) {
            var receiver = call.getScope().map(this::expression);

            if (isBlockingJoin(call) && receiver.filter(CallExpression.class::isInstance).isPresent()) {
                return new AwaitExpression(range(call), receiver.get());
            }
            return new CallExpression(range(call), call.getNameAsString(), receiver);
        }

        private static boolean isBlockingJoin(MethodCallExpr call) {
            return BLOCKING_JOINS.contains(call.getNameAsString()) && call.getArguments().isEmpty();
        }

        SourceRange range(Node node) {
            return node.getRange()
                       .map(r -> lineIndex.rangeOf(r.begin.line, r.begin.column, r.end.line, r.end.column))
                       .orElse(SourceRange.EMPTY);
        }
    }
}
