package org.pragmatica.yieldguard.source;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.Optional;
import java.util.regex.Pattern;

/// Reads the call performed by a configured mitigation statement, so the statement a fix
/// inserts is recognized as a mitigation afterwards.
///
/// A leading `await` is dropped before parsing, which makes `await DelayUtils.yieldToUI();`
/// and `DelayUtils.yieldToUI();` both resolve to `yieldToUI`.
public final class MitigationStatements {
    private static final Pattern AWAIT_PREFIX = Pattern.compile("^await\\s+");

    private MitigationStatements() {}

    public static Optional<String> callName(String statement) {
        var javaStatement = AWAIT_PREFIX.matcher(statement.trim())
                                        .replaceFirst("");
        ParseResult<Statement> result = createParser().parseStatement(javaStatement);

        if (!result.isSuccessful()) {
            return Optional.empty();
        }
        return result.getResult()
                     .filter(ExpressionStmt.class::isInstance)
                     .map(parsed -> ((ExpressionStmt) parsed).getExpression())
                     .filter(MethodCallExpr.class::isInstance)
                     .map(expression -> ((MethodCallExpr) expression).getNameAsString());
    }

    private static JavaParser createParser() {
        var configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return new JavaParser(configuration);
    }
}
