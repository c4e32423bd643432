package org.pragmatica.yieldguard.lint.rules;

import org.pragmatica.yieldguard.classify.OperationCategory;
import org.pragmatica.yieldguard.linearize.StatementLinearizer;
import org.pragmatica.yieldguard.lint.AnalysisSession;
import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintImpact;
import org.pragmatica.yieldguard.tree.FunctionDeclaration;
import org.pragmatica.yieldguard.tree.StatementShapes;

import java.util.stream.Stream;

/**
 * Flags {@code return await write()} (in Java, {@code return write()}) where the write
 * result is returned in the same statement, leaving no place for a yield.
 *
 * Reported regardless of what follows, since nothing can follow a return.
 */
public final class ReturnAwaitRule implements LintRule {
    public static final String RULE_ID = "avoid_return_await_db";

    private final String ruleId;

    private ReturnAwaitRule(String ruleId) {
        this.ruleId = ruleId;
    }

    public static ReturnAwaitRule avoidReturnAwaitDb() {
        return new ReturnAwaitRule(RULE_ID);
    }

    public static ReturnAwaitRule returnAwaitRule(String ruleId) {
        return new ReturnAwaitRule(ruleId);
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public String description() {
        return "Don't return the result of a database/IO write directly";
    }

    @Override
    public LintImpact impact() {
        return LintImpact.HIGH;
    }

    @Override
    public FixKind fixKind() {
        return FixKind.SPLIT_RETURN;
    }

    @Override
    public Stream<Diagnostic> analyze(FunctionDeclaration function, AnalysisSession session, DiagnosticSeverity severity) {
        return StatementLinearizer.linearize(function.body())
                                  .stream()
                                  .filter(slot -> StatementShapes.returnedCall(slot.statement())
                                                                 .map(session::classify)
                                                                 .filter(OperationCategory.WRITE::equals)
                                                                 .isPresent())
                                  .map(slot -> session.emit(ruleId,
                                                            severity,
                                                            impact(),
                                                            slot.statement().range(),
                                                            "Returning directly from a database/IO write skips yieldToUI().",
                                                            "Save the result to a variable, call yieldToUI(), then return the variable."));
    }
}
