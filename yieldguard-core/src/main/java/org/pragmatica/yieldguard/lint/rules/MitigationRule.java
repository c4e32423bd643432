package org.pragmatica.yieldguard.lint.rules;

import org.pragmatica.yieldguard.classify.OperationCategory;
import org.pragmatica.yieldguard.linearize.StatementLinearizer;
import org.pragmatica.yieldguard.linearize.StatementSlot;
import org.pragmatica.yieldguard.lint.AnalysisSession;
import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintImpact;
import org.pragmatica.yieldguard.mitigation.MitigationVerdict;
import org.pragmatica.yieldguard.tree.FunctionDeclaration;
import org.pragmatica.yieldguard.tree.StatementShapes;

import java.util.stream.Stream;

/**
 * Flags statements performing an operation of the target category that are not
 * immediately followed by a mitigating call.
 *
 * <pre>{@code
 * // BAD
 * var users = db.users().findAll();
 * process(users);
 *
 * // GOOD
 * var users = db.users().findAll();
 * DelayUtils.yieldToUI();
 * process(users);
 * }</pre>
 */
public final class MitigationRule implements LintRule {
    public static final String WRITE_RULE_ID = "require_yield_after_db_write";
    public static final String READ_RULE_ID = "prefer_yield_after_db_read";

    private final String ruleId;
    private final OperationCategory target;
    private final LintImpact impact;
    private final String description;
    private final String message;
    private final String correction;

    private MitigationRule(String ruleId,
                           OperationCategory target,
                           LintImpact impact,
                           String description,
                           String message,
                           String correction) {
        if (!target.requiresMitigation()) {
            throw new IllegalArgumentException(target + " never requires mitigation");
        }
        this.ruleId = ruleId;
        this.target = target;
        this.impact = impact;
        this.description = description;
        this.message = message;
        this.correction = correction;
    }

    public static MitigationRule mitigationRule(String ruleId,
                                                OperationCategory target,
                                                LintImpact impact,
                                                String description,
                                                String message,
                                                String correction) {
        return new MitigationRule(ruleId, target, impact, description, message, correction);
    }

    /// Rule with the built-in wording for the target, reported under a custom id.
    public static MitigationRule mitigationRule(String ruleId, OperationCategory target) {
        var template = target == OperationCategory.WRITE
                       ? requireYieldAfterWrite()
                       : preferYieldAfterRead();
        return mitigationRule(ruleId, target, template.impact, template.description, template.message, template.correction);
    }

    public static MitigationRule requireYieldAfterWrite() {
        return mitigationRule(WRITE_RULE_ID,
                              OperationCategory.WRITE,
                              LintImpact.HIGH,
                              "Yield to the UI after database/IO writes",
                              "Database/IO write without yieldToUI() may cause UI jank.",
                              "Insert a yieldToUI() call after this database/IO operation.");
    }

    public static MitigationRule preferYieldAfterRead() {
        return mitigationRule(READ_RULE_ID,
                              OperationCategory.BULK_READ,
                              LintImpact.MEDIUM,
                              "Yield to the UI after bulk database/IO reads",
                              "Bulk database/IO read without yieldToUI() may cause UI jank.",
                              "Consider a yieldToUI() call after this read.");
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public LintImpact impact() {
        return impact;
    }

    @Override
    public FixKind fixKind() {
        return FixKind.INSERT_MITIGATION;
    }

    public OperationCategory target() {
        return target;
    }

    @Override
    public Stream<Diagnostic> analyze(FunctionDeclaration function, AnalysisSession session, DiagnosticSeverity severity) {
        return StatementLinearizer.linearize(function.body())
                                  .stream()
                                  .filter(slot -> performsTarget(slot, session))
                                  .filter(slot -> session.successorChecker()
                                                         .verdict(slot, target) == MitigationVerdict.UNSAFE)
                                  .map(slot -> session.emit(ruleId,
                                                            severity,
                                                            impact,
                                                            slot.statement().range(),
                                                            message,
                                                            correction));
    }

    private boolean performsTarget(StatementSlot slot, AnalysisSession session) {
        return StatementShapes.inlineCall(slot.statement())
                              .map(session::classify)
                              .filter(target::equals)
                              .isPresent();
    }
}
