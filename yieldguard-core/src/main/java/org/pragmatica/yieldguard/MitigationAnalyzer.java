package org.pragmatica.yieldguard;

import org.pragmatica.yieldguard.classify.OperationCategory;
import org.pragmatica.yieldguard.classify.OperationClassifier;
import org.pragmatica.yieldguard.fix.FixSynthesizer;
import org.pragmatica.yieldguard.fix.TextEdit;
import org.pragmatica.yieldguard.lint.AnalysisSession;
import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintConfig;
import org.pragmatica.yieldguard.lint.rules.LintRule;
import org.pragmatica.yieldguard.lint.rules.MitigationRule;
import org.pragmatica.yieldguard.lint.rules.ReturnAwaitRule;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.SourceUnit;
import org.pragmatica.yieldguard.tree.Expression.CallExpression;
import org.pragmatica.yieldguard.tree.FunctionBody;
import org.pragmatica.yieldguard.tree.FunctionBody.BlockBody;
import org.pragmatica.yieldguard.tree.FunctionDeclaration;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for hosts that bring their own syntax tree.
 *
 * <p>Rules are run per function body; callers decide which bodies to visit and where the
 * diagnostics go. Every method is free of side effects, and an instance may be shared.
 */
public final class MitigationAnalyzer {
    private final OperationClassifier classifier;
    private final SuccessorChecker successorChecker;
    private final FixSynthesizer fixSynthesizer;

    private MitigationAnalyzer(LintConfig config) {
        this.classifier = OperationClassifier.operationClassifier(config.classification());
        this.successorChecker = SuccessorChecker.successorChecker(config.mitigationCalls());
        this.fixSynthesizer = FixSynthesizer.fixSynthesizer(config.mitigationStatement(), successorChecker);
    }

    public static MitigationAnalyzer mitigationAnalyzer() {
        return new MitigationAnalyzer(LintConfig.defaultConfig());
    }

    public static MitigationAnalyzer mitigationAnalyzer(LintConfig config) {
        return new MitigationAnalyzer(config);
    }

    public OperationCategory classify(CallExpression call) {
        return classifier.classify(call);
    }

    /**
     * Report statements of {@code body} performing a {@code target} operation without a
     * mitigating successor. Nothing is reported for a {@code target} that never requires
     * mitigation.
     */
    public List<Diagnostic> runMitigationRule(SourceUnit unit,
                                              FunctionBody body,
                                              OperationCategory target,
                                              String ruleId,
                                              DiagnosticSeverity severity) {
        if (!target.requiresMitigation()) {
            return List.of();
        }
        return run(unit, body, MitigationRule.mitigationRule(ruleId, target), severity);
    }

    public List<Diagnostic> runReturnAwaitRule(SourceUnit unit,
                                               FunctionBody body,
                                               String ruleId,
                                               DiagnosticSeverity severity) {
        return run(unit, body, ReturnAwaitRule.returnAwaitRule(ruleId), severity);
    }

    public Optional<TextEdit> synthesizeInsertionFix(Diagnostic diagnostic, SourceUnit unit) {
        return fixSynthesizer.synthesizeInsertionFix(diagnostic, unit);
    }

    public Optional<TextEdit> synthesizeSplitFix(Diagnostic diagnostic, SourceUnit unit) {
        return fixSynthesizer.synthesizeSplitFix(diagnostic, unit);
    }

    private List<Diagnostic> run(SourceUnit unit, FunctionBody body, LintRule rule, DiagnosticSeverity severity) {
        if (!(body instanceof BlockBody blockBody)) {
            return List.of();
        }
        var function = FunctionDeclaration.functionDeclaration("<body>", blockBody.block().range(), body);
        var session = AnalysisSession.analysisSession(unit, classifier, successorChecker);

        return rule.analyze(function, session, severity)
                   .toList();
    }
}
