package org.pragmatica.yieldguard.lint;

import org.pragmatica.yieldguard.classify.OperationClassifier;
import org.pragmatica.yieldguard.lint.rules.LintRule;
import org.pragmatica.yieldguard.lint.rules.RuleCatalog;
import org.pragmatica.yieldguard.lint.suppress.SuppressionDirectives;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.SourceUnit;
import org.pragmatica.yieldguard.tree.FunctionBody.ExpressionBody;
import org.pragmatica.yieldguard.tree.FunctionDeclaration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Runs the enabled rules over every function of a parsed unit.
///
/// Diagnostics silenced by ignore directives are dropped, and at most one diagnostic is
/// kept per (rule, anchor) pair. Results are ordered by position, then rule id.
public final class Linter {
    private static final Logger log = LoggerFactory.getLogger(Linter.class);

    private final LintContext context;
    private final List<LintRule> rules;
    private final OperationClassifier classifier;
    private final SuccessorChecker successorChecker;

    private Linter(LintContext context, List<LintRule> rules) {
        this.context = context;
        this.rules = List.copyOf(rules);
        this.classifier = OperationClassifier.operationClassifier(context.config().classification());
        this.successorChecker = SuccessorChecker.successorChecker(context.config().mitigationCalls());
    }

    public static Linter linter(LintContext context) {
        return new Linter(context, RuleCatalog.builtInRules());
    }

    public static Linter linter(LintContext context, List<LintRule> rules) {
        return new Linter(context, rules);
    }

    public LintContext context() {
        return context;
    }

    public List<LintRule> enabledRules() {
        return rules.stream()
                    .filter(rule -> context.isRuleEnabled(rule.ruleId()))
                    .toList();
    }

    public List<Diagnostic> lint(SourceUnit unit) {
        var suppressions = SuppressionDirectives.suppressionDirectives(unit.content());
        var activeRules = enabledRules().stream()
                                        .filter(rule -> !suppressions.isSuppressedForFile(rule.ruleId()))
                                        .toList();
        var seen = new HashSet<AnchorKey>();
        var diagnostics = new ArrayList<Diagnostic>();

        for (var function : unit.functions()) {
            if (function.body() instanceof ExpressionBody) {
                log.debug("Skipping expression-bodied {} in {}", function.name(), unit.fileName());
                continue;
            }
            var session = AnalysisSession.analysisSession(unit, classifier, successorChecker);

            for (var rule : activeRules) {
                rule.analyze(function, session, context.severityFor(rule.ruleId()))
                    .filter(diagnostic -> !suppressions.isSuppressedAt(diagnostic.ruleId(), diagnostic.line()))
                    .filter(diagnostic -> seen.add(AnchorKey.of(diagnostic)))
                    .forEach(diagnostics::add);
            }
        }

        diagnostics.sort(Comparator.comparingInt((Diagnostic d) -> d.anchor().offset())
                                   .thenComparing(Diagnostic::ruleId));
        log.debug("{}: {} function(s), {} diagnostic(s)", unit.fileName(), unit.functions().size(), diagnostics.size());
        return List.copyOf(diagnostics);
    }

    /// Diagnostics of a single function, without suppression handling.
    public List<Diagnostic> lint(SourceUnit unit, FunctionDeclaration function) {
        var session = AnalysisSession.analysisSession(unit, classifier, successorChecker);
        return enabledRules().stream()
                             .flatMap(rule -> rule.analyze(function, session, context.severityFor(rule.ruleId())))
                             .toList();
    }

    private record AnchorKey(String ruleId, int offset, int length) {
        static AnchorKey of(Diagnostic diagnostic) {
            return new AnchorKey(diagnostic.ruleId(), diagnostic.anchor().offset(), diagnostic.anchor().length());
        }
    }
}
