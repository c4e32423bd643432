package org.pragmatica.yieldguard.lint;

import org.pragmatica.yieldguard.classify.OperationCategory;
import org.pragmatica.yieldguard.classify.OperationClassifier;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.SourceUnit;
import org.pragmatica.yieldguard.tree.Expression.CallExpression;
import org.pragmatica.yieldguard.tree.SourceRange;

import java.util.IdentityHashMap;
import java.util.Map;

/// Scratch state for analyzing one function body.
///
/// Classification results are memoized per call node for the lifetime of the session;
/// a new session is created for every body and discarded afterwards.
public final class AnalysisSession {
    private final SourceUnit unit;
    private final OperationClassifier classifier;
    private final SuccessorChecker successorChecker;
    private final Map<CallExpression, OperationCategory> categories = new IdentityHashMap<>();

    private AnalysisSession(SourceUnit unit, OperationClassifier classifier, SuccessorChecker successorChecker) {
        this.unit = unit;
        this.classifier = classifier;
        this.successorChecker = successorChecker;
    }

    public static AnalysisSession analysisSession(SourceUnit unit,
                                                  OperationClassifier classifier,
                                                  SuccessorChecker successorChecker) {
        return new AnalysisSession(unit, classifier, successorChecker);
    }

    public SuccessorChecker successorChecker() {
        return successorChecker;
    }

    public OperationCategory classify(CallExpression call) {
        return categories.computeIfAbsent(call, classifier::classify);
    }

    /// Build a diagnostic anchored at the given range of this session's unit.
    public Diagnostic emit(String ruleId,
                           DiagnosticSeverity severity,
                           LintImpact impact,
                           SourceRange anchor,
                           String message,
                           String correction) {
        var lineIndex = unit.lineIndex();
        return Diagnostic.diagnostic(ruleId,
                                     severity,
                                     impact,
                                     unit.fileName(),
                                     anchor,
                                     lineIndex.lineOf(anchor.offset()),
                                     lineIndex.columnOf(anchor.offset()),
                                     message,
                                     correction);
    }
}
