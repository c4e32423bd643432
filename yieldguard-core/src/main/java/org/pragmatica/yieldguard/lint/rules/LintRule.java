package org.pragmatica.yieldguard.lint.rules;

import org.pragmatica.yieldguard.lint.AnalysisSession;
import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintImpact;
import org.pragmatica.yieldguard.tree.FunctionDeclaration;

import java.util.stream.Stream;

/**
 * Interface for lint rules.
 *
 * Each rule analyzes one function at a time and produces zero or more diagnostics.
 */
public interface LintRule {

    /**
     * Get the rule ID (e.g., "require_yield_after_db_write").
     */
    String ruleId();

    /**
     * Get a short description of what this rule checks.
     */
    String description();

    LintImpact impact();

    FixKind fixKind();

    /**
     * Analyze a function and return any diagnostics.
     *
     * @param function the function to analyze
     * @param session  per-function analysis state
     * @param severity severity to report with
     * @return stream of diagnostics found
     */
    Stream<Diagnostic> analyze(FunctionDeclaration function, AnalysisSession session, DiagnosticSeverity severity);
}
