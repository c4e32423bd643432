package org.pragmatica.yieldguard.lint;

import org.pragmatica.yieldguard.shared.LintError;

import java.util.List;

/// Outcome of linting a set of files.
public record LintRun(int filesAnalyzed, List<Diagnostic> diagnostics, List<LintError> errors) {
    public LintRun {
        diagnostics = List.copyOf(diagnostics);
        errors = List.copyOf(errors);
    }

    public static LintRun lintRun(int filesAnalyzed, List<Diagnostic> diagnostics, List<LintError> errors) {
        return new LintRun(filesAnalyzed, diagnostics, errors);
    }

    public long count(DiagnosticSeverity severity) {
        return diagnostics.stream()
                          .filter(diagnostic -> diagnostic.severity() == severity)
                          .count();
    }

    public long filesWithIssues() {
        return diagnostics.stream()
                          .map(Diagnostic::fileName)
                          .distinct()
                          .count();
    }

    /// Whether the run should fail: any error diagnostic, any file-level error, or warnings when asked to.
    public boolean failed(boolean failOnWarning) {
        var threshold = failOnWarning
                        ? DiagnosticSeverity.WARNING
                        : DiagnosticSeverity.ERROR;
        return !errors.isEmpty()
               || diagnostics.stream()
                             .anyMatch(diagnostic -> diagnostic.severity().isAtLeast(threshold));
    }
}
