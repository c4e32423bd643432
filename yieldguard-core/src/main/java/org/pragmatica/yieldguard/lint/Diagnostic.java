package org.pragmatica.yieldguard.lint;

import org.pragmatica.yieldguard.tree.SourceRange;

/// Single reported violation, anchored at the offending statement.
///
/// @param ruleId     stable taxonomy code of the rule, e.g. `require_yield_after_db_write`
/// @param severity   effective severity after configuration
/// @param impact     impact tier of the rule
/// @param fileName   file the anchor belongs to
/// @param anchor     character range of the flagged statement
/// @param line       1-based line of the anchor start
/// @param column     1-based column of the anchor start
/// @param message    what is wrong
/// @param correction how to fix it
public record Diagnostic(String ruleId,
                         DiagnosticSeverity severity,
                         LintImpact impact,
                         String fileName,
                         SourceRange anchor,
                         int line,
                         int column,
                         String message,
                         String correction) {
    public static Diagnostic diagnostic(String ruleId,
                                        DiagnosticSeverity severity,
                                        LintImpact impact,
                                        String fileName,
                                        SourceRange anchor,
                                        int line,
                                        int column,
                                        String message,
                                        String correction) {
        return new Diagnostic(ruleId, severity, impact, fileName, anchor, line, column, message, correction);
    }

    /// `file:line:column: severity [rule] message`
    public String format() {
        return fileName + ":" + line + ":" + column + ": " + severity.label() + " [" + ruleId + "] " + message;
    }
}
