package org.pragmatica.yieldguard.fix;

import org.pragmatica.yieldguard.shared.LintError;

import java.util.List;

/// Outcome of fixing a set of files.
public record FixRun(int filesAnalyzed, List<String> changedFiles, int fixesApplied, int fixesSkipped, List<LintError> errors) {
    public FixRun {
        changedFiles = List.copyOf(changedFiles);
        errors = List.copyOf(errors);
    }

    public static FixRun fixRun(int filesAnalyzed,
                                List<String> changedFiles,
                                int fixesApplied,
                                int fixesSkipped,
                                List<LintError> errors) {
        return new FixRun(filesAnalyzed, changedFiles, fixesApplied, fixesSkipped, errors);
    }
}
