package org.pragmatica.yieldguard.lint;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/// Context for lint analysis providing configuration.
public record LintContext(List<Pattern> excludedPathPatterns,
                          LintConfig config) {
    public LintContext {
        excludedPathPatterns = List.copyOf(excludedPathPatterns);
    }

    /// Check if a file should be linted (not matched by an exclusion glob).
    public boolean shouldLint(Path path) {
        if (excludedPathPatterns.isEmpty()) {
            return true;
        }
        var normalized = path.toString()
                             .replace('\\', '/');
        return excludedPathPatterns.stream()
                                   .noneMatch(pattern -> pattern.matcher(normalized)
                                                                .matches());
    }

    /// Get the configured severity for a rule.
    public DiagnosticSeverity severityFor(String ruleId) {
        return config.ruleSeverities()
                     .getOrDefault(ruleId, DiagnosticSeverity.WARNING);
    }

    /// Check if a rule is enabled.
    public boolean isRuleEnabled(String ruleId) {
        return ! config.disabledRules()
                      .contains(ruleId);
    }

    /// Factory method with default configuration.
    public static LintContext defaultContext() {
        return lintContext(LintConfig.defaultConfig());
    }

    /// Factory method from a configuration; its exclusion globs become path patterns.
    public static LintContext lintContext(LintConfig config) {
        return new LintContext(compile(config.excludePaths()), config);
    }

    private static List<Pattern> compile(List<String> globs) {
        return globs.stream()
                    .map(LintContext::globToRegex)
                    .map(Pattern::compile)
                    .toList();
    }

    private static String globToRegex(String glob) {
        // Use placeholder to avoid ** being affected by * replacement
        return glob.replace(".", "\\.")
                   .replace("**/", "\0DOTSTAR_DIR\0")
                   .replace("**", "\0DOTSTAR\0")
                   .replace("*", "[^/]*")
                   .replace("\0DOTSTAR_DIR\0", "(?:.*/)?")
                   .replace("\0DOTSTAR\0", ".*");
    }

    /// Builder-style method to set config.
    public LintContext withConfig(LintConfig config) {
        return new LintContext(compile(config.excludePaths()), config);
    }
}
