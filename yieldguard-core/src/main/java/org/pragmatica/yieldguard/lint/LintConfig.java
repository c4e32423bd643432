package org.pragmatica.yieldguard.lint;

import org.pragmatica.yieldguard.classify.ClassificationTables;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.MitigationStatements;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration for the linter.
 */
public record LintConfig(
        Map<String, DiagnosticSeverity> ruleSeverities,
        Set<String> disabledRules,
        boolean failOnWarning,
        Set<String> mitigationCalls,
        Optional<String> mitigationStatement,
        ClassificationTables classification,
        List<String> excludePaths
) {

    /**
     * Default lint configuration.
     */
    public static final LintConfig DEFAULT = new LintConfig(
            Map.ofEntries(
                    Map.entry("require_yield_after_db_write", DiagnosticSeverity.WARNING),   // Unmitigated writes
                    Map.entry("prefer_yield_after_db_read", DiagnosticSeverity.SUGGESTION),  // Unmitigated bulk reads
                    Map.entry("avoid_return_await_db", DiagnosticSeverity.WARNING)           // return await write()
            ),
            Set.of(),
            false,
            SuccessorChecker.DEFAULT_MITIGATION_CALLS,
            Optional.empty(),
            ClassificationTables.defaultTables(),
            List.of()
    );

    public LintConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        disabledRules = Set.copyOf(disabledRules);
        mitigationCalls = Set.copyOf(mitigationCalls);
        excludePaths = List.copyOf(excludePaths);
    }

    /**
     * Factory method for default config.
     */
    public static LintConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to set rule severity.
     */
    public LintConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new LintConfig(newSeverities, disabledRules, failOnWarning,
                              mitigationCalls, mitigationStatement, classification, excludePaths);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public LintConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new LintConfig(ruleSeverities, newDisabled, failOnWarning,
                              mitigationCalls, mitigationStatement, classification, excludePaths);
    }

    /**
     * Builder-style method to set fail on warning.
     */
    public LintConfig withFailOnWarning(boolean failOnWarning) {
        return new LintConfig(ruleSeverities, disabledRules, failOnWarning,
                              mitigationCalls, mitigationStatement, classification, excludePaths);
    }

    /**
     * Builder-style method to recognize additional mitigating calls.
     */
    public LintConfig withMitigationCalls(Set<String> calls) {
        var newCalls = new HashSet<>(mitigationCalls);
        newCalls.addAll(calls);
        return new LintConfig(ruleSeverities, disabledRules, failOnWarning,
                              newCalls, mitigationStatement, classification, excludePaths);
    }

    /**
     * Builder-style method to set the statement fixes insert. The call it performs is
     * recognized as a mitigation from then on.
     */
    public LintConfig withMitigationStatement(String statement) {
        var newCalls = new HashSet<>(mitigationCalls);
        MitigationStatements.callName(statement)
                            .ifPresent(newCalls::add);
        return new LintConfig(ruleSeverities, disabledRules, failOnWarning,
                              newCalls, Optional.of(statement), classification, excludePaths);
    }

    public LintConfig withClassification(ClassificationTables classification) {
        return new LintConfig(ruleSeverities, disabledRules, failOnWarning,
                              mitigationCalls, mitigationStatement, classification, excludePaths);
    }

    public LintConfig withExcludePaths(List<String> globs) {
        return new LintConfig(ruleSeverities, disabledRules, failOnWarning,
                              mitigationCalls, mitigationStatement, classification, globs);
    }
}
