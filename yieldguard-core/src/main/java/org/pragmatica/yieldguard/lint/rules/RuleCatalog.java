package org.pragmatica.yieldguard.lint.rules;

import java.util.List;
import java.util.Optional;

/// Built-in rules.
public final class RuleCatalog {
    private static final List<LintRule> BUILT_IN = List.of(MitigationRule.requireYieldAfterWrite(),
                                                           MitigationRule.preferYieldAfterRead(),
                                                           ReturnAwaitRule.avoidReturnAwaitDb());

    private RuleCatalog() {}

    public static List<LintRule> builtInRules() {
        return BUILT_IN;
    }

    public static Optional<LintRule> find(String ruleId) {
        return BUILT_IN.stream()
                       .filter(rule -> rule.ruleId().equals(ruleId))
                       .findFirst();
    }
}
