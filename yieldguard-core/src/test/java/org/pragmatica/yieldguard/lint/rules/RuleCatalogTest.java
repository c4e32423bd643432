package org.pragmatica.yieldguard.lint.rules;

import org.pragmatica.yieldguard.lint.LintConfig;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleCatalogTest {

    @Test
    void builtInRules_haveStableIds_andDefaultSeverities() {
        assertThat(RuleCatalog.builtInRules())
                .extracting(LintRule::ruleId)
                .containsExactly("require_yield_after_db_write", "prefer_yield_after_db_read", "avoid_return_await_db");
        assertThat(LintConfig.DEFAULT.ruleSeverities())
                .containsOnlyKeys("require_yield_after_db_write", "prefer_yield_after_db_read", "avoid_return_await_db");
    }

    @Test
    void find_returnsRuleById() {
        assertThat(RuleCatalog.find("avoid_return_await_db"))
                .hasValueSatisfying(rule -> assertThat(rule.fixKind()).isEqualTo(FixKind.SPLIT_RETURN));
        assertThat(RuleCatalog.find("prefer_yield_after_db_read"))
                .hasValueSatisfying(rule -> assertThat(rule.fixKind()).isEqualTo(FixKind.INSERT_MITIGATION));
        assertThat(RuleCatalog.find("no_such_rule")).isEmpty();
    }
}
