package org.pragmatica.yieldguard.lint;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LintContextTest {

    @Test
    void shouldLint_skipsExcludedGlobs() {
        var context = LintContext.lintContext(LintConfig.defaultConfig()
                                                        .withExcludePaths(List.of("**/generated/**", "*Test.java")));

        assertThat(context.shouldLint(Path.of("src/main/java/com/example/Store.java"))).isTrue();
        assertThat(context.shouldLint(Path.of("build/generated/sources/Store.java"))).isFalse();
        assertThat(context.shouldLint(Path.of("StoreTest.java"))).isFalse();
    }

    @Test
    void severityFor_fallsBackToWarning_forUnknownRule() {
        var context = LintContext.defaultContext();

        assertThat(context.severityFor("prefer_yield_after_db_read")).isEqualTo(DiagnosticSeverity.SUGGESTION);
        assertThat(context.severityFor("custom_rule")).isEqualTo(DiagnosticSeverity.WARNING);
    }

    @Test
    void isRuleEnabled_reflectsDisabledRules() {
        var context = LintContext.defaultContext()
                                 .withConfig(LintConfig.defaultConfig().withDisabledRule("avoid_return_await_db"));

        assertThat(context.isRuleEnabled("avoid_return_await_db")).isFalse();
        assertThat(context.isRuleEnabled("require_yield_after_db_write")).isTrue();
    }
}
