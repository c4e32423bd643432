package org.pragmatica.yieldguard.lint.suppress;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SuppressionDirectivesTest {

    @Test
    void isSuppressedAt_coversSameLineAndLineBelow() {
        var directives = SuppressionDirectives.suppressionDirectives("""
                // ignore: require_yield_after_db_write
                db.save(user);
                db.save(user);
                db.update(user); // ignore: prefer_yield_after_db_read, require_yield_after_db_write
                """);

        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 2)).isTrue();
        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 3)).isFalse();
        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 4)).isTrue();
        assertThat(directives.isSuppressedAt("prefer_yield_after_db_read", 4)).isTrue();
        assertThat(directives.isSuppressedAt("avoid_return_await_db", 4)).isFalse();
    }

    @Test
    void trailingDirective_coversOnlyItsOwnLine() {
        var directives = SuppressionDirectives.suppressionDirectives("""
                db.save(user); // ignore: require_yield_after_db_write
                db.save(order);
                    // ignore: require_yield_after_db_write
                db.save(invoice);
                """);

        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 1)).isTrue();
        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 2)).isFalse();
        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 4)).isTrue();
    }

    @Test
    void ruleNames_acceptHyphens_andDropExplanations() {
        var directives = SuppressionDirectives.suppressionDirectives("""
                db.save(user); // ignore: require-yield-after-db-write - flushed by caller
                db.save(user); // ignore: avoid_return_await_db // legacy
                """);

        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 1)).isTrue();
        assertThat(directives.isSuppressedAt("avoid_return_await_db", 2)).isTrue();
        assertThat(directives.isSuppressedAt("flushed", 1)).isFalse();
    }

    @Test
    void namesMustMatchWholeRuleIds() {
        var directives = SuppressionDirectives.suppressionDirectives("""
                // ignore: require_yield
                db.save(user);
                """);

        assertThat(directives.isSuppressedAt("require_yield_after_db_write", 2)).isFalse();
    }

    @Test
    void isSuppressedForFile_appliesToEveryLine() {
        var directives = SuppressionDirectives.suppressionDirectives("""
                // ignore_for_file: prefer-yield-after-db-read
                class Store {}
                """);

        assertThat(directives.isSuppressedForFile("prefer_yield_after_db_read")).isTrue();
        assertThat(directives.isSuppressedAt("prefer_yield_after_db_read", 200)).isTrue();
        assertThat(directives.isSuppressedForFile("require_yield_after_db_write")).isFalse();
    }
}
