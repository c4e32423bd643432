package org.pragmatica.yieldguard.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class YieldGuardCliTest {
    private static final String STORE = """
            class UserStore {
                void save(User user) {
                    db.save(user);
                    notifyListeners();
                }
            }
            """;

    @TempDir
    Path root;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        source = root.resolve("UserStore.java");
        Files.writeString(source, STORE);
    }

    private int execute(String... args) {
        return new CommandLine(new YieldGuardCli())
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .execute(args);
    }

    @Test
    void lint_reportsWarnings_withoutFailingByDefault() {
        int exitCode = execute("lint", root.toString());

        assertThat(exitCode).isEqualTo(YieldGuardCli.EXIT_OK);
        assertThat(out.toString()).contains("require_yield_after_db_write",
                                            "1 file(s) analyzed: 0 error(s), 1 warning(s), 0 suggestion(s)");
    }

    @Test
    void lint_failsOnWarning_whenAsked() {
        assertThat(execute("lint", "--fail-on-warning", root.toString())).isEqualTo(YieldGuardCli.EXIT_ISSUES);
    }

    @Test
    void lint_usesConfiguredSeverities() throws IOException {
        var config = root.resolve("yieldguard.toml");
        Files.writeString(config, """
                [rules]
                require_yield_after_db_write = "error"
                """);

        int exitCode = execute("lint", "--config", config.toString(), source.toString());

        assertThat(exitCode).isEqualTo(YieldGuardCli.EXIT_ISSUES);
        assertThat(out.toString()).contains("1 error(s)");
    }

    @Test
    void lint_returnsConfigExitCode_forInvalidConfig() throws IOException {
        var config = root.resolve("broken.toml");
        Files.writeString(config, """
                [rules]
                require_yield_after_db_write = "fatal"
                """);

        int exitCode = execute("lint", "-c", config.toString(), source.toString());

        assertThat(exitCode).isEqualTo(YieldGuardCli.EXIT_CONFIG);
        assertThat(err.toString()).contains("Error:", "fatal");
    }

    @Test
    void lint_writesExport() throws IOException {
        var export = root.resolve("reports/violations.json");

        execute("lint", "--export", export.toString(), source.toString());

        assertThat(out.toString()).contains("Exported 1 violation(s)");
        assertThat(Files.readString(export)).contains("\"schema\"", "\"1.0\"", "require_yield_after_db_write");
    }

    @Test
    void fix_dryRun_reportsWithoutWriting() throws IOException {
        int exitCode = execute("fix", "--dry-run", root.toString());

        assertThat(exitCode).isEqualTo(YieldGuardCli.EXIT_OK);
        assertThat(out.toString()).contains("Would fix: " + source, "Would fix 1 issue(s) in 1 file(s)");
        assertThat(Files.readString(source)).isEqualTo(STORE);
    }

    @Test
    void fix_rewritesSource_andLintThenPasses() throws IOException {
        assertThat(execute("fix", root.toString())).isEqualTo(YieldGuardCli.EXIT_OK);
        assertThat(Files.readString(source)).contains("""
                        db.save(user);
                        DelayUtils.yieldToUI();
                        notifyListeners();
                """);

        assertThat(execute("lint", "-w", root.toString())).isEqualTo(YieldGuardCli.EXIT_OK);
    }

    @Test
    void missingPath_isReportedAsError() {
        int exitCode = execute("lint", root.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(YieldGuardCli.EXIT_ISSUES);
        assertThat(err.toString()).contains("No such file or directory");
    }
}
