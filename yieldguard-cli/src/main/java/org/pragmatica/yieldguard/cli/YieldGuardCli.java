package org.pragmatica.yieldguard.cli;

import org.pragmatica.yieldguard.config.ConfigLoader;
import org.pragmatica.yieldguard.lint.LintConfig;

import java.nio.file.Path;
import java.util.Optional;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/// Yield guard command-line tool.
///
/// Usage examples:
/// ```
/// yieldguard lint src/main/java
/// yieldguard lint --export build/violations.json --fail-on-warning src
/// yieldguard fix --dry-run src/main/java
/// ```
@Command(name = "yieldguard",
        mixinStandardHelpOptions = true,
        version = "yieldguard 0.1.0",
        description = "Finds blocking database/IO calls that are not followed by a yield",
        subcommands = {LintCommand.class, FixCommand.class})
public class YieldGuardCli implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_ISSUES = 1;
    static final int EXIT_CONFIG = 2;

    private static final String LOGGER_ROOT = "org.pragmatica.yieldguard";

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"},
            description = "Log per-file progress")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new YieldGuardCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }

    void applyVerbosity() {
        if (verbose && LoggerFactory.getLogger(LOGGER_ROOT) instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    /// Explicit `--config` file, else `yieldguard.toml` in the working directory, else defaults.
    static LintConfig resolveConfig(Optional<Path> explicit) {
        return explicit.or(() -> ConfigLoader.discover(Path.of("")))
                       .map(ConfigLoader::load)
                       .orElse(LintConfig.defaultConfig());
    }
}
