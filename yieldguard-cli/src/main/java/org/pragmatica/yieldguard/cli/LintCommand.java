package org.pragmatica.yieldguard.cli;

import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintRun;
import org.pragmatica.yieldguard.report.ViolationExporter;
import org.pragmatica.yieldguard.runner.ProjectRunner;
import org.pragmatica.yieldguard.shared.LintException;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Lint command - reports unmitigated blocking calls.
 */
@Command(
        name = "lint",
        description = "Report blocking database/IO calls without a following yield",
        mixinStandardHelpOptions = true
)
public class LintCommand implements Callable<Integer> {

    @ParentCommand
    YieldGuardCli parent;

    @Spec
    CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to lint",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = {"--config", "-c"},
            description = "Path to yieldguard.toml"
    )
    Path configPath;

    @Option(
            names = {"--export", "-e"},
            description = "Write a JSON violation export to this file"
    )
    Path exportPath;

    @Option(
            names = {"--fail-on-warning", "-w"},
            description = "Treat warnings as errors"
    )
    boolean failOnWarning;

    @Override
    public Integer call() {
        parent.applyVerbosity();
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            var config = YieldGuardCli.resolveConfig(Optional.ofNullable(configPath));
            var run = ProjectRunner.projectRunner(config)
                                   .lint(paths);

            report(run, out, err);

            if (exportPath != null) {
                ViolationExporter.violationExporter(Path.of("").toAbsolutePath())
                                 .write(run, exportPath);
                out.println("Exported " + run.diagnostics().size() + " violation(s) to " + exportPath);
            }
            out.flush();
            return run.failed(failOnWarning || config.failOnWarning())
                   ? YieldGuardCli.EXIT_ISSUES
                   : YieldGuardCli.EXIT_OK;
        } catch (LintException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return YieldGuardCli.EXIT_CONFIG;
        }
    }

    private static void report(LintRun run, PrintWriter out, PrintWriter err) {
        run.diagnostics()
           .forEach(diagnostic -> out.println(diagnostic.format()));
        run.errors()
           .forEach(error -> err.println(error.message()));

        out.printf("%d file(s) analyzed: %d error(s), %d warning(s), %d suggestion(s)%n",
                   run.filesAnalyzed(),
                   run.count(DiagnosticSeverity.ERROR),
                   run.count(DiagnosticSeverity.WARNING),
                   run.count(DiagnosticSeverity.SUGGESTION));
        err.flush();
    }
}
