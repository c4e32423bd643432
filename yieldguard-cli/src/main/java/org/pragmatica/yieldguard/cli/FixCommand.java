package org.pragmatica.yieldguard.cli;

import org.pragmatica.yieldguard.runner.ProjectRunner;
import org.pragmatica.yieldguard.shared.LintException;

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
 * Fix command - inserts yields and splits returns in place.
 */
@Command(
        name = "fix",
        description = "Apply all available fixes in place",
        mixinStandardHelpOptions = true
)
public class FixCommand implements Callable<Integer> {

    @ParentCommand
    YieldGuardCli parent;

    @Spec
    CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to fix",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = {"--config", "-c"},
            description = "Path to yieldguard.toml"
    )
    Path configPath;

    @Option(
            names = {"--dry-run"},
            description = "Show what would change without writing files"
    )
    boolean dryRun;

    @Override
    public Integer call() {
        parent.applyVerbosity();
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            var config = YieldGuardCli.resolveConfig(Optional.ofNullable(configPath));
            var run = ProjectRunner.projectRunner(config)
                                   .fix(paths, dryRun);

            run.changedFiles()
               .forEach(file -> out.println((dryRun ? "Would fix: " : "Fixed: ") + file));
            run.errors()
               .forEach(error -> err.println(error.message()));
            out.printf("%s %d issue(s) in %d file(s)%s%n",
                       dryRun ? "Would fix" : "Fixed",
                       run.fixesApplied(),
                       run.changedFiles().size(),
                       run.fixesSkipped() > 0 ? ", " + run.fixesSkipped() + " left for manual review" : "");
            out.flush();
            err.flush();
            return run.errors().isEmpty()
                   ? YieldGuardCli.EXIT_OK
                   : YieldGuardCli.EXIT_ISSUES;
        } catch (LintException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return YieldGuardCli.EXIT_CONFIG;
        }
    }
}
