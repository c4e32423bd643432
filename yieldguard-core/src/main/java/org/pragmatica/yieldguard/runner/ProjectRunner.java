package org.pragmatica.yieldguard.runner;

import org.pragmatica.yieldguard.fix.FixEngine;
import org.pragmatica.yieldguard.fix.FixRun;
import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.LintConfig;
import org.pragmatica.yieldguard.lint.LintContext;
import org.pragmatica.yieldguard.lint.LintRun;
import org.pragmatica.yieldguard.lint.Linter;
import org.pragmatica.yieldguard.shared.FileCollector;
import org.pragmatica.yieldguard.shared.LintError;
import org.pragmatica.yieldguard.shared.LintException;
import org.pragmatica.yieldguard.shared.SourceFile;
import org.pragmatica.yieldguard.source.JavaSourceParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Lints or fixes every Java file under a set of paths.
///
/// Files are processed one after another. A file that can't be read, parsed or written is
/// recorded as a [LintError] and the run moves on to the next file.
public final class ProjectRunner {
    private static final Logger log = LoggerFactory.getLogger(ProjectRunner.class);

    private final LintContext context;
    private final Linter linter;
    private final FixEngine fixEngine;
    private final JavaSourceParser parser;

    private ProjectRunner(LintConfig config) {
        this.context = LintContext.lintContext(config);
        this.linter = Linter.linter(context);
        this.fixEngine = FixEngine.fixEngine(config, linter.enabledRules());
        this.parser = JavaSourceParser.javaSourceParser();
    }

    public static ProjectRunner projectRunner(LintConfig config) {
        return new ProjectRunner(config);
    }

    public LintRun lint(List<Path> paths) {
        var errors = new ArrayList<LintError>();
        var diagnostics = new ArrayList<Diagnostic>();
        var files = collect(paths, errors);

        for (var file : files) {
            try {
                var unit = parser.parse(SourceFile.read(file));
                diagnostics.addAll(linter.lint(unit));
            } catch (LintException e) {
                log.warn(e.getMessage());
                errors.add(e.error());
            }
        }
        log.debug("Linted {} file(s): {} diagnostic(s), {} error(s)", files.size(), diagnostics.size(), errors.size());
        return LintRun.lintRun(files.size(), diagnostics, errors);
    }

    /// Apply all available fixes, writing changed files back unless `dryRun` is set.
    public FixRun fix(List<Path> paths, boolean dryRun) {
        var errors = new ArrayList<LintError>();
        var changed = new ArrayList<String>();
        var files = collect(paths, errors);
        int applied = 0;
        int skipped = 0;

        for (var file : files) {
            try {
                var source = SourceFile.read(file);
                var unit = parser.parse(source);
                var outcome = fixEngine.fixAll(unit, linter.lint(unit));

                applied += outcome.applied();
                skipped += outcome.skipped();

                if (outcome.changed()) {
                    changed.add(source.fileName());
                    if (!dryRun) {
                        source.withContent(outcome.content())
                              .write();
                    }
                    log.debug("{}: {} fix(es) {}", source.fileName(), outcome.applied(), dryRun ? "available" : "applied");
                }
            } catch (LintException e) {
                log.warn(e.getMessage());
                errors.add(e.error());
            }
        }
        return FixRun.fixRun(files.size(), changed, applied, skipped, errors);
    }

    private List<Path> collect(List<Path> paths, List<LintError> errors) {
        return FileCollector.collectJavaFiles(paths,
                                              path -> !context.shouldLint(path),
                                              message -> {
                                                  log.warn(message);
                                                  errors.add(LintError.readError("<input>", message));
                                              });
    }
}
