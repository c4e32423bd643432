package org.pragmatica.yieldguard.report;

import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintImpact;
import org.pragmatica.yieldguard.lint.LintRun;
import org.pragmatica.yieldguard.report.ViolationExport.Summary;
import org.pragmatica.yieldguard.report.ViolationExport.Violation;
import org.pragmatica.yieldguard.shared.LintError;
import org.pragmatica.yieldguard.shared.LintException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.MapperFeature;
import tools.jackson.databind.json.JsonMapper;

/// Structured JSON export of all violations of a lint run.
///
/// Violations are ordered by impact (critical first), then file (case-insensitive), then line.
/// File paths are made relative to the project root and use forward slashes.
public final class ViolationExporter {
    private static final Logger log = LoggerFactory.getLogger(ViolationExporter.class);

    public static final String SCHEMA_VERSION = "1.0";

    private static final JsonMapper MAPPER = JsonMapper.builder()
                                                       .disable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                                                       .build();

    private final Path projectRoot;
    private final Clock clock;

    private ViolationExporter(Path projectRoot, Clock clock) {
        this.projectRoot = projectRoot;
        this.clock = clock;
    }

    public static ViolationExporter violationExporter(Path projectRoot) {
        return new ViolationExporter(projectRoot, Clock.systemUTC());
    }

    public static ViolationExporter violationExporter(Path projectRoot, Clock clock) {
        return new ViolationExporter(projectRoot, clock);
    }

    public ViolationExport export(LintRun run) {
        var violations = run.diagnostics()
                            .stream()
                            .sorted(Comparator.comparing(Diagnostic::impact)
                                              .thenComparing(d -> relativePath(d.fileName()), String.CASE_INSENSITIVE_ORDER)
                                              .thenComparingInt(Diagnostic::line))
                            .map(this::violation)
                            .toList();

        return new ViolationExport(SCHEMA_VERSION,
                                   Instant.now(clock).toString(),
                                   summary(run, violations),
                                   violations);
    }

    /// Pretty-printed JSON for the run.
    public String render(LintRun run) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                         .writeValueAsString(export(run));
        } catch (JacksonException e) {
            throw new LintException(LintError.writeError("<export>", e.getOriginalMessage()), e);
        }
    }

    /// Write the export to `target`, replacing it through a temporary sibling file.
    ///
    /// @throws LintException carrying [LintError.WriteError] when the file can't be written
    public void write(LintRun run, Path target) {
        var json = render(run);
        var temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            var parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
            log.debug("Wrote {} violation(s) to {}", run.diagnostics().size(), target);
        } catch (IOException e) {
            throw new LintException(LintError.writeError(target.toString(), e.getMessage()), e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing directly", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Summary summary(LintRun run, List<Violation> violations) {
        var bySeverity = new LinkedHashMap<String, Long>();
        for (int i = DiagnosticSeverity.values().length - 1; i >= 0; i--) {
            var severity = DiagnosticSeverity.values()[i];
            bySeverity.put(severity.label(), run.count(severity));
        }

        var byImpact = new LinkedHashMap<String, Long>();
        for (var impact : LintImpact.values()) {
            byImpact.put(label(impact), violations.stream()
                                                  .filter(v -> v.impact().equals(label(impact)))
                                                  .count());
        }

        Map<String, Long> issuesByFile = violations.stream()
                                                   .collect(Collectors.groupingBy(Violation::file,
                                                                                  TreeMap::new,
                                                                                  Collectors.counting()));
        return new Summary(run.filesAnalyzed(),
                           run.filesWithIssues(),
                           violations.size(),
                           bySeverity,
                           byImpact,
                           issuesByFile);
    }

    private Violation violation(Diagnostic diagnostic) {
        return new Violation(relativePath(diagnostic.fileName()),
                             diagnostic.line(),
                             diagnostic.column(),
                             diagnostic.ruleId(),
                             diagnostic.severity().label(),
                             label(diagnostic.impact()),
                             diagnostic.message(),
                             diagnostic.correction());
    }

    String relativePath(String fileName) {
        var root = projectRoot.toString().replace('\\', '/');
        var file = fileName.replace('\\', '/');

        if (!root.isEmpty() && file.startsWith(root + "/")) {
            return file.substring(root.length() + 1);
        }
        return file;
    }

    private static String label(LintImpact impact) {
        return impact.name().toLowerCase(Locale.ROOT);
    }
}
