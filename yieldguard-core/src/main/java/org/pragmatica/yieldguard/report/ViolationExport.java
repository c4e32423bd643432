package org.pragmatica.yieldguard.report;

import java.util.List;
import java.util.Map;

/// JSON document written by [ViolationExporter].
public record ViolationExport(String schema, String timestamp, Summary summary, List<Violation> violations) {

    public record Summary(int filesAnalyzed,
                          long filesWithIssues,
                          int totalViolations,
                          Map<String, Long> bySeverity,
                          Map<String, Long> byImpact,
                          Map<String, Long> issuesByFile) {}

    public record Violation(String file,
                            int line,
                            int column,
                            String rule,
                            String severity,
                            String impact,
                            String message,
                            String correction) {}
}
