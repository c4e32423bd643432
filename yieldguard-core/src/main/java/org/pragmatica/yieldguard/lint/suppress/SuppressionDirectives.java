package org.pragmatica.yieldguard.lint.suppress;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/// `// ignore:` and `// ignore_for_file:` comments found in one file.
///
/// ```
/// // ignore: require_yield_after_db_write
/// db.writeTxn(batch);
///
/// db.writeTxn(batch); // ignore: require-yield-after-db-write
///
/// // ignore_for_file: prefer_yield_after_db_read
/// ```
///
/// A trailing directive covers its own line only; a directive alone on its line also covers
/// the line below. Rule names may be written with underscores or hyphens and are separated
/// by commas.
/// Anything after a nested `//` or a ` - ` separator is an explanation, not a rule name.
public final class SuppressionDirectives {
    private static final Pattern LINE_DIRECTIVE = Pattern.compile("//\\s*ignore\\s*:(.*)$");
    private static final Pattern FILE_DIRECTIVE = Pattern.compile("//\\s*ignore_for_file\\s*:(.*)$");
    private static final Pattern EXPLANATION = Pattern.compile("(//|\\s-\\s).*$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final Set<String> fileRules;
    private final Map<Integer, Set<String>> lineRules;
    private final Set<Integer> standaloneLines;

    private SuppressionDirectives(Set<String> fileRules,
                                  Map<Integer, Set<String>> lineRules,
                                  Set<Integer> standaloneLines) {
        this.fileRules = fileRules;
        this.lineRules = lineRules;
        this.standaloneLines = standaloneLines;
    }

    public static SuppressionDirectives suppressionDirectives(String content) {
        var fileRules = new HashSet<String>();
        var lineRules = new HashMap<Integer, Set<String>>();
        var standaloneLines = new HashSet<Integer>();
        var lines = LINE_BREAK.split(content, -1);

        for (int i = 0; i < lines.length; i++) {
            var fileMatcher = FILE_DIRECTIVE.matcher(lines[i]);

            if (fileMatcher.find()) {
                fileRules.addAll(ruleNames(fileMatcher.group(1)));
                continue;
            }

            var lineMatcher = LINE_DIRECTIVE.matcher(lines[i]);

            if (lineMatcher.find()) {
                lineRules.put(i + 1, ruleNames(lineMatcher.group(1)));

                if (lines[i].substring(0, lineMatcher.start()).isBlank()) {
                    standaloneLines.add(i + 1);
                }
            }
        }
        return new SuppressionDirectives(Set.copyOf(fileRules), Map.copyOf(lineRules), Set.copyOf(standaloneLines));
    }

    public boolean isSuppressedForFile(String ruleId) {
        return fileRules.contains(normalize(ruleId));
    }

    /// Suppressed by a directive on the same line or by a standalone directive on the line directly above.
    public boolean isSuppressedAt(String ruleId, int line) {
        var normalized = normalize(ruleId);

        return isSuppressedForFile(ruleId)
               || lineRules.getOrDefault(line, Set.of()).contains(normalized)
               || standaloneLines.contains(line - 1) && lineRules.getOrDefault(line - 1, Set.of()).contains(normalized);
    }

    private static Set<String> ruleNames(String directiveBody) {
        var names = new ArrayList<String>();
        var withoutExplanation = EXPLANATION.matcher(directiveBody)
                                            .replaceFirst("");

        for (var name : withoutExplanation.split(",")) {
            var trimmed = name.trim();

            if (!trimmed.isEmpty()) {
                names.add(normalize(trimmed));
            }
        }
        return Set.copyOf(names);
    }

    private static String normalize(String ruleName) {
        return ruleName.replace('-', '_');
    }
}
