package org.pragmatica.yieldguard.fix;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Applies edits to a buffer.
public final class TextEdits {
    private TextEdits() {}

    /// Apply all operations of the given edits in one pass.
    ///
    /// Operations are taken in ascending offset order; an operation overlapping one
    /// already accepted is dropped together with the rest of its edit, so a fix is
    /// either applied completely or not at all.
    public static String apply(String content, List<TextEdit> edits) {
        var accepted = compatibleOperations(edits);
        var result = new StringBuilder(content);

        for (int i = accepted.size() - 1; i >= 0; i--) {
            var operation = accepted.get(i);

            if (operation.end() > content.length()) {
                continue;
            }
            result.replace(operation.offset(), operation.end(), operation.insertedText());
        }
        return result.toString();
    }

    /// Edits that can be applied together, in input order, skipping those conflicting with earlier ones.
    public static List<TextEdit> compatible(List<TextEdit> edits) {
        var accepted = new ArrayList<TextEdit>();
        var operations = new ArrayList<EditOperation>();

        for (var edit : edits) {
            var conflicts = edit.operations()
                                .stream()
                                .anyMatch(candidate -> operations.stream().anyMatch(candidate::overlaps));
            if (!conflicts) {
                accepted.add(edit);
                operations.addAll(edit.operations());
            }
        }
        return accepted;
    }

    private static List<EditOperation> compatibleOperations(List<TextEdit> edits) {
        return compatible(edits).stream()
                                .flatMap(edit -> edit.operations().stream())
                                .sorted(Comparator.comparingInt(EditOperation::offset))
                                .toList();
    }
}
