package org.pragmatica.yieldguard.fix;

import java.util.Comparator;
import java.util.List;

/// Ordered, non-overlapping edit operations over one file, produced by a single fix.
public record TextEdit(String label, List<EditOperation> operations) {
    public TextEdit {
        operations = operations.stream()
                               .sorted(Comparator.comparingInt(EditOperation::offset))
                               .toList();
        for (int i = 1; i < operations.size(); i++) {
            if (operations.get(i - 1).overlaps(operations.get(i))) {
                throw new IllegalArgumentException("Overlapping operations in edit '" + label + "'");
            }
        }
    }

    public static TextEdit textEdit(String label, EditOperation... operations) {
        return new TextEdit(label, List.of(operations));
    }

    public String applyTo(String content) {
        return TextEdits.apply(content, List.of(this));
    }
}
