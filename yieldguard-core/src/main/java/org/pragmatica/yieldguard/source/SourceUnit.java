package org.pragmatica.yieldguard.source;

import org.pragmatica.yieldguard.tree.FunctionDeclaration;
import org.pragmatica.yieldguard.tree.SourceRange;

import java.util.List;

/// One parsed file: the immutable buffer, its line index and the functions found in it.
public record SourceUnit(String fileName,
                         String content,
                         LineIndex lineIndex,
                         SourceDialect dialect,
                         List<FunctionDeclaration> functions) {
    public SourceUnit {
        functions = List.copyOf(functions);
    }

    public static SourceUnit sourceUnit(String fileName,
                                        String content,
                                        SourceDialect dialect,
                                        List<FunctionDeclaration> functions) {
        return new SourceUnit(fileName, content, LineIndex.lineIndex(content), dialect, functions);
    }

    public String text(SourceRange range) {
        return range.text(content);
    }

    /// Line separator used by the buffer: `\r\n`, a lone `\r` when the buffer has no `\n`, else `\n`.
    public String lineSeparator() {
        if (content.contains("\r\n")) {
            return "\r\n";
        }
        return content.indexOf('\r') >= 0 && content.indexOf('\n') < 0
               ? "\r"
               : "\n";
    }
}
