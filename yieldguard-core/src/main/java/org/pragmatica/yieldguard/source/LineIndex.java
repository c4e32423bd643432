package org.pragmatica.yieldguard.source;

import org.pragmatica.yieldguard.tree.SourceRange;

import java.util.ArrayList;
import java.util.Arrays;

/// Converts between character offsets and 1-based line/column positions.
///
/// Recognizes `\n`, `\r\n` and a lone `\r` as line terminators.
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex lineIndex(String content) {
        var starts = new ArrayList<Integer>();
        starts.add(0);

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);

            if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (c == '\n' || c == '\r') {
                starts.add(i + 1);
            }
        }
        return new LineIndex(starts.stream()
                                   .mapToInt(Integer::intValue)
                                   .toArray(),
                             content.length());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /// Offset of a 1-based line/column position, clamped to the buffer.
    public int offsetOf(int line, int column) {
        var lineIdx = Math.max(0, Math.min(line - 1, lineStarts.length - 1));
        return Math.min(length, lineStarts[lineIdx] + Math.max(0, column - 1));
    }

    /// 1-based line containing the offset.
    public int lineOf(int offset) {
        var pos = Arrays.binarySearch(lineStarts, offset);
        return pos >= 0
               ? pos + 1
               : -pos - 1;
    }

    /// 1-based column of the offset within its line.
    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1] + 1;
    }

    /// Range between two positions, the end position being inclusive as reported by parsers.
    public SourceRange rangeOf(int beginLine, int beginColumn, int endLine, int endColumn) {
        var start = offsetOf(beginLine, beginColumn);
        var end = Math.min(length, offsetOf(endLine, endColumn) + 1);
        return SourceRange.between(start, Math.max(start, end));
    }
}
