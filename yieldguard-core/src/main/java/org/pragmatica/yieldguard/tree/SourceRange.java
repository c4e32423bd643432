package org.pragmatica.yieldguard.tree;

/// Half-open character range `[offset, offset + length)` within one source buffer.
public record SourceRange(int offset, int length) {
    public static final SourceRange EMPTY = new SourceRange(0, 0);

    public SourceRange {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: offset=" + offset + ", length=" + length);
        }
    }

    public static SourceRange sourceRange(int offset, int length) {
        return new SourceRange(offset, length);
    }

    public static SourceRange between(int start, int end) {
        return new SourceRange(start, end - start);
    }

    public int end() {
        return offset + length;
    }

    /// Ranges intersect when they share at least one character, or when an empty range sits inside the other.
    public boolean intersects(SourceRange other) {
        if (length == 0 || other.length == 0) {
            return other.offset >= offset && other.offset <= end()
                   || offset >= other.offset && offset <= other.end();
        }
        return offset < other.end() && other.offset < end();
    }

    public boolean contains(SourceRange other) {
        return other.offset >= offset && other.end() <= end();
    }

    public String text(String source) {
        return source.substring(offset, end());
    }
}
