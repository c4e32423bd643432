package org.pragmatica.yieldguard.fix;

/// Replace `deletedLength` characters at `offset` with `insertedText`.
public record EditOperation(int offset, int deletedLength, String insertedText) {
    public EditOperation {
        if (offset < 0 || deletedLength < 0) {
            throw new IllegalArgumentException("Invalid edit: offset=" + offset + ", deletedLength=" + deletedLength);
        }
    }

    public static EditOperation insertion(int offset, String text) {
        return new EditOperation(offset, 0, text);
    }

    public static EditOperation replacement(int offset, int deletedLength, String text) {
        return new EditOperation(offset, deletedLength, text);
    }

    public int end() {
        return offset + deletedLength;
    }

    /// Two operations overlap if their deleted spans intersect, or both insert at the same offset.
    public boolean overlaps(EditOperation other) {
        if (offset == other.offset) {
            return true;
        }
        return offset < other.end() && other.offset < end();
    }
}
