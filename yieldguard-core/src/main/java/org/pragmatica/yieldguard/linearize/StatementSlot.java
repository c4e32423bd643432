package org.pragmatica.yieldguard.linearize;

import org.pragmatica.yieldguard.tree.Statement;

import java.util.List;
import java.util.Optional;

/// Position of one significant statement among its siblings in the innermost enclosing block.
public record StatementSlot(List<Statement> siblings, int index) {
    public StatementSlot {
        if (index < 0 || index >= siblings.size()) {
            throw new IndexOutOfBoundsException("Slot index " + index + " outside of " + siblings.size() + " statements");
        }
    }

    public static StatementSlot statementSlot(List<Statement> siblings, int index) {
        return new StatementSlot(siblings, index);
    }

    public Statement statement() {
        return siblings.get(index);
    }

    public boolean isLast() {
        return index == siblings.size() - 1;
    }

    public Optional<Statement> next() {
        return isLast()
               ? Optional.empty()
               : Optional.of(siblings.get(index + 1));
    }
}
