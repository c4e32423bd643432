package org.pragmatica.yieldguard.mitigation;

import org.pragmatica.yieldguard.classify.OperationCategory;
import org.pragmatica.yieldguard.linearize.StatementSlot;
import org.pragmatica.yieldguard.tree.Statement;
import org.pragmatica.yieldguard.tree.Statement.ExpressionStatement;
import org.pragmatica.yieldguard.tree.StatementShapes;

import java.util.List;
import java.util.Set;

/// One-statement lookahead deciding whether a blocking operation is mitigated.
///
/// Only the immediate sibling counts. A yield buried in a nested conditional does not
/// run on every path and is not accepted.
public final class SuccessorChecker {
    public static final Set<String> DEFAULT_MITIGATION_CALLS = Set.of("yieldToUI", "waitWithoutBlocking");

    private final Set<String> mitigationCalls;

    private SuccessorChecker(Set<String> mitigationCalls) {
        this.mitigationCalls = Set.copyOf(mitigationCalls);
    }

    public static SuccessorChecker successorChecker() {
        return new SuccessorChecker(DEFAULT_MITIGATION_CALLS);
    }

    public static SuccessorChecker successorChecker(Set<String> mitigationCalls) {
        return new SuccessorChecker(mitigationCalls);
    }

    public boolean isSafeSuccessor(List<Statement> statements, int index) {
        if (index < 0 || index >= statements.size() - 1) {
            return false;
        }
        var next = statements.get(index + 1);
        return isMitigation(next) || StatementShapes.isThrow(next);
    }

    public MitigationVerdict verdict(StatementSlot slot, OperationCategory category) {
        if (!category.requiresMitigation()) {
            return MitigationVerdict.NOT_APPLICABLE;
        }
        return isSafeSuccessor(slot.siblings(), slot.index())
               ? MitigationVerdict.SAFE
               : MitigationVerdict.UNSAFE;
    }

    /// `yieldToUI();`, `await DelayUtils.yieldToUI();` and the like.
    public boolean isMitigation(Statement statement) {
        if (!(statement instanceof ExpressionStatement expressionStatement)) {
            return false;
        }
        return StatementShapes.performedCall(expressionStatement.expression())
                              .filter(call -> mitigationCalls.contains(call.name()))
                              .isPresent();
    }
}
