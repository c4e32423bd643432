package org.pragmatica.yieldguard.linearize;

import org.pragmatica.yieldguard.tree.FunctionBody;
import org.pragmatica.yieldguard.tree.FunctionBody.BlockBody;
import org.pragmatica.yieldguard.tree.Statement;
import org.pragmatica.yieldguard.tree.Statement.Block;
import org.pragmatica.yieldguard.tree.Statement.ForStatement;
import org.pragmatica.yieldguard.tree.Statement.IfStatement;
import org.pragmatica.yieldguard.tree.Statement.TryStatement;
import org.pragmatica.yieldguard.tree.Statement.WhileStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/// Flattens a function body into the significant statements of every block, in source order.
///
/// Control-flow wrappers (try/catch/finally, if/else, loops, bare nested blocks) are
/// never visited themselves; the walk descends into their blocks so that "the next
/// statement" is always answered within the innermost enclosing block. Wrapper arms
/// that are not blocks have no siblings and are skipped.
public final class StatementLinearizer {
    private StatementLinearizer() {}

    /// Visit every significant statement of the body exactly once. Expression bodies yield nothing.
    public static void walk(FunctionBody body, Consumer<StatementSlot> visitor) {
        if (body instanceof BlockBody blockBody) {
            walkBlock(blockBody.block(), visitor);
        }
    }

    /// Collect the slots [#walk] would visit, in visiting order.
    public static List<StatementSlot> linearize(FunctionBody body) {
        var slots = new ArrayList<StatementSlot>();
        walk(body, slots::add);
        return slots;
    }

    private static void walkBlock(Block block, Consumer<StatementSlot> visitor) {
        var statements = block.statements();

        for (int i = 0; i < statements.size(); i++) {
            var statement = statements.get(i);

            if (statement instanceof Block nested) {
                walkBlock(nested, visitor);
            } else if (statement instanceof TryStatement tryStatement) {
                walkBlock(tryStatement.body(), visitor);
                tryStatement.catchBlocks()
                            .forEach(catchBlock -> walkBlock(catchBlock, visitor));
                tryStatement.finallyBlock()
                            .ifPresent(finallyBlock -> walkBlock(finallyBlock, visitor));
            } else if (statement instanceof IfStatement ifStatement) {
                walkArm(ifStatement.thenStatement(), visitor);
                ifStatement.elseStatement()
                           .ifPresent(elseStatement -> walkArm(elseStatement, visitor));
            } else if (statement instanceof ForStatement forStatement) {
                walkArm(forStatement.body(), visitor);
            } else if (statement instanceof WhileStatement whileStatement) {
                walkArm(whileStatement.body(), visitor);
            } else {
                visitor.accept(StatementSlot.statementSlot(statements, i));
            }
        }
    }

    private static void walkArm(Statement arm, Consumer<StatementSlot> visitor) {
        if (arm instanceof Block block) {
            walkBlock(block, visitor);
        }
    }
}
