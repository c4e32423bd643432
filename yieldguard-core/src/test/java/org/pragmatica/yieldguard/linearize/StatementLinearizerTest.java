package org.pragmatica.yieldguard.linearize;

import org.pragmatica.yieldguard.tree.Expression.OtherExpression;
import org.pragmatica.yieldguard.tree.FunctionBody.BlockBody;
import org.pragmatica.yieldguard.tree.FunctionBody.ExpressionBody;
import org.pragmatica.yieldguard.tree.SourceRange;
import org.pragmatica.yieldguard.tree.Statement;
import org.pragmatica.yieldguard.tree.Statement.Block;
import org.pragmatica.yieldguard.tree.Statement.ExpressionStatement;
import org.pragmatica.yieldguard.tree.Statement.ForStatement;
import org.pragmatica.yieldguard.tree.Statement.IfStatement;
import org.pragmatica.yieldguard.tree.Statement.TryStatement;
import org.pragmatica.yieldguard.tree.Statement.WhileStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementLinearizerTest {
    private int nextOffset;

    @Test
    void linearize_flattensTryCatch_keepingSuccessorsInsideEachBlock() {
        var s1 = statement();
        var s2 = statement();
        var s3 = statement();
        var tryStatement = new TryStatement(SourceRange.EMPTY,
                                            block(s1, s2),
                                            List.of(block(s3)),
                                            Optional.empty());

        var slots = StatementLinearizer.linearize(new BlockBody(block(tryStatement)));

        assertThat(slots).extracting(StatementSlot::statement)
                         .containsExactly(s1, s2, s3);
        assertThat(slots.get(0).next()).contains(s2);
        assertThat(slots.get(1).isLast()).isTrue();
        assertThat(slots.get(2).isLast()).isTrue();
    }

    @Test
    void linearize_neverYieldsWrappers() {
        var inIf = statement();
        var inElse = statement();
        var inFor = statement();
        var inWhile = statement();
        var inFinally = statement();
        var nested = statement();
        var last = statement();
        var body = block(new IfStatement(SourceRange.EMPTY, block(inIf), Optional.of(block(inElse))),
                         new ForStatement(SourceRange.EMPTY, block(inFor)),
                         new WhileStatement(SourceRange.EMPTY, block(inWhile)),
                         new TryStatement(SourceRange.EMPTY, block(statement()), List.of(), Optional.of(block(inFinally))),
                         block(nested),
                         last);

        var statements = StatementLinearizer.linearize(new BlockBody(body))
                                            .stream()
                                            .map(StatementSlot::statement)
                                            .toList();

        assertThat(statements).contains(inIf, inElse, inFor, inWhile, inFinally, nested, last)
                              .allMatch(ExpressionStatement.class::isInstance);
    }

    @Test
    void linearize_skipsArmsThatAreNotBlocks() {
        var braceless = statement();
        var after = statement();
        var body = block(new IfStatement(SourceRange.EMPTY, braceless, Optional.empty()), after);

        assertThat(StatementLinearizer.linearize(new BlockBody(body)))
                .extracting(StatementSlot::statement)
                .containsExactly(after);
    }

    @Test
    void walk_visitsEveryStatementOnce_inSourceOrder() {
        var a = statement();
        var b = statement();
        var c = statement();
        var visited = new ArrayList<Statement>();

        StatementLinearizer.walk(new BlockBody(block(a, block(b), c)), slot -> visited.add(slot.statement()));

        assertThat(visited).containsExactly(a, b, c);
    }

    @Test
    void linearize_yieldsNothing_forExpressionBody() {
        var body = new ExpressionBody(new OtherExpression(SourceRange.EMPTY));

        assertThat(StatementLinearizer.linearize(body)).isEmpty();
    }

    @Test
    void statementSlot_rejectsIndexOutsideSiblings() {
        assertThatThrownBy(() -> StatementSlot.statementSlot(List.of(statement()), 1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    private Statement statement() {
        var range = SourceRange.sourceRange(nextOffset, 1);
        nextOffset += 2;
        return new ExpressionStatement(range, new OtherExpression(range));
    }

    private static Block block(Statement... statements) {
        return new Block(SourceRange.EMPTY, List.of(statements));
    }
}
