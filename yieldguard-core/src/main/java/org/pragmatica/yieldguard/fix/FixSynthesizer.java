package org.pragmatica.yieldguard.fix;

import org.pragmatica.yieldguard.linearize.StatementLinearizer;
import org.pragmatica.yieldguard.linearize.StatementSlot;
import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.rules.FixKind;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.SourceUnit;
import org.pragmatica.yieldguard.tree.FunctionDeclaration;
import org.pragmatica.yieldguard.tree.SourceRange;
import org.pragmatica.yieldguard.tree.StatementShapes;

import java.util.Optional;
import java.util.regex.Pattern;

/// Turns diagnostics into indentation-preserving source edits.
///
/// The anchor of a diagnostic is matched against the statements of the current tree;
/// when nothing matches (the file changed since analysis) no edit is produced.
public final class FixSynthesizer {
    private static final String BINDING_NAME = "result";

    private final Optional<String> mitigationStatement;
    private final SuccessorChecker successorChecker;

    private FixSynthesizer(Optional<String> mitigationStatement, SuccessorChecker successorChecker) {
        this.mitigationStatement = mitigationStatement;
        this.successorChecker = successorChecker;
    }

    /// Synthesizer inserting the dialect's default mitigation.
    public static FixSynthesizer fixSynthesizer() {
        return new FixSynthesizer(Optional.empty(), SuccessorChecker.successorChecker());
    }

    public static FixSynthesizer fixSynthesizer(Optional<String> mitigationStatement, SuccessorChecker successorChecker) {
        return new FixSynthesizer(mitigationStatement, successorChecker);
    }

    public Optional<TextEdit> synthesize(Diagnostic diagnostic, SourceUnit unit, FixKind kind) {
        return kind == FixKind.SPLIT_RETURN
               ? synthesizeSplitFix(diagnostic, unit)
               : synthesizeInsertionFix(diagnostic, unit);
    }

    /// Insert the mitigation on its own line right after the flagged statement.
    public Optional<TextEdit> synthesizeInsertionFix(Diagnostic diagnostic, SourceUnit unit) {
        return locate(diagnostic.anchor(), unit)
                .filter(located -> !successorChecker.isSafeSuccessor(located.slot().siblings(), located.slot().index()))
                .map(located -> {
                    var statement = located.slot().statement();
                    var indent = Indentation.leadingWhitespace(unit.content(), statement.range().offset());
                    var mitigation = mitigationFor(unit);

                    return TextEdit.textEdit("Insert " + mitigation,
                                             EditOperation.insertion(statement.range().end(),
                                                                     unit.lineSeparator() + indent + mitigation));
                });
    }

    /// Replace `return <call>;` with binding, mitigation and `return <binding>;`.
    public Optional<TextEdit> synthesizeSplitFix(Diagnostic diagnostic, SourceUnit unit) {
        return locate(diagnostic.anchor(), unit)
                .flatMap(located -> {
                    var statement = located.slot().statement();

                    if (StatementShapes.returnedCall(statement).isEmpty()) {
                        return Optional.empty();
                    }
                    return StatementShapes.returnedExpression(statement)
                                          .map(expression -> splitEdit(unit, located, statement.range(), expression.range()));
                });
    }

    private TextEdit splitEdit(SourceUnit unit, Located located, SourceRange statementRange, SourceRange expressionRange) {
        var indent = Indentation.leadingWhitespace(unit.content(), statementRange.offset());
        var separator = unit.lineSeparator();
        var name = freshName(unit.text(located.function().range()));
        var replacement = unit.dialect().bindingKeyword() + " " + name + " = " + unit.text(expressionRange) + ";"
                          + separator + indent + mitigationFor(unit)
                          + separator + indent + "return " + name + ";";

        return TextEdit.textEdit("Save to variable, yield, then return",
                                 EditOperation.replacement(statementRange.offset(), statementRange.length(), replacement));
    }

    private String mitigationFor(SourceUnit unit) {
        return mitigationStatement.orElse(unit.dialect().mitigationStatement());
    }

    /// `result`, or `result2`, `result3`, ... when the name is already taken in the function.
    static String freshName(String functionText) {
        var candidate = BINDING_NAME;

        for (int suffix = 2; isUsed(functionText, candidate); suffix++) {
            candidate = BINDING_NAME + suffix;
        }
        return candidate;
    }

    private static boolean isUsed(String text, String name) {
        return Pattern.compile("\\b" + name + "\\b")
                      .matcher(text)
                      .find();
    }

    /// Statement matching the anchor exactly, or else the first one intersecting it.
    private static Optional<Located> locate(SourceRange anchor, SourceUnit unit) {
        Located intersecting = null;

        for (var function : unit.functions()) {
            if (!function.range().intersects(anchor)) {
                continue;
            }
            for (var slot : StatementLinearizer.linearize(function.body())) {
                var range = slot.statement().range();

                if (range.equals(anchor)) {
                    return Optional.of(new Located(function, slot));
                }
                if (intersecting == null && range.intersects(anchor)) {
                    intersecting = new Located(function, slot);
                }
            }
        }
        return Optional.ofNullable(intersecting);
    }

    private record Located(FunctionDeclaration function, StatementSlot slot) {}
}
