package org.pragmatica.yieldguard.lint.rules;

import org.pragmatica.yieldguard.classify.OperationClassifier;
import org.pragmatica.yieldguard.lint.AnalysisSession;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.SourceUnit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.yieldguard.tree.TreeFixtures.treeFixtures;

class ReturnAwaitRuleTest {
    private final ReturnAwaitRule rule = ReturnAwaitRule.avoidReturnAwaitDb();

    @Test
    void analyze_flagsReturnedWrite() {
        var fixtures = treeFixtures("""
                Future<int> save(User user) async {
                  return await isar.writeTxn(user);
                }
                """);
        var function = fixtures.function("save", fixtures.returnAwait("isar", "writeTxn", "user"));
        var unit = fixtures.unit(function);

        var diagnostics = rule.analyze(function, session(unit), DiagnosticSeverity.WARNING)
                              .toList();

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).ruleId()).isEqualTo(ReturnAwaitRule.RULE_ID);
        assertThat(unit.text(diagnostics.get(0).anchor())).isEqualTo("return await isar.writeTxn(user);");
    }

    @Test
    void analyze_ignoresReturnedReads_andPlainValues() {
        var fixtures = treeFixtures("""
                Future<List<User>> all() async {
                  return await isar.findAll();
                  return users;
                }
                """);
        var function = fixtures.function("all",
                                         fixtures.returnAwait("isar", "findAll", ""),
                                         fixtures.returnValue("users"));
        var unit = fixtures.unit(function);

        assertThat(rule.analyze(function, session(unit), DiagnosticSeverity.WARNING)).isEmpty();
    }

    @Test
    void fixKind_isSplitReturn() {
        assertThat(rule.fixKind()).isEqualTo(FixKind.SPLIT_RETURN);
    }

    private static AnalysisSession session(SourceUnit unit) {
        return AnalysisSession.analysisSession(unit,
                                               OperationClassifier.operationClassifier(),
                                               SuccessorChecker.successorChecker());
    }
}
