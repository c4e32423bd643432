package org.pragmatica.yieldguard.lint.rules;

import org.pragmatica.yieldguard.classify.OperationCategory;
import org.pragmatica.yieldguard.classify.OperationClassifier;
import org.pragmatica.yieldguard.lint.AnalysisSession;
import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintImpact;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.SourceUnit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.yieldguard.tree.TreeFixtures.treeFixtures;

class MitigationRuleTest {

    @Test
    void analyze_flagsAwaitedWrite_inDartShapedBody() {
        var fixtures = treeFixtures("""
                Future<void> saveAll(List<User> users) async {
                  await isar.writeTxn(batch);
                  await DelayUtils.yieldToUI();
                  await isar.putAll(users);
                  notify();
                }
                """);
        var function = fixtures.function("saveAll",
                                         fixtures.awaitCall("isar", "writeTxn", "batch"),
                                         fixtures.awaitCall("DelayUtils", "yieldToUI", ""),
                                         fixtures.awaitCall("isar", "putAll", "users"),
                                         fixtures.plainCall(null, "notify", ""));
        var unit = fixtures.unit(function);

        var diagnostics = MitigationRule.requireYieldAfterWrite()
                                        .analyze(function, session(unit), DiagnosticSeverity.WARNING)
                                        .toList();

        assertThat(diagnostics).hasSize(1);
        assertThat(unit.text(diagnostics.get(0).anchor())).isEqualTo("await isar.putAll(users);");
        assertThat(diagnostics.get(0).line()).isEqualTo(4);
        assertThat(diagnostics.get(0).column()).isEqualTo(3);
    }

    @Test
    void analyze_inspectsVariableInitializers() {
        var fixtures = treeFixtures("""
                Future<void> refresh() async {
                  final users = await isar.findAll();
                  render(users);
                }
                """);
        var function = fixtures.function("refresh",
                                         fixtures.awaitDeclaration("users", "isar", "findAll", ""),
                                         fixtures.plainCall(null, "render", "users"));
        var unit = fixtures.unit(function);

        var diagnostics = MitigationRule.preferYieldAfterRead()
                                        .analyze(function, session(unit), DiagnosticSeverity.SUGGESTION)
                                        .toList();

        assertThat(diagnostics).extracting(Diagnostic::ruleId)
                               .containsExactly(MitigationRule.READ_RULE_ID);
        assertThat(diagnostics.get(0).impact()).isEqualTo(LintImpact.MEDIUM);
    }

    @Test
    void analyze_flagsWriteInsideTry_evenWhenYieldFollowsTheTry() {
        var fixtures = treeFixtures("""
                Future<void> save() async {
                  try {
                    await dbSaveContact(contact);
                  } catch (e) {
                    report(e);
                  }
                  await DelayUtils.yieldToUI();
                }
                """);
        var body = fixtures.block(fixtures.awaitCall(null, "dbSaveContact", "contact"));
        var handler = fixtures.block(fixtures.plainCall(null, "report", "e"));
        var function = fixtures.function("save",
                                         fixtures.tryCatch(body, handler),
                                         fixtures.awaitCall("DelayUtils", "yieldToUI", ""));
        var unit = fixtures.unit(function);

        var diagnostics = MitigationRule.requireYieldAfterWrite()
                                        .analyze(function, session(unit), DiagnosticSeverity.WARNING)
                                        .toList();

        assertThat(diagnostics).hasSize(1);
        assertThat(unit.text(diagnostics.get(0).anchor())).isEqualTo("await dbSaveContact(contact);");
    }

    @Test
    void mitigationRule_rejectsTargetsWithoutMitigation() {
        assertThatThrownBy(() -> MitigationRule.mitigationRule("custom", OperationCategory.SINGLE_READ))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MitigationRule.mitigationRule("custom", OperationCategory.UNCLASSIFIED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mitigationRule_keepsBuiltInWording_underCustomId() {
        var rule = MitigationRule.mitigationRule("custom_write", OperationCategory.WRITE);

        assertThat(rule.ruleId()).isEqualTo("custom_write");
        assertThat(rule.target()).isEqualTo(OperationCategory.WRITE);
        assertThat(rule.impact()).isEqualTo(LintImpact.HIGH);
        assertThat(rule.fixKind()).isEqualTo(FixKind.INSERT_MITIGATION);
    }

    private static AnalysisSession session(SourceUnit unit) {
        return AnalysisSession.analysisSession(unit,
                                               OperationClassifier.operationClassifier(),
                                               SuccessorChecker.successorChecker());
    }
}
