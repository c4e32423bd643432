package org.pragmatica.yieldguard.lint.rules;

/// Shape of the automated fix a rule offers.
public enum FixKind {
    /// Insert the mitigation on a new line after the flagged statement.
    INSERT_MITIGATION,
    /// Split `return <call>` into binding, mitigation and return of the binding.
    SPLIT_RETURN
}
