package org.pragmatica.yieldguard.lint;

/// How much accumulated occurrences of a rule's violation hurt.
public enum LintImpact {
    /// Each occurrence is independently harmful.
    CRITICAL,
    /// Significant issues that compound; a handful is manageable.
    HIGH,
    /// Code quality issues; large counts suggest accumulated debt.
    MEDIUM,
    /// Style and consistency.
    LOW
}
