package org.pragmatica.yieldguard.source;

/// Surface syntax used when generating fix text.
public enum SourceDialect {
    JAVA("var", "DelayUtils.yieldToUI();"),
    DART("final", "await DelayUtils.yieldToUI();");

    private final String bindingKeyword;
    private final String mitigationStatement;

    SourceDialect(String bindingKeyword, String mitigationStatement) {
        this.bindingKeyword = bindingKeyword;
        this.mitigationStatement = mitigationStatement;
    }

    /// Keyword introducing an inferred, single-assignment local.
    public String bindingKeyword() {
        return bindingKeyword;
    }

    /// Statement inserted after an unmitigated operation.
    public String mitigationStatement() {
        return mitigationStatement;
    }
}
