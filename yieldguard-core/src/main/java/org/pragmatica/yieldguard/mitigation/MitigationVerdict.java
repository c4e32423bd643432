package org.pragmatica.yieldguard.mitigation;

public enum MitigationVerdict {
    /// A mitigating call or a throw immediately follows.
    SAFE,
    /// Nothing mitigating follows, or the statement is the last one of its block.
    UNSAFE,
    /// The operation category needs no mitigation.
    NOT_APPLICABLE
}
