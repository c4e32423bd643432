package org.pragmatica.yieldguard.classify;

/// Semantic category of a call with respect to blocking I/O.
public enum OperationCategory {
    /// Exclusive-lock or mutating I/O.
    WRITE,
    /// Potentially expensive read.
    BULK_READ,
    /// Cheap, bounded read.
    SINGLE_READ,
    /// Not an operation the analysis knows anything about.
    UNCLASSIFIED;

    /// Whether statements performing an operation of this category need a following mitigation.
    public boolean requiresMitigation() {
        return this == WRITE || this == BULK_READ;
    }
}
