package org.pragmatica.yieldguard.tree;

import java.util.Optional;

/// Capability of nodes that are evaluated against a receiver expression.
public interface HasReceiver {
    Optional<Expression> receiver();
}
