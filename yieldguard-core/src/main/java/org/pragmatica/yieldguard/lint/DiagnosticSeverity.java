package org.pragmatica.yieldguard.lint;

import java.util.Locale;
import java.util.Optional;

/// Severity tiers, ordered from least to most severe.
public enum DiagnosticSeverity {
    INFO,
    SUGGESTION,
    WARNING,
    ERROR;

    public boolean isAtLeast(DiagnosticSeverity other) {
        return compareTo(other) >= 0;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Case-insensitive lookup by name.
    public static Optional<DiagnosticSeverity> fromLabel(String label) {
        for (var severity : values()) {
            if (severity.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
