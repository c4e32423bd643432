package org.pragmatica.yieldguard.fix;

/// Content after fixing one file, with the number of fixes applied and skipped.
public record FixOutcome(String content, int applied, int skipped) {
    public static FixOutcome fixOutcome(String content, int applied, int skipped) {
        return new FixOutcome(content, applied, skipped);
    }

    public boolean changed() {
        return applied > 0;
    }
}
