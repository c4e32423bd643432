package org.pragmatica.yieldguard.shared;

/// Unchecked carrier of a [LintError].
public class LintException extends RuntimeException {
    private final LintError error;

    public LintException(LintError error) {
        super(error.message());
        this.error = error;
    }

    public LintException(LintError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public LintError error() {
        return error;
    }
}
