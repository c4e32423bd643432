package org.pragmatica.yieldguard.shared;

/// Failures of the host layer: reading, parsing, writing files and loading configuration.
///
/// The analysis itself never fails; these errors only arise around it.
public sealed interface LintError {
    String message();

    record ParseError(String file, int line, int column, String detail) implements LintError {
        @Override
        public String message() {
            return file + ":" + line + ":" + column + ": parse error: " + detail;
        }
    }

    record ReadError(String file, String detail) implements LintError {
        @Override
        public String message() {
            return "Unable to read " + file + ": " + detail;
        }
    }

    record WriteError(String file, String detail) implements LintError {
        @Override
        public String message() {
            return "Unable to write " + file + ": " + detail;
        }
    }

    record ConfigError(String source, String detail) implements LintError {
        @Override
        public String message() {
            return "Invalid configuration in " + source + ": " + detail;
        }
    }

    static LintError parseError(String file, int line, int column, String detail) {
        return new ParseError(file, line, column, detail);
    }

    static LintError readError(String file, String detail) {
        return new ReadError(file, detail);
    }

    static LintError writeError(String file, String detail) {
        return new WriteError(file, detail);
    }

    static LintError configError(String source, String detail) {
        return new ConfigError(source, detail);
    }
}
