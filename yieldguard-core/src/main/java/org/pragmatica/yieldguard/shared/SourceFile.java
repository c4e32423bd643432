package org.pragmatica.yieldguard.shared;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Source file path paired with its content.
public record SourceFile(Path path, String content) {
    public static SourceFile sourceFile(Path path, String content) {
        return new SourceFile(path, content);
    }

    /// Read a file as UTF-8.
    ///
    /// @throws LintException carrying [LintError.ReadError] when the file can't be read
    public static SourceFile read(Path path) {
        try {
            return new SourceFile(path, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LintException(LintError.readError(path.toString(), e.getMessage()), e);
        }
    }

    /// Write the content back to [#path()].
    public void write() {
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LintException(LintError.writeError(path.toString(), e.getMessage()), e);
        }
    }

    public String fileName() {
        return path.toString();
    }

    public SourceFile withContent(String newContent) {
        return new SourceFile(path, newContent);
    }
}
