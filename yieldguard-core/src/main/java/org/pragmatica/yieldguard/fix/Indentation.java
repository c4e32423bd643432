package org.pragmatica.yieldguard.fix;

import java.util.regex.Pattern;

/// Indentation helpers.
public final class Indentation {
    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^[ \\t]*");

    private Indentation() {}

    /// Leading whitespace of the line containing `offset`.
    public static String leadingWhitespace(String source, int offset) {
        var lineStart = Math.min(offset, source.length());

        while (lineStart > 0 && source.charAt(lineStart - 1) != '\n' && source.charAt(lineStart - 1) != '\r') {
            lineStart--;
        }

        var matcher = LEADING_WHITESPACE.matcher(source.substring(lineStart, Math.min(offset, source.length())));
        return matcher.find()
               ? matcher.group()
               : "";
    }
}
