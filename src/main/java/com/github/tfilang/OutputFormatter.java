package com.github.tfilang;

import java.util.stream.Collectors;

/**
 * Text transformations applied to generated JavaScript after a successful
 * compilation.
 */
public class OutputFormatter {

    static final String STRICT_DIRECTIVE = "\"use strict\";";
    private static final String INDENT = "    ";

    private OutputFormatter() {}

    public static String apply(String code, String source, CompilationOptions options) {
        if (options.minifyOutput()) {
            code = minify(code);
        } else if (options.formatOutput()) {
            code = reindent(code);
        }
        if (options.strictMode()) {
            code = STRICT_DIRECTIVE + (options.minifyOutput() ? "" : "\n") + code;
        }
        if (options.addComments()) {
            code = sourceComments(source) + "\n" + code;
        }
        return code;
    }

    /**
     * Indents every line by the number of braces open before it. Blank lines
     * stay empty.
     */
    public static String reindent(String code) {
        var formatted = new StringBuilder();
        int depth = 0;
        for (var line : code.split("\n", -1)) {
            var trimmed = line.trim();
            if (trimmed.startsWith("}")) {
                depth = Math.max(depth - 1, 0);
            }
            if (!trimmed.isEmpty()) {
                formatted.append(INDENT.repeat(depth)).append(trimmed);
            }
            formatted.append('\n');
            if (trimmed.endsWith("{")) {
                depth++;
            }
        }
        // split keeps one piece more than there are separators
        formatted.setLength(formatted.length() - 1);
        return formatted.toString();
    }

    public static String minify(String code) {
        return code.lines()
                .map(String::trim)
                .collect(Collectors.joining());
    }

    /**
     * One {@code // N: line} comment per non-blank source line, N being the
     * 1-based line number.
     */
    public static String sourceComments(String source) {
        var comments = new StringBuilder();
        comments.append("// Generated from TFI source code\n");
        comments.append("// Original source:\n");
        var lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i].trim();
            if (!line.isEmpty()) {
                comments.append("// ").append(i + 1).append(": ").append(line).append('\n');
            }
        }
        return comments.toString();
    }

}
