package com.github.tfilang;

import java.util.Optional;

/**
 * A 1-based line/column pair together with the text of the line it points into.
 */
public record SourcePosition(int line, int column, String sourceLine) {

    public static SourcePosition of(String source, int offset) {
        int limit = Math.min(Math.max(offset, 0), source.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = source.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        var sourceLine = source.substring(lineStart, lineEnd);
        if (sourceLine.endsWith("\r")) {
            sourceLine = sourceLine.substring(0, sourceLine.length() - 1);
        }
        return new SourcePosition(line, limit - lineStart + 1, sourceLine);
    }

    public String caret() {
        return " ".repeat(column - 1) + "^";
    }

    public String render(String heading, String message, Optional<String> suggestion) {
        var sb = new StringBuilder();
        sb.append(heading).append(" at line ").append(line).append(", column ").append(column).append('\n');
        sb.append("   ").append(message).append('\n');
        sb.append("   ").append(sourceLine).append('\n');
        sb.append("   ").append(caret());
        suggestion.ifPresent(s -> sb.append('\n').append("   Suggestion: ").append(s));
        return sb.toString();
    }
}
