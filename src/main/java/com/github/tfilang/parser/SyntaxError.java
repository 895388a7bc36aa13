package com.github.tfilang.parser;

import java.util.Optional;

import com.github.tfilang.CompilationError;
import com.github.tfilang.SourcePosition;

public record SyntaxError(
        int line,
        int column,
        String expected,
        String found,
        String sourceSnippet,
        String suggestionText) implements CompilationError {

    static SyntaxError at(SourcePosition position, String expected, String found, String suggestion) {
        return new SyntaxError(position.line(), position.column(), expected, found, position.sourceLine(),
                suggestion != null ? suggestion : suggestFor(position.sourceLine()));
    }

    @Override
    public String message() {
        return "Expected " + expected + " but found " + found;
    }

    @Override
    public Optional<String> suggestion() {
        return Optional.ofNullable(suggestionText);
    }

    @Override
    public String render() {
        return new SourcePosition(line, column, sourceSnippet).render("Parse Error", message(), suggestion());
    }

    // fallback when the failing rule has nothing more specific to say
    static String suggestFor(String sourceLine) {
        if (sourceLine.isBlank()) {
            return "Add a valid statement like 'bahubali(\"Hello\");'";
        } else if (sourceLine.contains("=") && !sourceLine.contains("rrr") && !sourceLine.contains("pushpa")) {
            return "Variable assignments need 'rrr' (const) or 'pushpa' (let) keyword";
        } else if (sourceLine.contains("bahubali") && !sourceLine.contains("(")) {
            return "bahubali statements need parentheses: bahubali(\"message\");";
        } else if (sourceLine.contains("magadheera") && !sourceLine.contains("(")) {
            return "magadheera statements need parentheses: magadheera(condition) { ... }";
        } else if (sourceLine.contains("pokiri") && !sourceLine.contains("(")) {
            return "pokiri statements need parentheses: pokiri(condition) { ... }";
        } else if (sourceLine.contains("eega") && !sourceLine.contains("(")) {
            return "eega statements need parentheses: eega(init; condition; update) { ... }";
        } else {
            return "Check your syntax and make sure all statements end with ';'";
        }
    }
}
