package com.github.tfilang;

import java.util.Optional;

public sealed interface LexError extends CompilationError {

    int offset();

    SourcePosition position();

    @Override
    default String render() {
        return position().render("Lex Error", message(), suggestion());
    }

    /**
     * {@code codePoint} is a full Unicode code point, so characters outside
     * the BMP are reported whole.
     */
    record UnexpectedCharacter(int codePoint, int offset, SourcePosition position) implements LexError {
        @Override
        public String message() {
            return "Unexpected character '" + Character.toString(codePoint) + "' at offset " + offset;
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of("Remove the character; only letters, digits, operators and punctuation like ( ) { } ; , are allowed");
        }
    }

    record UnterminatedString(int offset, SourcePosition position) implements LexError {
        @Override
        public String message() {
            return "Unterminated string literal starting at offset " + offset;
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of("Close the string with '\"' on the same line");
        }
    }

    record NumberOutOfRange(String image, int offset, SourcePosition position) implements LexError {
        @Override
        public String message() {
            return "Number " + image + " does not fit into a 32 bit integer";
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of("Use a number between 0 and " + Integer.MAX_VALUE);
        }
    }
}
