package com.github.tfilang.parser;

import java.util.Optional;

import com.github.tfilang.CompilationError;

/**
 * Semantic problems found by the {@link Validator}. {@code statement} is the
 * 1-based ordinal of the top-level statement the problem was found in.
 */
public sealed interface ValidationError extends CompilationError {

    int statement();

    @Override
    default String render() {
        var sb = new StringBuilder();
        sb.append("Validation Error at statement ").append(statement()).append('\n');
        sb.append("   ").append(message());
        suggestion().ifPresent(s -> sb.append('\n').append("   Suggestion: ").append(s));
        return sb.toString();
    }

    record EmptyPrintStatement(int statement) implements ValidationError {
        @Override
        public String message() {
            return "bahubali() requires at least one argument";
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of("bahubali(\"Hello, world!\");");
        }
    }

    record EmptyIdentifier(int statement, String keyword) implements ValidationError {
        @Override
        public String message() {
            return keyword + " declaration requires a valid identifier";
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of(keyword + " variable_name = value;");
        }
    }

    record EmptyBlock(int statement, String keyword) implements ValidationError {
        @Override
        public String message() {
            return keyword + " block cannot be empty";
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of(keyword + "(condition) { bahubali(\"action\"); }");
        }
    }

    record DuplicateVariable(int statement, String name, int originalStatement) implements ValidationError {
        @Override
        public String message() {
            return "Variable '" + name + "' is already declared at statement " + originalStatement;
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of("Use a different variable name or redeclare a 'rrr' variable with 'pushpa'");
        }
    }

    record UndefinedVariable(int statement, String name) implements ValidationError {
        @Override
        public String message() {
            return "Variable '" + name + "' is not defined";
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of("Declare the variable first with 'rrr " + name + " = value;' or 'pushpa " + name + " = value;'");
        }
    }

    record InvalidExpression(int statement, String detail) implements ValidationError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public Optional<String> suggestion() {
            return Optional.of("Combine values with one of + - * / > < >= <= == !=");
        }
    }
}
