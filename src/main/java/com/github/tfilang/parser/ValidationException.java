package com.github.tfilang.parser;

import lombok.Getter;
import lombok.experimental.Accessors;

public class ValidationException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final ValidationError error;

    public ValidationException(ValidationError error) {
        super(error.message() + " (statement " + error.statement() + ")");
        this.error = error;
    }
}
