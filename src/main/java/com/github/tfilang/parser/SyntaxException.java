package com.github.tfilang.parser;

import lombok.Getter;
import lombok.experimental.Accessors;

public class SyntaxException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final SyntaxError error;

    public SyntaxException(SyntaxError error) {
        super(error.message() + " at line " + error.line() + ", column " + error.column());
        this.error = error;
    }
}
