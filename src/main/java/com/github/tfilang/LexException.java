package com.github.tfilang;

import lombok.Getter;
import lombok.experimental.Accessors;

public class LexException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final LexError error;

    public LexException(LexError error) {
        super(error.message());
        this.error = error;
    }
}
