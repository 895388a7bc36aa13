package com.github.tfilang;

import lombok.Getter;
import lombok.experimental.Accessors;

public class GenerationException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final GenerationError error;

    public GenerationException(GenerationError error) {
        super(error.message() + ": " + error.node());
        this.error = error;
    }
}
