package com.github.tfilang;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * The first error any stage reported for a source. The message is the
 * rendered, multi-line form of {@link #error()}.
 */
public class CompilationException extends RuntimeException {

    @Accessors(fluent = true)
    @Getter
    private final CompilationError error;

    public CompilationException(CompilationError error, Throwable cause) {
        super(error.render(), cause);
        this.error = error;
    }
}
