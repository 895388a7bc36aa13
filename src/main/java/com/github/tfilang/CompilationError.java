package com.github.tfilang;

import java.util.Optional;

/**
 * Structured failure of one compilation stage.
 */
public interface CompilationError {

    String message();

    Optional<String> suggestion();

    /**
     * Human readable, possibly multi-line, rendering including position and
     * suggestion where the error has them.
     */
    String render();
}
