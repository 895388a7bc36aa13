package com.github.tfilang;

import java.util.Optional;

/**
 * A node the generator has no template for. A validated tree never
 * produces one.
 */
public record GenerationError(String message, String node) implements CompilationError {

    @Override
    public Optional<String> suggestion() {
        return Optional.empty();
    }

    @Override
    public String render() {
        return "Generation Error\n   " + message + "\n   Context: " + node;
    }
}
