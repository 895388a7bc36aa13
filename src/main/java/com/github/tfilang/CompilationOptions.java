package com.github.tfilang;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Post-processing switches, all off by default. Minification wins over
 * formatting when both are set.
 */
@Accessors(fluent = true)
@Getter
@Setter
@ToString
public class CompilationOptions {
    private boolean formatOutput;
    private boolean addComments;
    private boolean minifyOutput;
    private boolean strictMode;

    public CompilationOptions withFormatting() {
        formatOutput = true;
        return this;
    }

    public CompilationOptions withComments() {
        addComments = true;
        return this;
    }

    public CompilationOptions withMinification() {
        minifyOutput = true;
        return this;
    }

    public CompilationOptions withStrictMode() {
        strictMode = true;
        return this;
    }

    public boolean isDefault() {
        return !formatOutput && !addComments && !minifyOutput && !strictMode;
    }
}
