package com.github.tfilang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Accessors(fluent = true)
@Getter
@ToString
public class CompilationResult {
    private final String generatedText;
    private final int statementCount;
    @Getter(AccessLevel.NONE)
    private final List<String> warnings = new ArrayList<>();

    public CompilationResult(String generatedText, int statementCount) {
        this.generatedText = generatedText;
        this.statementCount = statementCount;
    }

    CompilationResult withGeneratedText(String text) {
        var result = new CompilationResult(text, statementCount);
        result.warnings.addAll(warnings);
        return result;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int warningCount() {
        return warnings.size();
    }
}
