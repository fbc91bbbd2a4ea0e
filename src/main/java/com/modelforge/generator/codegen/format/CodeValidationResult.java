package com.modelforge.generator.codegen.format;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of the shallow syntax check of one generated file.
 */
@Value
public class CodeValidationResult {

    boolean valid;

    @NonNull
    List<String> errors;

    public static CodeValidationResult ok() {
        return new CodeValidationResult(true, List.of());
    }

    public static CodeValidationResult of(List<String> errors) {
        return new CodeValidationResult(errors.isEmpty(), List.copyOf(errors));
    }
}
