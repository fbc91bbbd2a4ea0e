package com.modelforge.generator.codegen.validation;

import lombok.NonNull;
import lombok.Value;

/**
 * One validation finding: the locating path of the offending attribute, a readable message and a stable code.
 */
@Value
public class ValidationIssue {

    @NonNull
    String field;

    @NonNull
    String message;

    @NonNull
    String code;

    public ValidationIssue prefixed(String prefix) {
        return new ValidationIssue(prefix + "." + field, message, code);
    }
}
