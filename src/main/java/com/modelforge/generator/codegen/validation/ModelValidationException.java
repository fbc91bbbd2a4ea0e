package com.modelforge.generator.codegen.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when generation is requested for a model set that failed validation.
 */
public class ModelValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<ValidationIssue> errors;

    public ModelValidationException(List<ValidationIssue> errors) {
        super("Model validation failed:" + System.lineSeparator() + errors.stream()
                .map(e -> "  " + e.getField() + ": " + e.getMessage() + " [" + e.getCode() + "]")
                .collect(Collectors.joining(System.lineSeparator())));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationIssue> getErrors() {
        return errors;
    }
}
