package com.modelforge.generator.codegen.validation;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Aggregated outcome of validating a model set.
 *
 * Only {@link #getErrors()} decides {@link #isValid()}; warnings and circular references never block generation.
 */
@Value
@Builder
public class ValidationResult {

    @NonNull
    List<ValidationIssue> errors;

    @NonNull
    List<ValidationIssue> warnings;

    /**
     * Cycles in the model graph, rendered as {@code "A -> B -> A"}.
     */
    @NonNull
    List<String> circularReferences;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
