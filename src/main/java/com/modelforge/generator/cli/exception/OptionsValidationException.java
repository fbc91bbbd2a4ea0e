package com.modelforge.generator.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Raised when the generate command line is rejected. Carries every problem found,
 * not just the first one, so the printer can list them together.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid generate options (%d): %s".formatted(errors.size(), String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public OptionsValidationException(String error) {
        this(List.of(error));
    }
}
