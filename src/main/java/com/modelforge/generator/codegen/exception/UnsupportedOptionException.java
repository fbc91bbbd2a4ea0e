package com.modelforge.generator.codegen.exception;

/**
 * Raised when a generation or export option is missing, unknown, recognised
 * but without an emitter, or clashes with a model. Always raised before any
 * artifact is produced.
 */
public class UnsupportedOptionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String option;
    private final String value;

    public UnsupportedOptionException(String option, String value, String detail) {
        super("Unsupported " + option + " '" + value + "': " + detail);
        this.option = option;
        this.value = value;
    }

    public String getOption() {
        return option;
    }

    public String getValue() {
        return value;
    }
}
