package com.modelforge.generator.codegen.validation;

/**
 * Stable codes reported with each {@link ValidationIssue}.
 */
public final class IssueCode {

    // Errors
    public static final String SCHEMA_VALIDATION_ERROR = "SCHEMA_VALIDATION_ERROR";
    public static final String DUPLICATE_MODEL_NAME = "DUPLICATE_MODEL_NAME";
    public static final String DUPLICATE_FIELD_NAME = "DUPLICATE_FIELD_NAME";
    public static final String TARGET_MODEL_NOT_FOUND = "TARGET_MODEL_NOT_FOUND";
    public static final String SOURCE_FIELD_NOT_FOUND = "SOURCE_FIELD_NOT_FOUND";
    public static final String TARGET_FIELD_NOT_FOUND = "TARGET_FIELD_NOT_FOUND";

    // Warnings
    public static final String NAMING_CONVENTION_WARNING = "NAMING_CONVENTION_WARNING";
    public static final String FIELD_NAMING_CONVENTION_WARNING = "FIELD_NAMING_CONVENTION_WARNING";
    public static final String NO_FIELDS_WARNING = "NO_FIELDS_WARNING";
    public static final String NO_PRIMARY_KEY_WARNING = "NO_PRIMARY_KEY_WARNING";
    public static final String SOURCE_MODEL_MISMATCH = "SOURCE_MODEL_MISMATCH";
    public static final String MISSING_EMAIL_VALIDATION = "MISSING_EMAIL_VALIDATION";
    public static final String MISSING_STRING_VALIDATION = "MISSING_STRING_VALIDATION";

    private IssueCode() {
        // Constants only
    }
}
