package com.modelforge.generator.codegen.model.input;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single declarative validation rule attached to a field.
 *
 * The value is either a number (bounds) or a string (pattern, custom expression).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ValidationRule {

    @NonNull
    ValidationRuleType type;

    @NonNull
    Object value;

    String message;

    /**
     * Numeric view of the value, or {@code null} when the value is not numeric.
     */
    public Number numericValue() {
        if (value instanceof Number number) {
            return number;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
