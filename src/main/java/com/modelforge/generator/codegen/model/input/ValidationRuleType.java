package com.modelforge.generator.codegen.model.input;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of declarative validation rules a field may carry.
 */
public enum ValidationRuleType {
    MIN_LENGTH("minLength"),
    MAX_LENGTH("maxLength"),
    MIN("min"),
    MAX("max"),
    PATTERN("pattern"),
    CUSTOM("custom");

    private final String wireValue;

    ValidationRuleType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ValidationRuleType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireValue.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown validation rule type: " + value));
    }
}
