package com.modelforge.generator.codegen.model.input;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of a model field. The wire value is what the model editor sends.
 */
public enum FieldType {
    STRING("string"),
    TEXT("text"),
    NUMBER("number"),
    INTEGER("integer"),
    FLOAT("float"),
    DECIMAL("decimal"),
    BOOLEAN("boolean"),
    DATE("date"),
    EMAIL("email"),
    URL("url"),
    UUID("uuid"),
    JSON("json");

    private final String wireValue;

    FieldType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER || this == FLOAT || this == DECIMAL;
    }

    public boolean isTextual() {
        return this == STRING || this == TEXT || this == EMAIL || this == URL;
    }

    @JsonCreator
    public static FieldType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireValue.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + value));
    }
}
