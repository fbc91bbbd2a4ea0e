package com.modelforge.generator.codegen.model.input;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RelationshipType {
    ONE_TO_ONE("oneToOne"),
    ONE_TO_MANY("oneToMany"),
    MANY_TO_MANY("manyToMany");

    private final String wireValue;

    RelationshipType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static RelationshipType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireValue.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown relationship type: " + value));
    }
}
