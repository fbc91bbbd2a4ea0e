package com.modelforge.generator.codegen.model.core.context;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;

public enum TargetLanguage {
    TYPESCRIPT("typescript", true),
    JAVASCRIPT("javascript", false);

    private final String wireValue;
    private final boolean emitterAvailable;

    TargetLanguage(String wireValue, boolean emitterAvailable) {
        this.wireValue = wireValue;
        this.emitterAvailable = emitterAvailable;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isEmitterAvailable() {
        return emitterAvailable;
    }

    @JsonCreator
    public static TargetLanguage fromValue(String value) {
        return Arrays.stream(values())
                .filter(l -> l.wireValue.equalsIgnoreCase(value) || l.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOptionException("language", value,
                        "expected one of typescript, javascript"));
    }
}
