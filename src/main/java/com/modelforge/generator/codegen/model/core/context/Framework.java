package com.modelforge.generator.codegen.model.core.context;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;

/**
 * HTTP framework of the generated service.
 */
public enum Framework {
    EXPRESS("express", true),
    FASTIFY("fastify", false),
    KOA("koa", false);

    private final String wireValue;
    private final boolean emitterAvailable;

    Framework(String wireValue, boolean emitterAvailable) {
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
    public static Framework fromValue(String value) {
        return Arrays.stream(values())
                .filter(f -> f.wireValue.equalsIgnoreCase(value) || f.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOptionException("framework", value,
                        "expected one of express, fastify, koa"));
    }
}
