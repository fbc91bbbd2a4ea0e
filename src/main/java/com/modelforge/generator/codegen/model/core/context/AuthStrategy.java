package com.modelforge.generator.codegen.model.core.context;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;

/**
 * Authentication strategy of the generated service.
 */
public enum AuthStrategy {
    NONE("none", true, false),
    JWT("jwt", true, true),
    OAUTH("oauth", false, false),
    SESSION("session", false, false);

    private final String wireValue;
    private final boolean emitterAvailable;
    private final boolean tokenBased;

    AuthStrategy(String wireValue, boolean emitterAvailable, boolean tokenBased) {
        this.wireValue = wireValue;
        this.emitterAvailable = emitterAvailable;
        this.tokenBased = tokenBased;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isEmitterAvailable() {
        return emitterAvailable;
    }

    /**
     * Token-based strategies need a signing secret in every environment.
     */
    public boolean isTokenBased() {
        return tokenBased;
    }

    public boolean isEnabled() {
        return this != NONE;
    }

    @JsonCreator
    public static AuthStrategy fromValue(String value) {
        return Arrays.stream(values())
                .filter(a -> a.wireValue.equalsIgnoreCase(value) || a.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOptionException("authentication", value,
                        "expected one of none, jwt, oauth, session"));
    }
}
