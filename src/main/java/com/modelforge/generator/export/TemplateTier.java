package com.modelforge.generator.export;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;

/**
 * Packaging tier. Every tier contains all files of the tiers declared before it.
 */
public enum TemplateTier {
    BASIC("basic", "Basic", "Container definitions and ignore rules"),
    ADVANCED("advanced", "Advanced", "Basic plus CI pipeline, linting and formatting configuration"),
    ENTERPRISE("enterprise", "Enterprise", "Advanced plus Kubernetes, Helm and monitoring manifests");

    private final String wireValue;
    private final String label;
    private final String description;

    TemplateTier(String wireValue, String label, String description) {
        this.wireValue = wireValue;
        this.label = label;
        this.description = description;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public boolean includes(TemplateTier other) {
        return ordinal() >= other.ordinal();
    }

    @JsonCreator
    public static TemplateTier fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireValue.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOptionException("template", value,
                        "expected one of basic, advanced, enterprise"));
    }
}
