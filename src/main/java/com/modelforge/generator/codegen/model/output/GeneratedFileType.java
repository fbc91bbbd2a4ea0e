package com.modelforge.generator.codegen.model.output;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * High-level file categories for generated artifacts.
 */
public enum GeneratedFileType {
    SOURCE,
    CONFIG,
    DOCUMENTATION,
    TEST;

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase();
    }
}
