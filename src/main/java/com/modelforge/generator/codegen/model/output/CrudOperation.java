package com.modelforge.generator.codegen.model.output;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The five operations every model is exposed through, in emission order.
 */
public enum CrudOperation {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LIST;

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase();
    }
}
