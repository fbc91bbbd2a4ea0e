package com.modelforge.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-model generation hints.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelMetadata {

    /**
     * Overrides the derived table name (pluralized snake_case model name).
     */
    String tableName;

    @Builder.Default
    boolean timestamps = true;

    boolean softDelete;

    String description;

    /**
     * Whether mutating endpoints sit behind authentication.
     */
    @Builder.Default
    boolean requiresAuth = true;

    @Builder.Default
    List<String> allowedRoles = List.of();

    public List<String> getAllowedRoles() {
        return allowedRoles == null ? List.of() : allowedRoles;
    }

    public static ModelMetadata defaults() {
        return ModelMetadata.builder().build();
    }
}
