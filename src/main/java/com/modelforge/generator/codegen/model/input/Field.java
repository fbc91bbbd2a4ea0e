package com.modelforge.generator.codegen.model.input;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Describes a single field on a modeled entity.
 *
 * Pure structure only (no validation / mapping logic).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Field {

    /**
     * Field name, expected camelCase and unique within its model.
     */
    String name;

    FieldType type;

    boolean required;

    boolean unique;

    /**
     * Literal default value (string, number or boolean), may be null.
     */
    Object defaultValue;

    /**
     * Ordered validation rules.
     */
    @Builder.Default
    List<ValidationRule> validation = List.of();

    String description;

    public List<ValidationRule> getValidation() {
        return validation == null ? List.of() : validation;
    }

    public Optional<ValidationRule> findRule(ValidationRuleType ruleType) {
        return getValidation().stream()
                .filter(r -> r.getType() == ruleType)
                .findFirst();
    }
}
