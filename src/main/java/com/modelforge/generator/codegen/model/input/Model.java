package com.modelforge.generator.codegen.model.input;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A modeled entity: the unit the generator emits a full CRUD slice for.
 *
 * Created and edited by the model editor; read-only to the generation pipeline.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Model {

    /**
     * Entity name, expected PascalCase and unique across the model set.
     */
    String name;

    @Builder.Default
    List<Field> fields = List.of();

    /**
     * Relationships this model originates.
     */
    @Builder.Default
    List<Relationship> relationships = List.of();

    @Builder.Default
    ModelMetadata metadata = ModelMetadata.defaults();

    public List<Field> getFields() {
        return fields == null ? List.of() : fields;
    }

    public List<Relationship> getRelationships() {
        return relationships == null ? List.of() : relationships;
    }

    public ModelMetadata getMetadata() {
        return metadata == null ? ModelMetadata.defaults() : metadata;
    }

    public Optional<Field> findField(String fieldName) {
        return getFields().stream()
                .filter(f -> f.getName() != null && f.getName().equals(fieldName))
                .findFirst();
    }

    public boolean hasField(String fieldName) {
        return findField(fieldName).isPresent();
    }

    /**
     * Declared fields other than the identifier, which every emitted record carries on its own.
     */
    public List<Field> dataFields() {
        return getFields().stream()
                .filter(f -> f != null && !"id".equals(f.getName()))
                .toList();
    }
}
