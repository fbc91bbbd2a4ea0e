package com.modelforge.generator.codegen.model.output;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.input.Model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one generation run produced.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedProject {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    List<Model> models;

    @NonNull
    List<Endpoint> endpoints;

    @NonNull
    AuthConfig authConfig;

    @NonNull
    List<GeneratedFile> files;

    /**
     * OpenAPI document describing the endpoints. Callers receive a copy.
     */
    @NonNull
    ObjectNode apiSpec;

    @NonNull
    GenerationOptions generationOptions;

    @NonNull
    Instant createdAt;

    @NonNull
    Instant updatedAt;

    public ObjectNode getApiSpec() {
        return apiSpec.deepCopy();
    }

    public Optional<GeneratedFile> findFile(String path) {
        return files.stream().filter(f -> f.getPath().equals(path)).findFirst();
    }
}
