package com.modelforge.generator.codegen.model.output;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Derived description of one HTTP operation of the generated service, used for docs and setup guides.
 */
@Value
@Builder(toBuilder = true)
public class Endpoint {

    @NonNull
    String id;

    @NonNull
    String path;

    @NonNull
    HttpMethod method;

    @NonNull
    String modelName;

    @NonNull
    CrudOperation operation;

    boolean authenticated;

    @NonNull
    @Builder.Default
    List<String> roles = List.of();

    String description;
}
