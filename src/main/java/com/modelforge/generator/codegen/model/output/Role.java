package com.modelforge.generator.codegen.model.output;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Role {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    List<String> permissions = List.of();

    String description;
}
