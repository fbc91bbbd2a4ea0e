package com.modelforge.generator.export;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Summary written to {@code project.json} at the root of every archive.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonPropertyOrder({"name", "version", "description", "framework", "database", "authentication", "language",
        "template", "features", "dependencies", "devDependencies", "scripts"})
public class ProjectMetadata {

    @NonNull
    String name;

    @NonNull
    String version;

    String description;

    String framework;

    String database;

    String authentication;

    String language;

    String template;

    @NonNull
    @Builder.Default
    List<String> features = List.of();

    @NonNull
    @Builder.Default
    Map<String, String> dependencies = Map.of();

    @NonNull
    @Builder.Default
    Map<String, String> devDependencies = Map.of();

    @NonNull
    @Builder.Default
    Map<String, String> scripts = Map.of();
}
