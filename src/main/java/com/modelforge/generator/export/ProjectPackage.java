package com.modelforge.generator.export;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.modelforge.generator.codegen.model.output.GeneratedFile;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated project ready to be archived: filtered files plus tier files, metadata and setup guide.
 */
@Value
@Builder(toBuilder = true)
public class ProjectPackage {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    List<GeneratedFile> files;

    @NonNull
    ProjectMetadata metadata;

    @NonNull
    String setupInstructions;

    @NonNull
    ExportOptions exportOptions;

    @NonNull
    Instant createdAt;

    public Optional<GeneratedFile> findFile(String path) {
        return files.stream().filter(f -> f.getPath().equals(path)).findFirst();
    }
}
