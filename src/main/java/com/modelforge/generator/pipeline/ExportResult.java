package com.modelforge.generator.pipeline;

import com.modelforge.generator.codegen.model.output.GeneratedProject;
import com.modelforge.generator.codegen.validation.ValidationResult;
import com.modelforge.generator.export.ArchiveFormat;
import com.modelforge.generator.export.ProjectPackage;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one pipeline run produced: the archive plus the intermediate results it was built from.
 */
@Value
@Builder
public class ExportResult {

    @NonNull
    String fileName;

    @NonNull
    String mediaType;

    @NonNull
    ArchiveFormat format;

    @NonNull
    byte[] bytes;

    @NonNull
    GeneratedProject project;

    @NonNull
    ProjectPackage projectPackage;

    /**
     * Passing validation, possibly with warnings and reported cycles.
     */
    @NonNull
    ValidationResult validation;
}
