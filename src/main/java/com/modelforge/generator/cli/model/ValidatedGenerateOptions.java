package com.modelforge.generator.cli.model;

import java.nio.file.Path;

import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.export.ArchiveFormat;
import com.modelforge.generator.export.ExportOptions;
import com.modelforge.generator.export.TemplateTier;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path modelsFile;
    Path optionsFile;
    Path normalizedOutputDir;
    ArchiveFormat format;
    TemplateTier template;
    boolean includeTests;
    boolean includeDocumentation;
    String projectName;
    boolean unpacked;
    boolean force;

    public ExportOptions toExportOptions() {
        return ExportOptions.builder()
                .format(format)
                .template(template)
                .includeTests(includeTests)
                .includeDocumentation(includeDocumentation)
                .build();
    }

    /**
     * Applies the skip flags on top of the options read from the input files.
     */
    public GenerationOptions applyTo(GenerationOptions options) {
        return options.toBuilder()
                .includeTests(options.isIncludeTests() && includeTests)
                .includeDocumentation(options.isIncludeDocumentation() && includeDocumentation)
                .build();
    }

    /**
     * Where the archive or directory for the given project name goes.
     */
    public Path targetFor(String name) {
        String fileName = unpacked ? name : name + format.getFileExtension();
        return normalizedOutputDir.resolve(fileName).normalize();
    }
}
