package com.modelforge.generator.pipeline;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelforge.generator.codegen.CodeGenerationService;
import com.modelforge.generator.codegen.format.CodeFormatter;
import com.modelforge.generator.codegen.format.CodeValidationResult;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedProject;
import com.modelforge.generator.codegen.validation.ModelValidationException;
import com.modelforge.generator.codegen.validation.ModelValidationService;
import com.modelforge.generator.codegen.validation.ValidationResult;
import com.modelforge.generator.export.ExportOptions;
import com.modelforge.generator.export.ProjectExportService;
import com.modelforge.generator.export.ProjectPackage;

/**
 * Runs the whole chain for one request: validate, generate, format, package, archive.
 */
public class ProjectExportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ProjectExportPipeline.class);

    private final ModelValidationService validationService;
    private final CodeGenerationService generationService;
    private final CodeFormatter formatter;
    private final ProjectExportService exportService;

    public ProjectExportPipeline() {
        this(new ModelValidationService(), new CodeGenerationService(), new CodeFormatter(),
                new ProjectExportService());
    }

    public ProjectExportPipeline(ModelValidationService validationService,
                                 CodeGenerationService generationService,
                                 CodeFormatter formatter,
                                 ProjectExportService exportService) {
        this.validationService = validationService;
        this.generationService = generationService;
        this.formatter = formatter;
        this.exportService = exportService;
    }

    public ExportResult export(List<Model> models, GenerationOptions generationOptions,
                               ExportOptions exportOptions) {
        return export(models, generationOptions, exportOptions, null);
    }

    /**
     * @param projectName replaces the generated timestamped name when not null
     * @throws ModelValidationException when the models do not pass validation; nothing is generated then
     * @throws com.modelforge.generator.codegen.exception.UnsupportedOptionException for options without an emitter
     */
    public ExportResult export(List<Model> models, GenerationOptions generationOptions,
                               ExportOptions exportOptions, String projectName) {
        ExportOptions options = exportOptions == null ? ExportOptions.defaults() : exportOptions;

        ValidationResult validation = validationService.validate(models);
        if (!validation.isValid()) {
            throw new ModelValidationException(validation.getErrors());
        }
        if (!validation.getWarnings().isEmpty()) {
            log.info("Model validation passed with {} warning(s)", validation.getWarnings().size());
        }
        validation.getCircularReferences()
                .forEach(cycle -> log.info("Circular model reference: {}", cycle));

        GeneratedProject generated = generationService.generateProject(models, generationOptions);
        List<GeneratedFile> formatted = formatter.formatFiles(generated.getFiles());
        checkSyntax(formatted);
        GeneratedProject project = generated.toBuilder()
                .name(projectName == null ? generated.getName() : projectName)
                .files(formatted)
                .build();

        ProjectPackage projectPackage = exportService.createProjectPackage(project, options);
        byte[] bytes = exportService.createArchive(projectPackage, options.getFormat());

        return ExportResult.builder()
                .fileName(exportService.archiveFileName(projectPackage, options.getFormat()))
                .mediaType(exportService.mediaType(options.getFormat()))
                .format(options.getFormat())
                .bytes(bytes)
                .project(project)
                .projectPackage(projectPackage)
                .validation(validation)
                .build();
    }

    private void checkSyntax(List<GeneratedFile> files) {
        for (GeneratedFile file : files) {
            CodeValidationResult result = formatter.validateCode(file);
            if (!result.isValid()) {
                log.warn("Generated file {} failed the syntax check: {}", file.getPath(), result.getErrors());
            }
        }
    }
}
