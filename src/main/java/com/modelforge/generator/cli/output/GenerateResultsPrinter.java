package com.modelforge.generator.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelforge.generator.cli.input.ModelInput;
import com.modelforge.generator.cli.model.ValidatedGenerateOptions;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.output.GeneratedFileType;
import com.modelforge.generator.codegen.validation.ValidationIssue;
import com.modelforge.generator.export.ExportMetadata;
import com.modelforge.generator.pipeline.ExportResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(ValidatedGenerateOptions v, ModelInput input) {
        GenerationOptions options = v.applyTo(input.getOptions());
        log.info("=================================================");
        log.info("ModelForge Backend Generator");
        log.info("=================================================");
        log.info("Models File: {}", v.getModelsFile().toAbsolutePath());
        log.info("Options File: {}", v.getOptionsFile() != null ? v.getOptionsFile().toAbsolutePath() : "None");
        log.info("Models: {}", input.getModels().size());
        log.info("Framework: {}", options.getFramework().getWireValue());
        log.info("Database: {}", options.getDatabase().getWireValue());
        log.info("Authentication: {}", options.getAuthentication().getWireValue());
        log.info("Language: {}", options.getLanguage().getWireValue());
        log.info("Include Tests: {}", options.isIncludeTests());
        log.info("Include Documentation: {}", options.isIncludeDocumentation());
        log.info("Template: {}", v.getTemplate().getWireValue());
        log.info("Output: {}", v.isUnpacked() ? "directory" : v.getFormat().getWireValue() + " archive");
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(ExportResult result, Path target) {
        long testFiles = result.getProjectPackage().getFiles().stream()
                .filter(f -> f.getType() == GeneratedFileType.TEST)
                .count();

        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", target);
        log.info("Project Name: {}", result.getProject().getName());
        log.info("Models: {}", result.getProject().getModels().size());
        log.info("Endpoints: {}", result.getProject().getEndpoints().size());
        log.info("Files Packaged: {}", result.getProjectPackage().getFiles().size());
        log.info("Test Files: {}", testFiles);
        log.info("Archive Size: {} bytes", result.getBytes().length);

        List<ValidationIssue> warnings = result.getValidation().getWarnings();
        if (!warnings.isEmpty()) {
            log.info("");
            log.info("Model Warnings:");
            warnings.forEach(w -> log.info("  {}: {}", w.getField(), w.getMessage()));
        }
        if (!result.getValidation().getCircularReferences().isEmpty()) {
            log.info("");
            log.info("Circular References:");
            result.getValidation().getCircularReferences().forEach(c -> log.info("  {}", c));
        }

        log.info("");
        log.info("=================================================");
        log.info("NEXT STEPS");
        log.info("=================================================");
        log.info("1. Unpack the project and follow SETUP.md:");
        log.info("   npm install");
        log.info("   cp .env.example .env");
        log.info("");
        log.info("2. Run the application:");
        log.info("   npm run dev");
        log.info("");
        log.info("3. Check the service:");
        log.info("   curl http://localhost:3000/health");
        log.info("=================================================");
    }

    public void printValidationFailure(List<ValidationIssue> errors) {
        log.error("Model validation failed with {} error(s):", errors.size());
        errors.forEach(e -> log.error("  {}: {} [{}]", e.getField(), e.getMessage(), e.getCode()));
    }

    public void printOptionErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  {}", e));
    }

    public void printExportOptions(ExportMetadata metadata) {
        log.info("Formats:");
        metadata.getFormats().forEach(f ->
                log.info("  {} ({}): {} [{}]", f.value(), f.extension(), f.description(), f.mediaType()));
        log.info("Templates:");
        metadata.getTemplates().forEach(t -> {
            log.info("  {}: {}", t.value(), t.description());
            t.files().forEach(path -> log.info("    {}", path));
        });
        log.info("Defaults: format={}, template={}, includeTests={}, includeDocumentation={}",
                metadata.getDefaultOptions().getFormat().getWireValue(),
                metadata.getDefaultOptions().getTemplate().getWireValue(),
                metadata.getDefaultOptions().isIncludeTests(),
                metadata.getDefaultOptions().isIncludeDocumentation());
    }
}
