package com.modelforge.generator.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelforge.generator.cli.exception.OptionsValidationException;
import com.modelforge.generator.cli.input.ModelInput;
import com.modelforge.generator.cli.input.ModelInputReader;
import com.modelforge.generator.cli.model.GenerateOptions;
import com.modelforge.generator.cli.model.ValidatedGenerateOptions;
import com.modelforge.generator.cli.output.GenerateResultsPrinter;
import com.modelforge.generator.cli.validation.GenerateOptionsValidator;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;
import com.modelforge.generator.codegen.util.FileWriteUtil;
import com.modelforge.generator.codegen.validation.ModelValidationException;
import com.modelforge.generator.export.ProjectExportService;
import com.modelforge.generator.export.ProjectPackage;
import com.modelforge.generator.pipeline.ExportResult;
import com.modelforge.generator.pipeline.ProjectExportPipeline;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that turns a models file into a packaged backend project.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "modelforge-generator 1.0.0",
        description = "Generates an Express + TypeScript REST backend from a JSON model definition and packages it as an archive."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator;
    private final ModelInputReader inputReader;
    private final ProjectExportPipeline pipeline;
    private final ProjectExportService exportService;
    private final GenerateResultsPrinter printer;

    public GenerateCommand() {
        this(new ProjectExportPipeline(), new ProjectExportService());
    }

    public GenerateCommand(ProjectExportPipeline pipeline, ProjectExportService exportService) {
        this.validator = new GenerateOptionsValidator();
        this.inputReader = new ModelInputReader();
        this.pipeline = pipeline;
        this.exportService = exportService;
        this.printer = new GenerateResultsPrinter();
    }

    @Override
    public Integer call() {
        if (options.isListExportOptions()) {
            printer.printExportOptions(exportService.getExportMetadata());
            return 0;
        }

        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            ModelInput input = inputReader.read(validated.getModelsFile(), validated.getOptionsFile());
            printer.printBanner(validated, input);

            ExportResult result = pipeline.export(input.getModels(), validated.applyTo(input.getOptions()),
                    validated.toExportOptions(), validated.getProjectName());

            String name = result.getProject().getName();
            validator.checkTarget(validated, name);
            Path target = validated.targetFor(name);
            if (validated.isUnpacked()) {
                writeDirectory(target, result.getProjectPackage());
            } else {
                FileWriteUtil.writeBytes(target, result.getBytes());
            }

            printer.printSuccess(result, target);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printOptionErrors(e.getErrors());
            return 1;
        } catch (ModelValidationException e) {
            printer.printValidationFailure(e.getErrors());
            return 1;
        } catch (UnsupportedOptionException e) {
            log.error("Generation failed: {}", e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot read input or write output: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    private void writeDirectory(Path target, ProjectPackage projectPackage) throws IOException {
        if (Files.exists(target)) {
            log.warn("Force mode enabled, will overwrite: {}", target);
            FileWriteUtil.deleteTree(target);
        }
        FileWriteUtil.writeTree(target, projectPackage.getFiles());
        FileWriteUtil.writeText(target.resolve(ProjectExportService.METADATA_ENTRY),
                ProjectExportService.metadataJson(projectPackage.getMetadata()));
        FileWriteUtil.writeText(target.resolve(ProjectExportService.SETUP_ENTRY),
                projectPackage.getSetupInstructions());
    }
}
