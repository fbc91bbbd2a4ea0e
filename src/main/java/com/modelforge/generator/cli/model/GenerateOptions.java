package com.modelforge.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

    @Option(names = { "--models", "-m" },
            description = "JSON file with the models: an array, or an object with \"models\" and optional \"options\"")
    private Path modelsFile;

    @Option(names = { "--options" }, description = "JSON file with generation options; overrides options in the models file")
    private Path optionsFile;

    @Option(names = { "--format" }, defaultValue = "zip", description = "Archive format: zip or tar (default: zip)")
    private String format;

    @Option(names = { "--template", "-t" }, defaultValue = "basic",
            description = "Packaging tier: basic, advanced or enterprise (default: basic)")
    private String template;

    @Option(names = { "--skip-tests" }, description = "Do not generate or package the test suite")
    private boolean skipTests;

    @Option(names = { "--skip-docs" }, description = "Do not generate or package API documentation")
    private boolean skipDocs;

    @Option(names = { "--project-name", "-n" },
            description = "Name of the generated project (defaults to generated-api-<timestamp>)")
    private String projectName;

    @Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
    private Path outputDir;

    @Option(names = { "--force", "-f" }, description = "Overwrite an existing archive or directory")
    private boolean force;

    @Option(names = { "--unpacked" }, description = "Write the project as a directory instead of an archive")
    private boolean unpacked;

    @Option(names = { "--list-export-options" }, description = "Print the available formats and tiers, then exit")
    private boolean listExportOptions;

}
