package com.modelforge.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.modelforge.generator.cli.exception.OptionsValidationException;
import com.modelforge.generator.cli.model.GenerateOptions;
import com.modelforge.generator.cli.model.ValidatedGenerateOptions;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;
import com.modelforge.generator.export.ArchiveFormat;
import com.modelforge.generator.export.TemplateTier;

public class GenerateOptionsValidator {

    private static final Pattern PROJECT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    public ValidatedGenerateOptions validate(GenerateOptions o) {
        List<String> errors = new ArrayList<>();

        if (o.getModelsFile() == null) {
            errors.add("A models file is required (--models / -m).");
        } else if (!Files.isRegularFile(o.getModelsFile())) {
            errors.add("Models file does not exist or is not a file: " + o.getModelsFile());
        }

        if (o.getOptionsFile() != null && !Files.isRegularFile(o.getOptionsFile())) {
            errors.add("Options file does not exist or is not a file: " + o.getOptionsFile());
        }

        ArchiveFormat format = null;
        try {
            format = ArchiveFormat.fromValue(o.getFormat());
        } catch (UnsupportedOptionException e) {
            errors.add("Unsupported --format '" + o.getFormat() + "'. Expected zip or tar.");
        }

        TemplateTier template = null;
        try {
            template = TemplateTier.fromValue(o.getTemplate());
        } catch (UnsupportedOptionException e) {
            errors.add("Unsupported --template '" + o.getTemplate() + "'. Expected basic, advanced or enterprise.");
        }

        String projectName = isBlank(o.getProjectName()) ? null : o.getProjectName().trim();
        if (projectName != null && !PROJECT_NAME.matcher(projectName).matches()) {
            errors.add("Project name may contain only letters, digits, '.', '_' and '-': " + projectName);
        }

        Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
                .normalize();
        if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
            errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        ValidatedGenerateOptions validated = new ValidatedGenerateOptions(o.getModelsFile(), o.getOptionsFile(),
                normalizedOutputDir, format, template, !o.isSkipTests(), !o.isSkipDocs(), projectName,
                o.isUnpacked(), o.isForce());

        // Generated names carry a timestamp, so only an explicit name can collide up front.
        if (projectName != null) {
            checkTarget(validated, projectName);
        }
        return validated;
    }

    /**
     * Fails when the target for {@code name} already exists and --force was not given.
     */
    public void checkTarget(ValidatedGenerateOptions v, String name) {
        Path target = v.targetFor(name);
        if (Files.exists(target) && !v.isForce()) {
            throw new OptionsValidationException("Output already exists: " + target + ". Use --force to overwrite.");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
