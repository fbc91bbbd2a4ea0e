package com.modelforge.generator.export;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.modelforge.generator.codegen.generator.AuthGenerator;
import com.modelforge.generator.codegen.model.core.context.AuthStrategy;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedFileType;
import com.modelforge.generator.codegen.model.output.GeneratedProject;

/**
 * Generates {@code SETUP.md}: installation, environment, database and run steps plus one line per model listing
 * its endpoints.
 */
public class SetupGuideGenerator {

    static final String TEMPLATE = "setup.md.ftl";

    private static final Map<DatabaseEngine, String> DATABASE_LABELS = Map.of(
            DatabaseEngine.POSTGRESQL, "PostgreSQL",
            DatabaseEngine.MYSQL, "MySQL",
            DatabaseEngine.MONGODB, "MongoDB");

    private final ExportTemplateRenderer renderer;

    public SetupGuideGenerator(ExportTemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * @param files the files that end up in the package, after filtering
     */
    public String generate(GeneratedProject project, List<GeneratedFile> files) {
        GenerationOptions options = project.getGenerationOptions();

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("projectName", project.getName());
        model.put("database", options.getDatabase().getWireValue());
        model.put("databaseLabel", DATABASE_LABELS.get(options.getDatabase()));
        model.put("connectionFormat", options.getDatabase().getExampleConnectionString());
        model.put("jwt", options.getAuthentication() == AuthStrategy.JWT);
        model.put("schemaFiles", files.stream()
                .map(GeneratedFile::getPath)
                .filter(path -> path.endsWith(".sql"))
                .toList());
        model.put("documentation", hasFileOfType(files, GeneratedFileType.DOCUMENTATION, "docs/"));
        model.put("tests", hasFileOfType(files, GeneratedFileType.TEST, "src/tests/"));
        model.put("authEndpoints", project.getEndpoints().stream()
                .filter(e -> AuthGenerator.AUTH_MODEL_NAME.equals(e.getModelName()))
                .map(SetupGuideGenerator::endpointEntry)
                .toList());
        model.put("models", project.getModels().stream()
                .map(m -> modelEntry(m, project.getEndpoints()))
                .toList());
        return renderer.render(TEMPLATE, model);
    }

    private static boolean hasFileOfType(List<GeneratedFile> files, GeneratedFileType type, String prefix) {
        return files.stream().anyMatch(f -> f.getType() == type && f.getPath().startsWith(prefix));
    }

    private static Map<String, Object> endpointEntry(Endpoint endpoint) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("method", endpoint.getMethod().name());
        entry.put("path", endpoint.getPath());
        entry.put("description", endpoint.getDescription() == null ? "" : endpoint.getDescription());
        return entry;
    }

    private static Map<String, Object> modelEntry(Model model, List<Endpoint> endpoints) {
        String listing = endpoints.stream()
                .filter(e -> model.getName().equals(e.getModelName()))
                .map(e -> "`" + e.getMethod().name() + " " + e.getPath() + "`")
                .collect(Collectors.joining(", "));
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", model.getName());
        entry.put("endpoints", listing.isEmpty() ? "no endpoints" : listing);
        return entry;
    }
}
