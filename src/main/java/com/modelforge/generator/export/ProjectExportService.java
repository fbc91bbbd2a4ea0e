package com.modelforge.generator.export;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedFileType;
import com.modelforge.generator.codegen.model.output.GeneratedProject;
import com.modelforge.generator.codegen.util.JsonSupport;
import com.modelforge.generator.export.archive.ArchiveEntry;
import com.modelforge.generator.export.archive.ArchiveWriter;
import com.modelforge.generator.export.archive.TarGzArchiveWriter;
import com.modelforge.generator.export.archive.ZipArchiveWriter;

/**
 * Packages a generated project for download: filters files per export options, adds tier files, derives the
 * metadata and setup guide, and writes zip or gzip-compressed tar archives.
 *
 * Every archive holds {@code project.json} and {@code SETUP.md} followed by the package files at their declared
 * paths.
 */
public class ProjectExportService {

    private static final Logger log = LoggerFactory.getLogger(ProjectExportService.class);

    public static final String METADATA_ENTRY = "project.json";
    public static final String SETUP_ENTRY = "SETUP.md";

    static final String PROJECT_VERSION = "1.0.0";

    private final TierFileGenerator tierFileGenerator;
    private final SetupGuideGenerator setupGuideGenerator;
    private final Map<ArchiveFormat, ArchiveWriter> writers;
    private final Clock clock;
    private final Supplier<String> idSupplier;

    public ProjectExportService() {
        this(new ExportTemplateRenderer(), Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public ProjectExportService(ExportTemplateRenderer renderer, Clock clock, Supplier<String> idSupplier) {
        this.tierFileGenerator = new TierFileGenerator(renderer);
        this.setupGuideGenerator = new SetupGuideGenerator(renderer);
        this.writers = Map.of(
                ArchiveFormat.ZIP, new ZipArchiveWriter(),
                ArchiveFormat.TAR, new TarGzArchiveWriter());
        this.clock = clock;
        this.idSupplier = idSupplier;
    }

    public ProjectPackage createProjectPackage(GeneratedProject project) {
        return createProjectPackage(project, ExportOptions.defaults());
    }

    public ProjectPackage createProjectPackage(GeneratedProject project, ExportOptions exportOptions) {
        ExportOptions options = exportOptions == null ? ExportOptions.defaults() : exportOptions;
        log.info("Packaging project {} (template {}, format {})", project.getName(),
                options.getTemplate().getWireValue(), options.getFormat().getWireValue());

        List<GeneratedFile> files = new ArrayList<>();
        for (GeneratedFile file : project.getFiles()) {
            if (!options.isIncludeTests() && file.getType() == GeneratedFileType.TEST) {
                continue;
            }
            if (!options.isIncludeDocumentation() && file.getType() == GeneratedFileType.DOCUMENTATION) {
                continue;
            }
            files.add(file);
        }
        int dropped = project.getFiles().size() - files.size();
        if (dropped > 0) {
            log.debug("Excluded {} file(s) per export options", dropped);
        }

        String setupInstructions = setupGuideGenerator.generate(project, files);
        files.addAll(tierFileGenerator.generate(project, options.getTemplate()));

        ProjectPackage projectPackage = ProjectPackage.builder()
                .id(idSupplier.get())
                .name(project.getName())
                .files(List.copyOf(files))
                .metadata(buildMetadata(project, files, options))
                .setupInstructions(setupInstructions)
                .exportOptions(options)
                .createdAt(clock.instant())
                .build();
        log.info("Packaged {} file(s)", projectPackage.getFiles().size());
        return projectPackage;
    }

    public byte[] createArchive(ProjectPackage projectPackage, ArchiveFormat format) {
        List<ArchiveEntry> entries = new ArrayList<>();
        entries.add(ArchiveEntry.of(METADATA_ENTRY, metadataJson(projectPackage.getMetadata())));
        entries.add(ArchiveEntry.of(SETUP_ENTRY, projectPackage.getSetupInstructions()));
        for (GeneratedFile file : projectPackage.getFiles()) {
            entries.add(ArchiveEntry.of(file.getPath(), file.getContents()));
        }
        byte[] bytes = writers.get(format).write(entries, projectPackage.getCreatedAt());
        log.info("Wrote {} archive with {} entries ({} bytes)", format.getWireValue(), entries.size(),
                bytes.length);
        return bytes;
    }

    public byte[] createZipArchive(ProjectPackage projectPackage) {
        return createArchive(projectPackage, ArchiveFormat.ZIP);
    }

    public byte[] createTarArchive(ProjectPackage projectPackage) {
        return createArchive(projectPackage, ArchiveFormat.TAR);
    }

    public String archiveFileName(ProjectPackage projectPackage, ArchiveFormat format) {
        return projectPackage.getName() + format.getFileExtension();
    }

    public String mediaType(ArchiveFormat format) {
        return format.getMediaType();
    }

    public ExportMetadata getExportMetadata() {
        return ExportMetadata.builder()
                .formats(Arrays.stream(ArchiveFormat.values())
                        .map(f -> new ExportMetadata.FormatInfo(f.getWireValue(), f.getLabel(), f.getDescription(),
                                f.getFileExtension(), f.getMediaType()))
                        .toList())
                .templates(Arrays.stream(TemplateTier.values())
                        .map(t -> new ExportMetadata.TierInfo(t.getWireValue(), t.getLabel(), t.getDescription(),
                                tierFileGenerator.pathsFor(t)))
                        .toList())
                .defaultOptions(ExportOptions.defaults())
                .build();
    }

    public static String metadataJson(ProjectMetadata metadata) {
        return JsonSupport.print(JsonSupport.mapper().valueToTree(metadata)) + "\n";
    }

    ProjectMetadata buildMetadata(GeneratedProject project, List<GeneratedFile> files, ExportOptions options) {
        GenerationOptions generation = project.getGenerationOptions();
        ProjectMetadata.ProjectMetadataBuilder metadata = ProjectMetadata.builder()
                .name(project.getName())
                .version(PROJECT_VERSION)
                .description("Generated API project with %d models and %d endpoints"
                        .formatted(project.getModels().size(), project.getEndpoints().size()))
                .framework(generation.getFramework().getWireValue())
                .database(generation.getDatabase().getWireValue())
                .authentication(generation.getAuthentication().getWireValue())
                .language(generation.getLanguage().getWireValue())
                .template(options.getTemplate().getWireValue())
                .features(features(project, files, options));

        Optional<JsonNode> manifest = readManifest(project);
        manifest.ifPresent(root -> metadata
                .dependencies(stringMap(root.get("dependencies")))
                .devDependencies(stringMap(root.get("devDependencies")))
                .scripts(stringMap(root.get("scripts"))));
        return metadata.build();
    }

    private static List<String> features(GeneratedProject project, List<GeneratedFile> files,
                                         ExportOptions options) {
        GenerationOptions generation = project.getGenerationOptions();
        List<String> features = new ArrayList<>();
        features.add(generation.getFramework().getWireValue() + " framework");
        features.add(generation.getDatabase().getWireValue() + " database");
        features.add(generation.getAuthentication().getWireValue() + " authentication");
        features.add("RESTful API endpoints");
        features.add("Input validation");
        features.add("Error handling");
        if (files.stream().anyMatch(f -> f.getType() == GeneratedFileType.TEST)) {
            features.add("Test suite");
        }
        if (files.stream().anyMatch(f -> f.getPath().equals("docs/openapi.json"))) {
            features.add("OpenAPI documentation");
        }
        if (!project.getModels().isEmpty()) {
            features.add(project.getModels().size() + " data models");
        }
        if (!project.getEndpoints().isEmpty()) {
            features.add(project.getEndpoints().size() + " API endpoints");
        }
        TemplateTier tier = options.getTemplate();
        features.add("Docker support");
        if (tier.includes(TemplateTier.ADVANCED)) {
            features.add("CI pipeline");
            features.add("Linting and formatting");
        }
        if (tier.includes(TemplateTier.ENTERPRISE)) {
            features.add("Kubernetes deployment");
            features.add("Helm chart");
            features.add("Prometheus monitoring");
        }
        return features;
    }

    private static Optional<JsonNode> readManifest(GeneratedProject project) {
        Optional<GeneratedFile> packageJson = project.findFile("package.json");
        if (packageJson.isEmpty()) {
            log.debug("No package.json in project {}, metadata has no dependencies", project.getName());
            return Optional.empty();
        }
        try {
            JsonNode root = JsonSupport.parse(packageJson.get().getContents());
            return root != null && root.isObject() ? Optional.of(root) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse package.json for metadata: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
        }
        return values;
    }
}
