package com.modelforge.generator.export;

import static org.assertj.core.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelforge.generator.TestModels;
import com.modelforge.generator.codegen.CodeGenerationService;
import com.modelforge.generator.codegen.exception.UnsupportedOptionException;
import com.modelforge.generator.codegen.model.core.context.AuthStrategy;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.GeneratedFileType;
import com.modelforge.generator.codegen.model.output.GeneratedProject;
import com.modelforge.generator.codegen.template.TemplateEngine;
import com.modelforge.generator.codegen.util.JsonSupport;

/**
 * Unit tests for ProjectExportService.
 */
class ProjectExportServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private ProjectExportService exportService;
    private GeneratedProject project;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        exportService = new ProjectExportService(new ExportTemplateRenderer(), clock, () -> "package-1");
        project = new CodeGenerationService(new TemplateEngine(), clock, () -> "project-1")
                .generateProject(List.of(TestModels.user(), TestModels.post()), GenerationOptions.defaults());
    }

    @Test
    void testPackageCarriesAllFilesAndBasicTier() {
        ProjectPackage projectPackage = exportService.createProjectPackage(project);

        assertThat(projectPackage.getId()).isEqualTo("package-1");
        assertThat(projectPackage.getName()).isEqualTo(project.getName());
        assertThat(projectPackage.getCreatedAt()).isEqualTo(NOW);
        assertThat(projectPackage.getFiles()).hasSize(project.getFiles().size() + 3);
        assertThat(projectPackage.getFiles())
                .extracting(GeneratedFile::getPath)
                .contains(".gitignore", "Dockerfile", "docker-compose.yml")
                .doesNotContain(".github/workflows/ci.yml", "k8s/deployment.yml");
    }

    @Test
    void testTiersAreCumulative() {
        List<String> basic = exportService.createProjectPackage(project, options(TemplateTier.BASIC))
                .getFiles().stream().map(GeneratedFile::getPath).toList();
        List<String> advanced = exportService.createProjectPackage(project, options(TemplateTier.ADVANCED))
                .getFiles().stream().map(GeneratedFile::getPath).toList();
        List<String> enterprise = exportService.createProjectPackage(project, options(TemplateTier.ENTERPRISE))
                .getFiles().stream().map(GeneratedFile::getPath).toList();

        assertThat(advanced).containsAll(basic).contains(".github/workflows/ci.yml", ".eslintrc.js", ".prettierrc");
        assertThat(enterprise).containsAll(advanced)
                .contains("k8s/deployment.yml", "helm/Chart.yaml", "monitoring/prometheus.yml");
    }

    @Test
    void testExcludedCategoriesAreDropped() {
        ExportOptions options = ExportOptions.builder().includeTests(false).includeDocumentation(false).build();

        ProjectPackage projectPackage = exportService.createProjectPackage(project, options);

        assertThat(projectPackage.getFiles())
                .noneMatch(f -> f.getType() == GeneratedFileType.TEST)
                .noneMatch(f -> f.getType() == GeneratedFileType.DOCUMENTATION);
        assertThat(projectPackage.getSetupInstructions())
                .doesNotContain("npm test")
                .doesNotContain("docs/openapi.json");
        assertThat(projectPackage.getMetadata().getFeatures())
                .doesNotContain("Test suite", "OpenAPI documentation");
    }

    @Test
    void testMetadataFromProjectAndManifest() {
        ProjectMetadata metadata = exportService.createProjectPackage(project, options(TemplateTier.ENTERPRISE))
                .getMetadata();

        assertThat(metadata.getName()).isEqualTo(project.getName());
        assertThat(metadata.getVersion()).isEqualTo("1.0.0");
        assertThat(metadata.getDescription()).isEqualTo("Generated API project with 2 models and 12 endpoints");
        assertThat(metadata.getFramework()).isEqualTo("express");
        assertThat(metadata.getDatabase()).isEqualTo("postgresql");
        assertThat(metadata.getAuthentication()).isEqualTo("jwt");
        assertThat(metadata.getTemplate()).isEqualTo("enterprise");
        assertThat(metadata.getDependencies()).containsKeys("express", "pg", "jsonwebtoken");
        assertThat(metadata.getDevDependencies()).containsKeys("typescript", "jest");
        assertThat(metadata.getScripts()).containsEntry("build", "tsc");
        assertThat(metadata.getFeatures())
                .contains("Test suite", "OpenAPI documentation", "2 data models", "12 API endpoints",
                        "Docker support", "CI pipeline", "Kubernetes deployment", "Helm chart");
    }

    @Test
    void testMissingManifestLeavesDependenciesEmpty() {
        GeneratedProject withoutManifest = project.toBuilder()
                .files(project.getFiles().stream().filter(f -> !f.getPath().equals("package.json")).toList())
                .build();

        ProjectMetadata metadata = exportService.createProjectPackage(withoutManifest).getMetadata();

        assertThat(metadata.getDependencies()).isEmpty();
        assertThat(metadata.getDevDependencies()).isEmpty();
        assertThat(metadata.getScripts()).isEmpty();
    }

    @Test
    void testUnparseableManifestLeavesDependenciesEmpty() {
        GeneratedProject broken = project.toBuilder()
                .files(project.getFiles().stream()
                        .map(f -> f.getPath().equals("package.json") ? f.toBuilder().contents("{ nope").build() : f)
                        .toList())
                .build();

        ProjectMetadata metadata = exportService.createProjectPackage(broken).getMetadata();

        assertThat(metadata.getDependencies()).isEmpty();
        assertThat(metadata.getName()).isEqualTo(project.getName());
    }

    @Test
    void testSetupGuideListsSchemasAndEndpoints() {
        String setup = exportService.createProjectPackage(project).getSetupInstructions();

        assertThat(setup)
                .startsWith("# " + project.getName() + " - Setup Instructions")
                .contains("psql -d your_database_name -f src/schemas/user.sql")
                .contains("psql -d your_database_name -f src/schemas/post.sql")
                .contains("- `POST /auth/login` - User login")
                .contains("- **User**: `POST /user`, `GET /user/:id`")
                .contains("JWT_SECRET")
                .contains("npm test");
    }

    @Test
    void testSetupGuideForMongoWithoutAuth() {
        GeneratedProject mongo = new CodeGenerationService().generateProject(List.of(TestModels.post()),
                GenerationOptions.builder()
                        .database(DatabaseEngine.MONGODB)
                        .authentication(AuthStrategy.NONE)
                        .build());

        String setup = exportService.createProjectPackage(mongo).getSetupInstructions();

        assertThat(setup)
                .contains("no schema files are needed")
                .doesNotContain("psql")
                .doesNotContain("JWT_SECRET")
                .doesNotContain("Authentication Endpoints");
    }

    @Test
    void testZipArchive() throws IOException {
        ProjectPackage projectPackage = exportService.createProjectPackage(project);

        byte[] zip = exportService.createZipArchive(projectPackage);

        assertThat(zip).startsWith((byte) 0x50, (byte) 0x4B, (byte) 0x03, (byte) 0x04);
        Map<String, String> entries = readZip(zip);
        assertThat(entries.keySet()).startsWith(ProjectExportService.METADATA_ENTRY, ProjectExportService.SETUP_ENTRY);
        assertThat(entries).hasSize(projectPackage.getFiles().size() + 2);
        assertThat(entries.get(ProjectExportService.SETUP_ENTRY)).isEqualTo(projectPackage.getSetupInstructions());
        assertThat(entries.get("src/models/User.ts"))
                .isEqualTo(projectPackage.findFile("src/models/User.ts").orElseThrow().getContents());
    }

    @Test
    void testTarArchive() throws IOException {
        ProjectPackage projectPackage = exportService.createProjectPackage(project);

        byte[] tar = exportService.createTarArchive(projectPackage);

        assertThat(tar[0]).isEqualTo((byte) 0x1f);
        assertThat(tar[1]).isEqualTo((byte) 0x8b);
        Map<String, String> entries = readTar(tar);
        assertThat(entries.keySet()).containsExactlyElementsOf(readZip(exportService.createZipArchive(projectPackage))
                .keySet());
        JsonNode metadata = JsonSupport.parse(entries.get(ProjectExportService.METADATA_ENTRY));
        assertThat(metadata.get("name").asText()).isEqualTo(project.getName());
        assertThat(metadata.fieldNames().next()).isEqualTo("name");
    }

    @Test
    void testArchivesAreReproducible() {
        ProjectPackage projectPackage = exportService.createProjectPackage(project);

        assertThat(exportService.createZipArchive(projectPackage))
                .isEqualTo(exportService.createZipArchive(projectPackage));
        assertThat(exportService.createTarArchive(projectPackage))
                .isEqualTo(exportService.createTarArchive(projectPackage));
    }

    @Test
    void testFileNamesAndMediaTypes() {
        ProjectPackage projectPackage = exportService.createProjectPackage(project);

        assertThat(exportService.archiveFileName(projectPackage, ArchiveFormat.ZIP))
                .isEqualTo(project.getName() + ".zip");
        assertThat(exportService.archiveFileName(projectPackage, ArchiveFormat.TAR))
                .isEqualTo(project.getName() + ".tar.gz");
        assertThat(exportService.mediaType(ArchiveFormat.ZIP)).isEqualTo("application/zip");
        assertThat(exportService.mediaType(ArchiveFormat.TAR)).isEqualTo("application/gzip");
    }

    @Test
    void testExportMetadata() {
        ExportMetadata metadata = exportService.getExportMetadata();

        assertThat(metadata.getFormats()).extracting(ExportMetadata.FormatInfo::value).containsExactly("zip", "tar");
        assertThat(metadata.getTemplates()).extracting(ExportMetadata.TierInfo::value)
                .containsExactly("basic", "advanced", "enterprise");
        assertThat(metadata.getTemplates().get(0).files()).hasSize(3);
        assertThat(metadata.getTemplates().get(2).files()).hasSize(9);
        assertThat(metadata.getDefaultOptions()).isEqualTo(ExportOptions.defaults());
    }

    @Test
    void testTierFilesRenderDatabaseAndAuth() {
        ProjectPackage projectPackage = exportService.createProjectPackage(project, options(TemplateTier.ENTERPRISE));

        assertThat(projectPackage.findFile("docker-compose.yml").orElseThrow().getContents())
                .contains("image: postgres:15")
                .contains("DATABASE_URL=${DATABASE_URL:-postgresql://postgres:password@db:5432/api_db}")
                .contains("JWT_SECRET=${JWT_SECRET}");
        assertThat(projectPackage.findFile(".github/workflows/ci.yml").orElseThrow().getContents())
                .contains("${{ matrix.node-version }}")
                .contains("npm test");
        assertThat(projectPackage.findFile("k8s/deployment.yml").orElseThrow().getContents())
                .contains("name: " + TierFileGenerator.appName(project.getName()));
    }

    @Test
    void testAppNameIsDnsLabel() {
        assertThat(TierFileGenerator.appName("My_Project  API")).isEqualTo("my-project-api");
        assertThat(TierFileGenerator.appName("___")).isEqualTo("generated-api");
        assertThat(TierFileGenerator.appName("a".repeat(80))).hasSize(50);
    }

    @Test
    void testUnknownOptionValuesRejected() {
        assertThat(ArchiveFormat.fromValue("TAR")).isEqualTo(ArchiveFormat.TAR);
        assertThatThrownBy(() -> ArchiveFormat.fromValue("rar"))
                .isInstanceOf(UnsupportedOptionException.class)
                .hasMessageContaining("rar");
        assertThatThrownBy(() -> TemplateTier.fromValue("platinum"))
                .isInstanceOf(UnsupportedOptionException.class);
    }

    @Test
    void testExportOptionsFromJson() throws IOException {
        ExportOptions options = JsonSupport.mapper().readValue(
                "{\"format\":\"tar\",\"template\":\"advanced\",\"includeTests\":false}", ExportOptions.class);

        assertThat(options.getFormat()).isEqualTo(ArchiveFormat.TAR);
        assertThat(options.getTemplate()).isEqualTo(TemplateTier.ADVANCED);
        assertThat(options.isIncludeTests()).isFalse();
        assertThat(options.isIncludeDocumentation()).isTrue();
    }

    private static ExportOptions options(TemplateTier tier) {
        return ExportOptions.builder().template(tier).build();
    }

    private static Map<String, String> readZip(byte[] bytes) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }

    private static Map<String, String> readTar(byte[] bytes) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (TarArchiveInputStream tar = new TarArchiveInputStream(
                new GzipCompressorInputStream(new ByteArrayInputStream(bytes)))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextTarEntry()) != null) {
                entries.put(entry.getName(), new String(tar.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }
}
