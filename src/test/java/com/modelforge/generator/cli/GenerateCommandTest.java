package com.modelforge.generator.cli;

import static org.assertj.core.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelforge.generator.GeneratorApplication;
import com.modelforge.generator.codegen.util.JsonSupport;

/**
 * End-to-end tests for the generate command.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesZipArchive() throws Exception {
        int exitCode = execute("-m", resource("blog.json").toString(), "-o", tempDir.toString(), "-n", "blog");

        assertThat(exitCode).isZero();
        Path archive = tempDir.resolve("blog.zip");
        assertThat(archive).exists();

        List<String> names = zipEntryNames(Files.readAllBytes(archive));
        assertThat(names).startsWith("project.json", "SETUP.md")
                .contains("src/schemas/author.sql", "src/schemas/article.sql", "src/tests/ArticleController.test.ts",
                        "docker-compose.yml");
    }

    @Test
    void testUnpackedWithOptionsFileOverride() throws Exception {
        int exitCode = execute("-m", resource("blog.json").toString(), "--options", resource("options-none.json")
                .toString(), "-o", tempDir.toString(), "-n", "blog", "--unpacked", "--skip-tests", "-t", "advanced");

        assertThat(exitCode).isZero();
        Path root = tempDir.resolve("blog");
        assertThat(root.resolve("src/app.ts")).exists();
        assertThat(root.resolve(".github/workflows/ci.yml")).exists();
        assertThat(root.resolve("src/schemas/author.sql")).exists();
        assertThat(root.resolve("src/auth/AuthController.ts")).doesNotExist();
        assertThat(root.resolve("src/tests")).doesNotExist();

        JsonNode metadata = JsonSupport.parse(Files.readString(root.resolve("project.json")));
        assertThat(metadata.get("name").asText()).isEqualTo("blog");
        assertThat(metadata.get("database").asText()).isEqualTo("postgresql");
        assertThat(metadata.get("authentication").asText()).isEqualTo("none");
        assertThat(metadata.get("template").asText()).isEqualTo("advanced");
        assertThat(Files.readString(root.resolve("SETUP.md"))).startsWith("# blog - Setup Instructions");
    }

    @Test
    void testExistingOutputNeedsForce() throws Exception {
        Path existing = Files.writeString(tempDir.resolve("blog.tar.gz"), "old");
        String[] args = { "-m", resource("blog.json").toString(), "-o", tempDir.toString(), "-n", "blog",
                "--format", "tar" };

        assertThat(execute(args)).isEqualTo(1);
        assertThat(Files.readString(existing)).isEqualTo("old");

        String[] forced = new String[args.length + 1];
        System.arraycopy(args, 0, forced, 0, args.length);
        forced[args.length] = "--force";
        assertThat(execute(forced)).isZero();
        byte[] bytes = Files.readAllBytes(existing);
        assertThat(bytes[0]).isEqualTo((byte) 0x1f);
        assertThat(bytes[1]).isEqualTo((byte) 0x8b);
    }

    @Test
    void testInvalidModelsFail() throws Exception {
        int exitCode = execute("-m", resource("invalid.json").toString(), "-o", tempDir.toString(), "-n", "broken");

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("broken.zip")).doesNotExist();
    }

    @Test
    void testMalformedModelsFileFails() throws IOException {
        Path models = Files.writeString(tempDir.resolve("models.json"), "{ \"name\": \"NotAList\" }");

        assertThat(execute("-m", models.toString(), "-o", tempDir.toString())).isEqualTo(1);
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(models);
        }
    }

    @Test
    void testBadOptionsFail() throws IOException {
        assertThat(execute("-o", tempDir.toString(), "--format", "rar")).isEqualTo(1);
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void testListExportOptionsNeedsNoModels() {
        assertThat(execute("--list-export-options")).isZero();
    }

    private static int execute(String... args) {
        return GeneratorApplication.commandLine().execute(args);
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(GenerateCommandTest.class.getResource("/models/" + name).toURI());
    }

    private static List<String> zipEntryNames(byte[] bytes) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
