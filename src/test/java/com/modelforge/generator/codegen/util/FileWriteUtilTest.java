package com.modelforge.generator.codegen.util;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelforge.generator.codegen.model.output.GeneratedFile;

class FileWriteUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteTreeCreatesNestedDirectories() throws IOException {
        FileWriteUtil.writeTree(tempDir.resolve("out"), List.of(
                GeneratedFile.source("src/models/user.ts", "export {};\n", "typescript"),
                GeneratedFile.documentation("README.md", "# API\n")));

        assertThat(Files.readString(tempDir.resolve("out/src/models/user.ts"))).isEqualTo("export {};\n");
        assertThat(Files.readString(tempDir.resolve("out/README.md"))).isEqualTo("# API\n");
    }

    @Test
    void testWriteTreeRejectsEscapingPathsBeforeWriting() {
        List<GeneratedFile> files = List.of(
                GeneratedFile.documentation("README.md", "# API\n"),
                GeneratedFile.documentation("../outside.md", "nope"));

        assertThatThrownBy(() -> FileWriteUtil.writeTree(tempDir.resolve("out"), files))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("../outside.md");
        assertThat(tempDir.resolve("out/README.md")).doesNotExist();
        assertThat(tempDir.resolve("outside.md")).doesNotExist();
    }

    @Test
    void testDeleteTree() throws IOException {
        FileWriteUtil.writeText(tempDir.resolve("gone/a/b.txt"), "x");

        FileWriteUtil.deleteTree(tempDir.resolve("gone"));
        FileWriteUtil.deleteTree(tempDir.resolve("never-existed"));

        assertThat(tempDir.resolve("gone")).doesNotExist();
    }
}
