package com.modelforge.generator.cli.input;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelforge.generator.codegen.model.core.context.AuthStrategy;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.RelationshipType;
import com.modelforge.generator.codegen.model.input.ValidationRule;
import com.modelforge.generator.codegen.model.input.ValidationRuleType;

/**
 * Unit tests for ModelInputReader.
 */
class ModelInputReaderTest {

    @TempDir
    Path tempDir;

    private final ModelInputReader reader = new ModelInputReader();

    @Test
    void testReadsModelsAndEmbeddedOptions() throws Exception {
        ModelInput input = reader.read(resource("blog.json"), null);

        assertThat(input.getModels()).extracting(Model::getName).containsExactly("Author", "Article");
        Model author = input.getModels().get(0);
        assertThat(author.findField("email").orElseThrow().getType()).isEqualTo(FieldType.EMAIL);
        assertThat(author.findField("displayName").orElseThrow().getValidation())
                .extracting(ValidationRule::getType)
                .containsExactly(ValidationRuleType.MIN_LENGTH, ValidationRuleType.MAX_LENGTH);
        assertThat(author.getRelationships().get(0).getType()).isEqualTo(RelationshipType.ONE_TO_MANY);
        assertThat(input.getModels().get(1).getMetadata().isSoftDelete()).isTrue();
        assertThat(input.getModels().get(1).getMetadata().isTimestamps()).isTrue();
        assertThat(input.getOptions().getDatabase()).isEqualTo(DatabaseEngine.MYSQL);
        assertThat(input.getOptions().isIncludeTests()).isTrue();
    }

    @Test
    void testOptionsFileTakesPrecedence() throws Exception {
        ModelInput input = reader.read(resource("blog.json"), resource("options-none.json"));

        assertThat(input.getOptions().getDatabase()).isEqualTo(DatabaseEngine.POSTGRESQL);
        assertThat(input.getOptions().getAuthentication()).isEqualTo(AuthStrategy.NONE);
    }

    @Test
    void testBareArrayUsesDefaultOptions() throws Exception {
        ModelInput input = reader.read(resource("invalid.json"), null);

        assertThat(input.getModels()).hasSize(1);
        assertThat(input.getOptions().getAuthentication()).isEqualTo(AuthStrategy.JWT);
    }

    @Test
    void testRejectsOtherShapes() throws IOException {
        Path file = Files.writeString(tempDir.resolve("models.json"), "\"just text\"");

        assertThatThrownBy(() -> reader.read(file, null))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("JSON array");
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(ModelInputReaderTest.class.getResource("/models/" + name).toURI());
    }
}
