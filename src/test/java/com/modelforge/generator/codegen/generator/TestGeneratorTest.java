package com.modelforge.generator.codegen.generator;

import static com.modelforge.generator.TestModels.rule;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.modelforge.generator.TestModels;
import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.ValidationRuleType;
import com.modelforge.generator.codegen.model.output.GeneratedFile;

/**
 * Unit tests for TestGenerator.
 */
class TestGeneratorTest {

    private final TestGenerator generator = new TestGenerator();

    @Test
    void testSuiteWalksTheLifecycle() {
        GeneratedFile file = generator.generate(TestModels.user(), List.of());

        assertThat(file.getPath()).isEqualTo("src/tests/UserController.test.ts");
        assertThat(file.getContents())
                .contains("    name: 'test string',\n    email: 'test@example.com',\n")
                .contains("    name: 'updated string',\n    email: 'updated@example.com',\n")
                .contains("describe('POST /user'", "describe('DELETE /user/:id'")
                .contains("it('should return 400 for invalid data'")
                .doesNotContain("authHeader");
    }

    @Test
    void testSamplesRespectFieldBounds() {
        Model product = Model.builder()
                .name("Product")
                .fields(List.of(
                        Field.builder().name("sku").type(FieldType.STRING).required(true)
                                .validation(List.of(rule(ValidationRuleType.MAX_LENGTH, 5)))
                                .build(),
                        Field.builder().name("stock").type(FieldType.INTEGER).required(true)
                                .validation(List.of(rule(ValidationRuleType.MIN, 100)))
                                .build()))
                .build();

        String contents = generator.generate(product, List.of()).getContents();

        assertThat(contents)
                .contains("    sku: 'test',\n    stock: 100,\n")
                .contains("    sku: 'updat',\n    stock: 101,\n")
                .doesNotContain("'test string'", ": 42,");
    }

    @Test
    void testFieldWithoutConformingValueIsNotSentOrAsserted() {
        Model theme = Model.builder()
                .name("Theme")
                .fields(List.of(
                        Field.builder().name("label").type(FieldType.STRING).required(true).build(),
                        Field.builder().name("color").type(FieldType.STRING)
                                .validation(List.of(rule(ValidationRuleType.PATTERN, "^#[0-9a-f]{6}$")))
                                .build()))
                .build();

        String contents = generator.generate(theme, List.of()).getContents();

        assertThat(contents)
                .contains("expect(response.body.data.label).toEqual(testData.label);")
                .doesNotContain("color");
    }
}
