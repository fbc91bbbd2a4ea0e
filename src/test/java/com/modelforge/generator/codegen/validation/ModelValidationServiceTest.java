package com.modelforge.generator.codegen.validation;

import static com.modelforge.generator.TestModels.model;
import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.modelforge.generator.TestModels;
import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.Relationship;

/**
 * Unit tests for ModelValidationService.
 */
class ModelValidationServiceTest {

    private final ModelValidationService service = new ModelValidationService();

    @Test
    void testValidModelsPass() {
        ValidationResult result = service.validate(List.of(TestModels.user(), TestModels.post()));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getCircularReferences()).isEmpty();
    }

    @Test
    void testEmptyModelListIsValid() {
        ValidationResult result = service.validate(List.of());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testDuplicateModelNamesIgnoreCase() {
        ValidationResult result = service.validate(List.of(model("Post"), model("post")));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.DUPLICATE_MODEL_NAME);
        assertThat(result.getErrors().get(0).getField()).isEqualTo("models[1].name");
    }

    @Test
    void testDuplicateFieldNames() {
        Model model = Model.builder()
                .name("Tag")
                .fields(List.of(
                        Field.builder().name("id").type(FieldType.UUID).build(),
                        Field.builder().name("label").type(FieldType.TEXT).build(),
                        Field.builder().name("label").type(FieldType.TEXT).build()))
                .build();

        ValidationResult result = service.validate(List.of(model));

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getField, ValidationIssue::getCode)
                .containsExactly(tuple("models[0].fields[2].name", IssueCode.DUPLICATE_FIELD_NAME));
    }

    @Test
    void testMissingNameAndTypeAreSchemaErrors() {
        Model model = Model.builder()
                .name("")
                .fields(List.of(Field.builder().name("value").build()))
                .build();

        ValidationResult result = service.validate(List.of(model));

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getField)
                .containsExactly("models[0].name", "models[0].fields[0].type");
        assertThat(result.getErrors())
                .extracting(ValidationIssue::getCode)
                .containsOnly(IssueCode.SCHEMA_VALIDATION_ERROR);
    }

    @Test
    void testNullEntriesAreReportedNotThrown() {
        List<Model> models = new ArrayList<>(Arrays.asList(TestModels.post(), null));

        ValidationResult result = service.validate(models);

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getField)
                .containsExactly("models[1]");
    }

    @Test
    void testOverlongNameIsError() {
        Model model = model("A" + "b".repeat(ModelValidationService.MAX_NAME_LENGTH));

        ValidationResult result = service.validate(List.of(model));

        assertThat(result.getErrors()).extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.SCHEMA_VALIDATION_ERROR);
    }

    @Test
    void testMissingTargetModel() {
        ValidationResult result = service.validate(List.of(model("Post", "Author")));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors())
                .extracting(ValidationIssue::getField, ValidationIssue::getCode)
                .containsExactly(tuple("models[0].relationships[0].targetModel", IssueCode.TARGET_MODEL_NOT_FOUND));
        assertThat(result.getCircularReferences()).isEmpty();
    }

    @Test
    void testMissingSourceAndTargetFields() {
        Relationship relationship = TestModels.relationship("Post", "Comment").toBuilder()
                .sourceField("commentIds")
                .targetField("postId")
                .build();
        Model post = model("Post").toBuilder().relationships(List.of(relationship)).build();

        ValidationResult result = service.validate(List.of(post, model("Comment")));

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.SOURCE_FIELD_NOT_FOUND, IssueCode.TARGET_FIELD_NOT_FOUND);
    }

    @Test
    void testSourceModelMismatchIsWarning() {
        Relationship relationship = TestModels.relationship("Other", "Comment");
        Model post = model("Post").toBuilder().relationships(List.of(relationship)).build();

        ValidationResult result = service.validate(List.of(post, model("Comment")));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings())
                .extracting(ValidationIssue::getCode)
                .contains(IssueCode.SOURCE_MODEL_MISMATCH);
    }

    @Test
    void testCyclesDoNotBlockGeneration() {
        ValidationResult result = service.validate(List.of(model("A", "B"), model("B", "A")));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getCircularReferences()).containsExactly("A -> B -> A");
    }

    @Test
    void testNamingAndStructureWarnings() {
        Model model = Model.builder()
                .name("blog_post")
                .fields(List.of(
                        Field.builder().name("Title").type(FieldType.STRING).build(),
                        Field.builder().name("contact").type(FieldType.EMAIL).build()))
                .build();

        ValidationResult result = service.validate(List.of(model));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings())
                .extracting(ValidationIssue::getCode)
                .containsExactlyInAnyOrder(
                        IssueCode.NAMING_CONVENTION_WARNING,
                        IssueCode.FIELD_NAMING_CONVENTION_WARNING,
                        IssueCode.MISSING_STRING_VALIDATION,
                        IssueCode.MISSING_EMAIL_VALIDATION,
                        IssueCode.NO_PRIMARY_KEY_WARNING);
        assertThat(result.getWarnings())
                .filteredOn(w -> w.getCode().equals(IssueCode.MISSING_EMAIL_VALIDATION))
                .extracting(ValidationIssue::getField)
                .containsExactly("models[0].fields[1].validation");
    }

    @Test
    void testModelWithoutFieldsIsOnlyWarned() {
        Model model = Model.builder().name("Empty").build();

        ValidationResult result = service.validate(List.of(model));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings())
                .extracting(ValidationIssue::getCode)
                .contains(IssueCode.NO_FIELDS_WARNING);
    }

    @Test
    void testValidateFieldHintsOnlyForUnconstrainedText() {
        Field constrained = TestModels.user().getFields().get(0);
        Field number = Field.builder().name("count").type(FieldType.INTEGER).build();

        assertThat(service.validateField(constrained)).isEmpty();
        assertThat(service.validateField(number)).isEmpty();
        assertThat(service.validateField(Field.builder().name("s").type(FieldType.STRING).build()))
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.MISSING_STRING_VALIDATION);
    }

    @Test
    void testExceptionMessageListsEveryError() {
        ValidationResult result = service.validate(List.of(model("Post", "Author"), model("Post")));

        ModelValidationException exception = new ModelValidationException(result.getErrors());

        assertThat(exception.getErrors()).hasSize(2);
        assertThat(exception.getMessage())
                .contains(IssueCode.TARGET_MODEL_NOT_FOUND)
                .contains(IssueCode.DUPLICATE_MODEL_NAME);
    }
}
