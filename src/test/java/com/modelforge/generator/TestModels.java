package com.modelforge.generator;

import java.util.Arrays;
import java.util.List;

import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.Relationship;
import com.modelforge.generator.codegen.model.input.RelationshipType;
import com.modelforge.generator.codegen.model.input.ValidationRule;
import com.modelforge.generator.codegen.model.input.ValidationRuleType;

/**
 * Model fixtures shared by the tests.
 */
public final class TestModels {

    private TestModels() {
    }

    /**
     * User with a required name and a required, unique email.
     */
    public static Model user() {
        return Model.builder()
                .name("User")
                .fields(List.of(
                        Field.builder().name("name").type(FieldType.STRING).required(true)
                                .validation(List.of(rule(ValidationRuleType.MIN_LENGTH, 2),
                                        rule(ValidationRuleType.MAX_LENGTH, 100)))
                                .build(),
                        Field.builder().name("email").type(FieldType.EMAIL).required(true).unique(true)
                                .validation(List.of(rule(ValidationRuleType.PATTERN, "^\\S+@\\S+$")))
                                .build()))
                .build();
    }

    public static Model post() {
        return Model.builder()
                .name("Post")
                .fields(List.of(
                        Field.builder().name("id").type(FieldType.UUID).build(),
                        Field.builder().name("title").type(FieldType.STRING).required(true)
                                .validation(List.of(rule(ValidationRuleType.MAX_LENGTH, 200)))
                                .build(),
                        Field.builder().name("published").type(FieldType.BOOLEAN).defaultValue(false).build(),
                        Field.builder().name("authorId").type(FieldType.UUID).required(true).build()))
                .build();
    }

    public static Model model(String name, String... targets) {
        List<Relationship> relationships = Arrays.stream(targets)
                .map(target -> relationship(name, target))
                .toList();
        return Model.builder()
                .name(name)
                .fields(List.of(Field.builder().name("id").type(FieldType.UUID).build()))
                .relationships(relationships)
                .build();
    }

    public static Relationship relationship(String source, String target) {
        return Relationship.builder()
                .type(RelationshipType.ONE_TO_MANY)
                .sourceModel(source)
                .targetModel(target)
                .sourceField("id")
                .targetField("id")
                .build();
    }

    public static ValidationRule rule(ValidationRuleType type, Object value) {
        return ValidationRule.builder().type(type).value(value).build();
    }
}
