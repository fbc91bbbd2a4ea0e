package com.modelforge.generator.codegen.mapper;

import static com.modelforge.generator.TestModels.rule;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.ValidationRule;
import com.modelforge.generator.codegen.model.input.ValidationRuleType;

/**
 * Unit tests for SampleData.
 */
class SampleDataTest {

    @Test
    void testUnconstrainedFieldsKeepFixedLiterals() {
        Field name = field(FieldType.STRING, true);

        assertThat(SampleData.created(name)).contains("'test string'");
        assertThat(SampleData.updated(name)).contains("'updated string'");
        assertThat(SampleData.created(field(FieldType.INTEGER, true))).contains("42");
    }

    @Test
    void testStringsCutToMaxLength() {
        Field code = field(FieldType.STRING, true, rule(ValidationRuleType.MAX_LENGTH, 5));

        assertThat(SampleData.created(code)).contains("'test'");
        assertThat(SampleData.updated(code)).contains("'updat'");
    }

    @Test
    void testStringsPaddedToMinLength() {
        Field secret = field(FieldType.TEXT, true, rule(ValidationRuleType.MIN_LENGTH, 20));

        assertThat(SampleData.created(secret)).contains("'test text contentxxx'");
    }

    @Test
    void testNumbersClampedIntoRange() {
        Field quantity = field(FieldType.INTEGER, true, rule(ValidationRuleType.MIN, 100));
        Field rating = field(FieldType.DECIMAL, true, rule(ValidationRuleType.MAX, 5));
        Field ratio = field(FieldType.FLOAT, true, rule(ValidationRuleType.MIN, 0.25), rule(ValidationRuleType.MAX, 0.75));

        assertThat(SampleData.created(quantity)).contains("100");
        assertThat(SampleData.updated(quantity)).contains("101");
        assertThat(SampleData.created(rating)).contains("5");
        assertThat(SampleData.updated(rating)).contains("4");
        assertThat(SampleData.created(ratio)).contains("0.75");
    }

    @Test
    void testIntegerBoundsRoundedInward() {
        Field level = field(FieldType.INTEGER, true, rule(ValidationRuleType.MAX, "9.5"));

        assertThat(SampleData.created(level)).contains("9");
    }

    @Test
    void testPatternPicksMatchingCandidate() {
        Field code = field(FieldType.STRING, true, rule(ValidationRuleType.PATTERN, "^[A-Z]+$"));
        Field digits = field(FieldType.STRING, true, rule(ValidationRuleType.PATTERN, "^\\d+$"));

        assertThat(SampleData.created(code)).contains("'TEST'");
        assertThat(SampleData.updated(code)).contains("'UPDATED'");
        assertThat(SampleData.created(digits)).contains("'12345'");
    }

    @Test
    void testUnmatchedPatternLeavesOptionalFieldOut() {
        ValidationRule hex = rule(ValidationRuleType.PATTERN, "^#[0-9a-f]{6}$");

        assertThat(SampleData.created(field(FieldType.STRING, false, hex))).isEmpty();
        assertThat(SampleData.created(field(FieldType.STRING, true, hex))).contains("'test string'");
    }

    @Test
    void testEmailKeepsItsAddress() {
        Field email = field(FieldType.EMAIL, true, rule(ValidationRuleType.PATTERN, "^\\S+@\\S+$"));

        assertThat(SampleData.created(email)).contains("'test@example.com'");
    }

    private static Field field(FieldType type, boolean required, ValidationRule... rules) {
        return Field.builder().name("value").type(type).required(required).validation(List.of(rules)).build();
    }
}
