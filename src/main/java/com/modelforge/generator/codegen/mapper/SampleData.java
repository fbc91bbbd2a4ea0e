package com.modelforge.generator.codegen.mapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.ValidationRule;
import com.modelforge.generator.codegen.model.input.ValidationRuleType;
import com.modelforge.generator.codegen.util.NamingUtil;

import lombok.experimental.UtilityClass;

/**
 * Test input for a single field that passes the field's own validation rules.
 *
 * Starts from the fixed literals of {@link FieldTypeMapper}. Strings are padded or cut to their length bounds,
 * numbers are clamped to their range and patterns are checked against a few candidates. An optional field with
 * no conforming candidate gets no value at all; a required one keeps the closest candidate.
 */
@UtilityClass
public class SampleData {

    private final String PADDING = "x";

    private final List<String> STRING_CANDIDATES = List.of("test string", "teststring", "test", "TEST", "12345",
            "test123", "a");

    private final List<String> UPDATED_STRING_CANDIDATES = List.of("updated string", "updatedstring", "updated",
            "UPDATED", "67890", "updated456", "b");

    /**
     * Literal sent when creating a record, empty when the field is better left out.
     */
    public Optional<String> created(Field field) {
        return literal(field, false);
    }

    /**
     * Literal sent when updating a record, different from {@link #created(Field)} whenever the rules allow it.
     */
    public Optional<String> updated(Field field) {
        return literal(field, true);
    }

    private Optional<String> literal(Field field, boolean update) {
        FieldType type = field.getType();
        if (type.isNumeric()) {
            return Optional.of(number(field, update));
        }
        String fixed = update ? FieldTypeMapper.updatedSampleLiteral(type) : FieldTypeMapper.sampleLiteral(type);
        if (!hasTextRules(field) || !fixed.startsWith("'")) {
            return Optional.of(fixed);
        }

        List<String> candidates = new ArrayList<>();
        if (type == FieldType.STRING || type == FieldType.TEXT) {
            List<String> words = update ? UPDATED_STRING_CANDIDATES : STRING_CANDIDATES;
            candidates.add(fit(unquote(fixed), field));
            words.forEach(word -> candidates.add(fit(word, field)));
        } else {
            candidates.add(unquote(fixed));
        }
        String other = update ? unquote(FieldTypeMapper.sampleLiteral(type)) : null;

        Optional<String> conforming = candidates.stream()
                .filter(value -> conforms(value, field))
                .filter(value -> !value.equals(other))
                .findFirst()
                .or(() -> candidates.stream().filter(value -> conforms(value, field)).findFirst());
        if (conforming.isPresent()) {
            return conforming.map(NamingUtil::quote);
        }
        return field.isRequired() ? Optional.of(NamingUtil.quote(candidates.get(0))) : Optional.empty();
    }

    private boolean hasTextRules(Field field) {
        return field.getValidation().stream().anyMatch(rule -> rule.getType() == ValidationRuleType.MIN_LENGTH
                || rule.getType() == ValidationRuleType.MAX_LENGTH
                || rule.getType() == ValidationRuleType.PATTERN);
    }

    /**
     * Cuts the value to the maximum length and pads it up to the minimum one.
     */
    private String fit(String value, Field field) {
        String fitted = value;
        Optional<Integer> max = bound(field, ValidationRuleType.MAX_LENGTH).map(BigDecimal::intValue);
        if (max.isPresent() && fitted.length() > max.get()) {
            fitted = fitted.substring(0, Math.max(0, max.get())).strip();
        }
        int min = bound(field, ValidationRuleType.MIN_LENGTH).map(BigDecimal::intValue).orElse(0);
        if (fitted.length() < min) {
            fitted = fitted + PADDING.repeat(min - fitted.length());
        }
        return fitted;
    }

    private boolean conforms(String value, Field field) {
        Optional<BigDecimal> min = bound(field, ValidationRuleType.MIN_LENGTH);
        Optional<BigDecimal> max = bound(field, ValidationRuleType.MAX_LENGTH);
        if (min.isPresent() && value.length() < min.get().intValue()) {
            return false;
        }
        if (max.isPresent() && value.length() > max.get().intValue()) {
            return false;
        }
        return field.findRule(ValidationRuleType.PATTERN)
                .map(rule -> matches(String.valueOf(rule.getValue()), value))
                .orElse(true);
    }

    private boolean matches(String regex, String value) {
        try {
            return Pattern.compile(regex).matcher(value).find();
        } catch (PatternSyntaxException e) {
            // Not a pattern Java can read: no candidate counts as verified
            return false;
        }
    }

    private String number(Field field, boolean update) {
        FieldType type = field.getType();
        BigDecimal value = new BigDecimal(update
                ? FieldTypeMapper.updatedSampleLiteral(type)
                : FieldTypeMapper.sampleLiteral(type));
        boolean integral = type == FieldType.INTEGER;

        Optional<BigDecimal> min = bound(field, ValidationRuleType.MIN)
                .map(v -> integral ? v.setScale(0, RoundingMode.CEILING) : v);
        Optional<BigDecimal> max = bound(field, ValidationRuleType.MAX)
                .map(v -> integral ? v.setScale(0, RoundingMode.FLOOR) : v);
        if (update) {
            // Step back from the upper bound so the update still differs from the created value
            BigDecimal created = new BigDecimal(number(field, false));
            if (max.isPresent() && value.compareTo(max.get()) > 0) {
                value = created.subtract(BigDecimal.ONE);
            } else if (min.isPresent() && value.compareTo(min.get()) < 0) {
                value = created.add(BigDecimal.ONE);
            }
        }
        if (min.isPresent() && value.compareTo(min.get()) < 0) {
            value = min.get();
        }
        if (max.isPresent() && value.compareTo(max.get()) > 0) {
            value = max.get();
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private Optional<BigDecimal> bound(Field field, ValidationRuleType ruleType) {
        return field.findRule(ruleType)
                .map(ValidationRule::numericValue)
                .map(n -> n instanceof BigDecimal decimal ? decimal : new BigDecimal(n.toString()));
    }

    private String unquote(String literal) {
        return literal.substring(1, literal.length() - 1);
    }
}
