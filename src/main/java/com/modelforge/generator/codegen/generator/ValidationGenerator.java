package com.modelforge.generator.codegen.generator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.modelforge.generator.codegen.mapper.FieldTypeMapper;
import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.ValidationRule;
import com.modelforge.generator.codegen.model.input.ValidationRuleType;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates express-validator chains for the create and update bodies of a model.
 *
 * Create chains enforce presence of required fields; update chains make every field optional. Both apply the
 * type check and any declared bounds.
 */
public class ValidationGenerator {

    public GeneratedFile generate(Model model) {
        String name = model.getName();
        List<Field> fields = model.dataFields();

        String createChains = fields.stream()
                .map(f -> "    " + chain(f, false) + ",\n")
                .collect(Collectors.joining());
        String updateChains = fields.stream()
                .map(f -> "    " + chain(f, true) + ",\n")
                .collect(Collectors.joining());

        String contents = """
                import { body } from 'express-validator';
                import { handleValidationErrors } from '../middleware/validation';

                export const validate%1$s = {
                  create: [
                %2$s    handleValidationErrors
                  ],

                  update: [
                %3$s    handleValidationErrors
                  ]
                };
                """.formatted(name, createChains, updateChains);

        return GeneratedFile.source("src/validation/" + name + "Validation.ts", contents, ContentLanguage.TYPESCRIPT);
    }

    String chain(Field field, boolean update) {
        StringBuilder chain = new StringBuilder("body(").append(NamingUtil.quote(field.getName())).append(')');
        if (!update && field.isRequired()) {
            chain.append(".exists({ checkNull: true }).withMessage(")
                    .append(NamingUtil.quote(field.getName() + " is required")).append(')');
        } else {
            chain.append(".optional()");
        }
        chain.append(FieldTypeMapper.validatorChain(field.getType()));
        bounds(field).forEach(chain::append);
        return chain.toString();
    }

    private List<String> bounds(Field field) {
        List<String> bounds = new ArrayList<>();
        FieldType type = field.getType();

        Optional<ValidationRule> minLength = field.findRule(ValidationRuleType.MIN_LENGTH);
        Optional<ValidationRule> maxLength = field.findRule(ValidationRuleType.MAX_LENGTH);
        if (type.isTextual()) {
            range(minLength, maxLength).ifPresent(r -> bounds.add(
                    ".isLength(" + r + ")" + message(minLength, maxLength)));
        }

        Optional<ValidationRule> min = field.findRule(ValidationRuleType.MIN);
        Optional<ValidationRule> max = field.findRule(ValidationRuleType.MAX);
        if (type.isNumeric()) {
            String check = type == FieldType.INTEGER ? ".isInt(" : ".isFloat(";
            range(min, max).ifPresent(r -> bounds.add(check + r + ")" + message(min, max)));
        }

        field.findRule(ValidationRuleType.PATTERN).ifPresent(rule -> bounds.add(
                ".matches(new RegExp(" + NamingUtil.quote(String.valueOf(rule.getValue())) + "))"
                        + message(Optional.of(rule), Optional.empty())));
        return bounds;
    }

    /**
     * Bounds object such as {@code { min: 2, max: 50 }}; empty when no rule carries a numeric value.
     */
    private static Optional<String> range(Optional<ValidationRule> lower, Optional<ValidationRule> upper) {
        List<String> parts = new ArrayList<>();
        lower.flatMap(ValidationGenerator::number).ifPresent(v -> parts.add("min: " + v));
        upper.flatMap(ValidationGenerator::number).ifPresent(v -> parts.add("max: " + v));
        return parts.isEmpty() ? Optional.empty() : Optional.of("{ " + String.join(", ", parts) + " }");
    }

    private static String message(Optional<ValidationRule> first, Optional<ValidationRule> second) {
        return first.map(ValidationRule::getMessage)
                .or(() -> second.map(ValidationRule::getMessage))
                .map(m -> ".withMessage(" + NamingUtil.quote(m) + ")")
                .orElse("");
    }

    private static Optional<String> number(ValidationRule rule) {
        Number value = rule.numericValue();
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal.stripTrailingZeros().toPlainString());
        }
        return Optional.ofNullable(value).map(Number::toString);
    }
}
