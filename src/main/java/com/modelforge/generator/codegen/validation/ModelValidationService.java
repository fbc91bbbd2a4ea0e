package com.modelforge.generator.codegen.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.Relationship;

/**
 * Checks a model set for structural, naming and referential problems and reports every finding in one pass.
 *
 * Never throws for bad input. Generation must not run when the returned result is not valid.
 */
public class ModelValidationService {

    private static final Logger log = LoggerFactory.getLogger(ModelValidationService.class);

    static final int MAX_NAME_LENGTH = 100;

    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    private static final Pattern CAMEL_CASE = Pattern.compile("^[a-z][a-zA-Z0-9]*$");

    private final CycleDetector cycleDetector;

    public ModelValidationService() {
        this(new CycleDetector());
    }

    public ModelValidationService(CycleDetector cycleDetector) {
        this.cycleDetector = cycleDetector;
    }

    public ValidationResult validate(List<Model> models) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        List<Model> safeModels = models == null ? List.of() : models;

        for (int i = 0; i < safeModels.size(); i++) {
            validateModel(safeModels.get(i), "models[" + i + "]", errors, warnings);
        }
        checkDuplicateModelNames(safeModels, errors);
        checkRelationships(safeModels, errors, warnings);

        List<String> cycles = cycleDetector.findCycles(safeModels);

        log.debug("Validated {} model(s): {} error(s), {} warning(s), {} circular reference(s)",
                safeModels.size(), errors.size(), warnings.size(), cycles.size());

        return ValidationResult.builder()
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .circularReferences(List.copyOf(cycles))
                .build();
    }

    /**
     * Field-level hints only (no errors): textual fields without any validation rule.
     */
    public List<ValidationIssue> validateField(Field field) {
        List<ValidationIssue> hints = new ArrayList<>();
        if (field == null || field.getType() == null || !field.getValidation().isEmpty()) {
            return hints;
        }
        if (field.getType() == FieldType.EMAIL) {
            hints.add(new ValidationIssue("validation",
                    "Email field '" + field.getName() + "' has no validation rules",
                    IssueCode.MISSING_EMAIL_VALIDATION));
        } else if (field.getType() == FieldType.STRING) {
            hints.add(new ValidationIssue("validation",
                    "String field '" + field.getName() + "' has no length constraints",
                    IssueCode.MISSING_STRING_VALIDATION));
        }
        return hints;
    }

    private void validateModel(Model model, String path,
                               List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        if (model == null) {
            errors.add(new ValidationIssue(path, "Model must not be null", IssueCode.SCHEMA_VALIDATION_ERROR));
            return;
        }

        String name = model.getName();
        if (isBlank(name)) {
            errors.add(new ValidationIssue(path + ".name", "Model name is required",
                    IssueCode.SCHEMA_VALIDATION_ERROR));
        } else {
            if (name.length() > MAX_NAME_LENGTH) {
                errors.add(new ValidationIssue(path + ".name",
                        "Model name must be at most " + MAX_NAME_LENGTH + " characters",
                        IssueCode.SCHEMA_VALIDATION_ERROR));
            }
            if (!PASCAL_CASE.matcher(name).matches()) {
                warnings.add(new ValidationIssue(path + ".name",
                        "Model name '" + name + "' should be PascalCase",
                        IssueCode.NAMING_CONVENTION_WARNING));
            }
        }

        List<Field> fields = model.getFields();
        if (fields.isEmpty()) {
            warnings.add(new ValidationIssue(path + ".fields", "Model has no fields",
                    IssueCode.NO_FIELDS_WARNING));
        }

        Set<String> seenFieldNames = new HashSet<>();
        boolean hasIdentifier = false;
        for (int j = 0; j < fields.size(); j++) {
            Field field = fields.get(j);
            String fieldPath = path + ".fields[" + j + "]";
            if (field == null) {
                errors.add(new ValidationIssue(fieldPath, "Field must not be null",
                        IssueCode.SCHEMA_VALIDATION_ERROR));
                continue;
            }
            validateFieldSchema(field, fieldPath, errors, warnings);

            if (!isBlank(field.getName()) && !seenFieldNames.add(field.getName())) {
                errors.add(new ValidationIssue(fieldPath + ".name",
                        "Duplicate field name '" + field.getName() + "'",
                        IssueCode.DUPLICATE_FIELD_NAME));
            }
            if ("id".equalsIgnoreCase(field.getName()) || field.getType() == FieldType.UUID || field.isUnique()) {
                hasIdentifier = true;
            }
            validateField(field).forEach(hint -> warnings.add(hint.prefixed(fieldPath)));
        }

        if (!hasIdentifier) {
            warnings.add(new ValidationIssue(path + ".fields",
                    "Model has no id, uuid or unique field",
                    IssueCode.NO_PRIMARY_KEY_WARNING));
        }

        List<Relationship> relationships = model.getRelationships();
        for (int k = 0; k < relationships.size(); k++) {
            validateRelationshipSchema(relationships.get(k), path + ".relationships[" + k + "]", errors);
        }
    }

    private void validateFieldSchema(Field field, String path,
                                     List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        String name = field.getName();
        if (isBlank(name)) {
            errors.add(new ValidationIssue(path + ".name", "Field name is required",
                    IssueCode.SCHEMA_VALIDATION_ERROR));
        } else {
            if (name.length() > MAX_NAME_LENGTH) {
                errors.add(new ValidationIssue(path + ".name",
                        "Field name must be at most " + MAX_NAME_LENGTH + " characters",
                        IssueCode.SCHEMA_VALIDATION_ERROR));
            }
            if (!CAMEL_CASE.matcher(name).matches()) {
                warnings.add(new ValidationIssue(path + ".name",
                        "Field name '" + name + "' should be camelCase",
                        IssueCode.FIELD_NAMING_CONVENTION_WARNING));
            }
        }
        if (field.getType() == null) {
            errors.add(new ValidationIssue(path + ".type", "Field type is required",
                    IssueCode.SCHEMA_VALIDATION_ERROR));
        }
    }

    private void validateRelationshipSchema(Relationship relationship, String path, List<ValidationIssue> errors) {
        if (relationship == null) {
            errors.add(new ValidationIssue(path, "Relationship must not be null",
                    IssueCode.SCHEMA_VALIDATION_ERROR));
            return;
        }
        if (relationship.getType() == null) {
            errors.add(new ValidationIssue(path + ".type", "Relationship type is required",
                    IssueCode.SCHEMA_VALIDATION_ERROR));
        }
        requireText(relationship.getSourceModel(), path + ".sourceModel", errors);
        requireText(relationship.getTargetModel(), path + ".targetModel", errors);
        requireText(relationship.getSourceField(), path + ".sourceField", errors);
        requireText(relationship.getTargetField(), path + ".targetField", errors);
    }

    private void requireText(String value, String path, List<ValidationIssue> errors) {
        if (isBlank(value)) {
            String attribute = path.substring(path.lastIndexOf('.') + 1);
            errors.add(new ValidationIssue(path, "Relationship " + attribute + " is required",
                    IssueCode.SCHEMA_VALIDATION_ERROR));
        }
    }

    private void checkDuplicateModelNames(List<Model> models, List<ValidationIssue> errors) {
        Map<String, Integer> firstSeen = new LinkedHashMap<>();
        for (int i = 0; i < models.size(); i++) {
            Model model = models.get(i);
            if (model == null || isBlank(model.getName())) {
                continue;
            }
            String key = model.getName().toLowerCase(Locale.ROOT);
            Integer first = firstSeen.putIfAbsent(key, i);
            if (first != null) {
                errors.add(new ValidationIssue("models[" + i + "].name",
                        "Duplicate model name '" + model.getName() + "' (first defined at models[" + first + "])",
                        IssueCode.DUPLICATE_MODEL_NAME));
            }
        }
    }

    private void checkRelationships(List<Model> models, List<ValidationIssue> errors,
                                    List<ValidationIssue> warnings) {
        Map<String, Model> byName = new LinkedHashMap<>();
        for (Model model : models) {
            if (model != null && !isBlank(model.getName())) {
                byName.putIfAbsent(model.getName(), model);
            }
        }

        for (int i = 0; i < models.size(); i++) {
            Model owner = models.get(i);
            if (owner == null) {
                continue;
            }
            List<Relationship> relationships = owner.getRelationships();
            for (int k = 0; k < relationships.size(); k++) {
                Relationship relationship = relationships.get(k);
                if (relationship == null) {
                    continue;
                }
                String path = "models[" + i + "].relationships[" + k + "]";

                if (!isBlank(relationship.getSourceModel()) && !relationship.getSourceModel().equals(owner.getName())) {
                    warnings.add(new ValidationIssue(path + ".sourceModel",
                            "Relationship source model '" + relationship.getSourceModel()
                                    + "' does not match owning model '" + owner.getName() + "'",
                            IssueCode.SOURCE_MODEL_MISMATCH));
                }

                if (!isBlank(relationship.getSourceField()) && !owner.hasField(relationship.getSourceField())) {
                    errors.add(new ValidationIssue(path + ".sourceField",
                            "Source field '" + relationship.getSourceField() + "' not found in model '"
                                    + owner.getName() + "'",
                            IssueCode.SOURCE_FIELD_NOT_FOUND));
                }

                if (isBlank(relationship.getTargetModel())) {
                    continue;
                }
                Model target = byName.get(relationship.getTargetModel());
                if (target == null) {
                    errors.add(new ValidationIssue(path + ".targetModel",
                            "Target model '" + relationship.getTargetModel() + "' not found",
                            IssueCode.TARGET_MODEL_NOT_FOUND));
                } else if (!isBlank(relationship.getTargetField()) && !target.hasField(relationship.getTargetField())) {
                    errors.add(new ValidationIssue(path + ".targetField",
                            "Target field '" + relationship.getTargetField() + "' not found in model '"
                                    + target.getName() + "'",
                            IssueCode.TARGET_FIELD_NOT_FOUND));
                }
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
