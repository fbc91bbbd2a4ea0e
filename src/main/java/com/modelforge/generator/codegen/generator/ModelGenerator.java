package com.modelforge.generator.codegen.generator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelforge.generator.codegen.mapper.FieldTypeMapper;
import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.template.BuiltinTemplates;
import com.modelforge.generator.codegen.template.TemplateEngine;

/**
 * Generates the record definitions of a model: the stored record, the create input and the partial update input.
 */
public class ModelGenerator {

    private final TemplateEngine templateEngine;

    public ModelGenerator(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    public GeneratedFile generate(Model model) {
        List<Map<String, Object>> fields = model.dataFields().stream()
                .map(ModelGenerator::toTemplateField)
                .toList();

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("modelName", model.getName());
        values.put("timestamps", model.getMetadata().isTimestamps());
        values.put("fields", fields);
        values.put("createFields", fields);
        values.put("updateFields", fields);

        String contents = templateEngine.render(BuiltinTemplates.MODEL_INTERFACE, values);
        return GeneratedFile.source("src/models/" + model.getName() + ".ts", contents, ContentLanguage.TYPESCRIPT);
    }

    private static Map<String, Object> toTemplateField(Field field) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("name", field.getName());
        value.put("tsType", FieldTypeMapper.toTypeScript(field.getType()));
        value.put("optionalMarker", field.isRequired() ? "" : "?");
        return value;
    }
}
