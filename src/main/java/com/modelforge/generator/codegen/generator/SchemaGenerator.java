package com.modelforge.generator.codegen.generator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import com.modelforge.generator.codegen.mapper.FieldTypeMapper;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.template.BuiltinTemplates;
import com.modelforge.generator.codegen.template.TemplateEngine;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates the table definition of a model for relational engines.
 *
 * Columns use snake_case names. With timestamps on, {@code updated_at} is kept current by the database itself.
 */
public class SchemaGenerator {

    private final TemplateEngine templateEngine;

    public SchemaGenerator(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    public GeneratedFile generate(Model model, DatabaseEngine database) {
        String path = "src/schemas/" + model.getName().toLowerCase(Locale.ROOT) + ".sql";
        String contents = switch (database) {
            case POSTGRESQL -> generatePostgreSql(model);
            case MYSQL -> generateMySql(model);
            case MONGODB -> throw new IllegalArgumentException("MongoDB has no table definitions");
        };
        return GeneratedFile.source(path, contents, ContentLanguage.SQL);
    }

    private String generatePostgreSql(Model model) {
        List<Map<String, Object>> columns = model.dataFields().stream()
                .map(field -> Map.<String, Object>of("definition", columnDefinition(field, DatabaseEngine.POSTGRESQL)))
                .toList();

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("tableName", NamingUtil.tableName(model));
        values.put("columns", columns);
        values.put("timestamps", model.getMetadata().isTimestamps());
        values.put("softDelete", model.getMetadata().isSoftDelete());
        return templateEngine.render(BuiltinTemplates.POSTGRESQL_SCHEMA, values);
    }

    private String generateMySql(Model model) {
        String tableName = NamingUtil.tableName(model);
        String columns = model.dataFields().stream()
                .map(field -> ",\n  " + columnDefinition(field, DatabaseEngine.MYSQL))
                .collect(Collectors.joining());
        String timestamps = model.getMetadata().isTimestamps()
                ? ",\n  created_at DATETIME DEFAULT CURRENT_TIMESTAMP"
                        + ",\n  updated_at DATETIME DEFAULT CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP"
                : "";
        String softDelete = model.getMetadata().isSoftDelete() ? ",\n  deleted_at DATETIME NULL" : "";

        return """
                CREATE TABLE IF NOT EXISTS %s (
                  id CHAR(36) PRIMARY KEY%s%s%s
                );
                """.formatted(tableName, columns, timestamps, softDelete);
    }

    static String columnDefinition(Field field, DatabaseEngine database) {
        StringBuilder definition = new StringBuilder()
                .append(NamingUtil.toSnakeCase(field.getName()))
                .append(' ')
                .append(FieldTypeMapper.toColumnType(field.getType(), database));
        if (field.isRequired()) {
            definition.append(" NOT NULL");
        }
        if (field.isUnique()) {
            definition.append(" UNIQUE");
        }
        if (field.getDefaultValue() != null) {
            definition.append(" DEFAULT ").append(defaultLiteral(field.getDefaultValue()));
        }
        return definition.toString();
    }

    private static String defaultLiteral(Object value) {
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        return "'" + String.valueOf(value).replace("'", "''") + "'";
    }
}
