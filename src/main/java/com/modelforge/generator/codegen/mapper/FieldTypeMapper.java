package com.modelforge.generator.codegen.mapper;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.input.FieldType;
import com.modelforge.generator.codegen.util.JsonSupport;

import lombok.experimental.UtilityClass;

/**
 * Maps a declared field type to its representation in each emitted artifact.
 */
@UtilityClass
public class FieldTypeMapper {

    public String toTypeScript(FieldType type) {
        return switch (type) {
            case STRING, TEXT, EMAIL, URL, UUID -> "string";
            case NUMBER, INTEGER, FLOAT, DECIMAL -> "number";
            case BOOLEAN -> "boolean";
            case DATE -> "Date";
            case JSON -> "Record<string, unknown>";
        };
    }

    public String toPostgreSql(FieldType type) {
        return switch (type) {
            case STRING, EMAIL -> "VARCHAR(255)";
            case TEXT, URL -> "TEXT";
            case NUMBER -> "NUMERIC";
            case INTEGER -> "INTEGER";
            case FLOAT -> "REAL";
            case DECIMAL -> "DECIMAL(10, 2)";
            case BOOLEAN -> "BOOLEAN";
            case DATE -> "TIMESTAMP WITH TIME ZONE";
            case UUID -> "UUID";
            case JSON -> "JSONB";
        };
    }

    public String toMySql(FieldType type) {
        return switch (type) {
            case STRING, EMAIL -> "VARCHAR(255)";
            case TEXT, URL -> "TEXT";
            case NUMBER -> "DOUBLE";
            case INTEGER -> "INT";
            case FLOAT -> "FLOAT";
            case DECIMAL -> "DECIMAL(10, 2)";
            case BOOLEAN -> "BOOLEAN";
            case DATE -> "DATETIME";
            case UUID -> "CHAR(36)";
            case JSON -> "JSON";
        };
    }

    /**
     * Column type in the given dialect.
     *
     * @throws IllegalArgumentException for a non-relational engine
     */
    public String toColumnType(FieldType type, DatabaseEngine database) {
        return switch (database) {
            case POSTGRESQL -> toPostgreSql(type);
            case MYSQL -> toMySql(type);
            case MONGODB -> throw new IllegalArgumentException("No column types for " + database.getWireValue());
        };
    }

    /**
     * OpenAPI 3 schema object of a field type.
     */
    public ObjectNode toOpenApiSchema(FieldType type) {
        ObjectNode schema = JsonSupport.object();
        switch (type) {
            case STRING, TEXT -> schema.put("type", "string");
            case EMAIL -> schema.put("type", "string").put("format", "email");
            case URL -> schema.put("type", "string").put("format", "uri");
            case UUID -> schema.put("type", "string").put("format", "uuid");
            case DATE -> schema.put("type", "string").put("format", "date-time");
            case INTEGER -> schema.put("type", "integer");
            case NUMBER -> schema.put("type", "number");
            case FLOAT -> schema.put("type", "number").put("format", "float");
            case DECIMAL -> schema.put("type", "number").put("format", "double");
            case BOOLEAN -> schema.put("type", "boolean");
            case JSON -> schema.put("type", "object");
        }
        return schema;
    }

    /**
     * TypeScript literal used as test input. Fixed values so output stays reproducible.
     */
    public String sampleLiteral(FieldType type) {
        return switch (type) {
            case STRING -> "'test string'";
            case TEXT -> "'test text content'";
            case NUMBER, INTEGER -> "42";
            case FLOAT -> "42.5";
            case DECIMAL -> "42.99";
            case BOOLEAN -> "true";
            case DATE -> "'2024-01-01T00:00:00.000Z'";
            case EMAIL -> "'test@example.com'";
            case URL -> "'https://example.com'";
            case UUID -> "'123e4567-e89b-12d3-a456-426614174000'";
            case JSON -> "{ key: 'value' }";
        };
    }

    /**
     * A second literal, different from {@link #sampleLiteral(FieldType)}, used by update tests.
     */
    public String updatedSampleLiteral(FieldType type) {
        return switch (type) {
            case STRING -> "'updated string'";
            case TEXT -> "'updated text content'";
            case NUMBER, INTEGER -> "43";
            case FLOAT -> "43.5";
            case DECIMAL -> "43.99";
            case BOOLEAN -> "false";
            case DATE -> "'2024-02-01T00:00:00.000Z'";
            case EMAIL -> "'updated@example.com'";
            case URL -> "'https://example.org'";
            case UUID -> "'123e4567-e89b-12d3-a456-426614174001'";
            case JSON -> "{ key: 'updated' }";
        };
    }

    /**
     * express-validator type check appended to a {@code body('field')} chain.
     */
    public String validatorChain(FieldType type) {
        return switch (type) {
            case STRING, TEXT -> ".isString()";
            case EMAIL -> ".isEmail()";
            case URL -> ".isURL()";
            case UUID -> ".isUUID()";
            case INTEGER -> ".isInt()";
            case NUMBER, FLOAT, DECIMAL -> ".isNumeric()";
            case BOOLEAN -> ".isBoolean()";
            case DATE -> ".isISO8601()";
            case JSON -> ".isObject()";
        };
    }
}
