package com.modelforge.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.modelforge.generator.codegen.model.input.Model;

/**
 * Naming conventions of the emitted project.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts kebab-case, snake_case or space separated words to PascalCase. Already PascalCase input is kept.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_\\s]+"))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
                .collect(Collectors.joining(""));
    }

    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * OrderItem to order_item.
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        result = result.replaceAll("[-\\s]+", "_");
        return result.toLowerCase(Locale.ROOT);
    }

    public static String toScreamingSnakeCase(String name) {
        String snake = toSnakeCase(name);
        return snake == null ? null : snake.toUpperCase(Locale.ROOT);
    }

    /**
     * URL segment and route module name of a model: its name lower-cased.
     */
    public static String routeSegment(Model model) {
        return model.getName().toLowerCase(Locale.ROOT);
    }

    /**
     * Table override from the metadata, otherwise the pluralized snake_case name.
     */
    public static String tableName(Model model) {
        String override = model.getMetadata().getTableName();
        if (override != null && !override.isBlank()) {
            return override;
        }
        return pluralize(toSnakeCase(model.getName()));
    }

    public static String pluralize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        if (word.endsWith("s") || word.endsWith("x") || word.endsWith("ch") || word.endsWith("sh")) {
            return word + "es";
        }
        if (word.endsWith("y") && word.length() > 1 && "aeiou".indexOf(word.charAt(word.length() - 2)) < 0) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        return word + "s";
    }

    /**
     * Single-quoted TypeScript string literal.
     */
    public static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
