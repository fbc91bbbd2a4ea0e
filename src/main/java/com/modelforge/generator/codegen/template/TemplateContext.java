package com.modelforge.generator.codegen.template;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.modelforge.generator.codegen.util.JsonSupport;

/**
 * Variable scope a template is rendered against.
 *
 * A context is a flat name to value map. Iteration creates a child context: the outer values overlaid with the
 * current element's properties and a {@code this} alias for the element itself. Elements other than maps are read
 * through their Jackson JSON properties, so records and getter-based value objects work too. Scalars and lists
 * have no properties.
 */
public final class TemplateContext {

    public static final String THIS = "this";

    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {
    };

    private final Map<String, Object> values;

    private TemplateContext(Map<String, Object> values) {
        this.values = values;
    }

    public static TemplateContext empty() {
        return new TemplateContext(Map.of());
    }

    public static TemplateContext of(Map<String, ?> values) {
        return new TemplateContext(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Child scope for one iteration element.
     */
    public TemplateContext overlay(Object element) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(propertiesOf(element));
        merged.put(THIS, element);
        return new TemplateContext(Collections.unmodifiableMap(merged));
    }

    public Optional<Object> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Resolves a dotted path such as {@code model.name}; empty when any segment is missing or null.
     */
    public Optional<Object> resolve(String path) {
        String[] segments = path.split("\\.");
        Object current = values.get(segments[0]);
        for (int i = 1; i < segments.length && current != null; i++) {
            current = propertyOf(current, segments[i]);
        }
        return Optional.ofNullable(current);
    }

    /**
     * Only {@code null}, {@code false}, zero, NaN and the empty string are falsy. Empty lists and maps count as true.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0d && !Double.isNaN(n.doubleValue());
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        return true;
    }

    private static Map<String, Object> propertiesOf(Object element) {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (element instanceof Map<?, ?> map) {
            map.forEach((k, v) -> properties.put(String.valueOf(k), v));
        } else if (element != null && !isScalar(element)) {
            try {
                properties.putAll(JsonSupport.mapper().convertValue(element, PROPERTIES));
            } catch (IllegalArgumentException e) {
                // Not a JSON object: no properties, paths through it stay unresolved
                return Map.of();
            }
        }
        return properties;
    }

    private static Object propertyOf(Object target, String name) {
        return propertiesOf(target).get(name);
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?> || value instanceof Collection<?>;
    }
}
