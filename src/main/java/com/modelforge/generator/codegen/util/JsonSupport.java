package com.modelforge.generator.codegen.util;

import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper and canonical JSON printing for emitted manifests and documents.
 *
 * Unknown properties are ignored when binding, so models exported by the editor with extra layout data still load.
 */
public class JsonSupport {

    public static final String DEFAULT_INDENT = "  ";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonSupport() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    public static ArrayNode array() {
        return MAPPER.createArrayNode();
    }

    public static String print(JsonNode node) {
        return print(node, DEFAULT_INDENT);
    }

    /**
     * Prints with the given indent unit, without a trailing newline.
     */
    public static String print(JsonNode node, String indentUnit) {
        try {
            return MAPPER.writer(new CanonicalPrettyPrinter(indentUnit)).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot print JSON document", e);
        }
    }

    /**
     * Strict parse: trailing content after the document is an error.
     */
    public static JsonNode parse(String text) throws JsonProcessingException {
        return MAPPER.readTree(text);
    }
}
