package com.deskclaw.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Utility functions for reading tool parameters from JSON input and rendering
 * results.
 */
public final class ToolParamUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ToolParamUtils() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // --- String param ---

    /**
     * Read a string parameter from the JSON params node.
     *
     * @param params   JSON parameter node
     * @param key      parameter key
     * @param required if true, throws when missing
     * @return trimmed string value, or null if absent and not required
     */
    public static String readStringParam(JsonNode params, String key, boolean required) {
        if (params == null || !params.has(key)) {
            if (required)
                throw new IllegalArgumentException(key + " required");
            return null;
        }
        JsonNode node = params.get(key);
        if (!node.isTextual()) {
            if (required)
                throw new IllegalArgumentException(key + " required");
            return null;
        }
        String value = node.asText().trim();
        if (value.isEmpty()) {
            if (required)
                throw new IllegalArgumentException(key + " required");
            return null;
        }
        return value;
    }

    public static String readStringParam(JsonNode params, String key) {
        return readStringParam(params, key, false);
    }

    // --- Number param ---

    /**
     * Read a numeric parameter. Numeric strings are accepted.
     */
    public static Number readNumberParam(JsonNode params, String key) {
        if (params == null || !params.has(key)) {
            return null;
        }
        JsonNode node = params.get(key);
        if (node.isNumber()) {
            return node.isInt() || node.isLong() ? node.asLong() : node.asDouble();
        }
        if (node.isTextual()) {
            String trimmed = node.asText().trim();
            if (!trimmed.isEmpty()) {
                try {
                    return Double.parseDouble(trimmed);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    public static int readIntParam(JsonNode params, String key, int defaultValue) {
        Number n = readNumberParam(params, key);
        return n != null ? n.intValue() : defaultValue;
    }

    // --- Boolean param ---

    public static boolean readBoolParam(JsonNode params, String key, boolean defaultValue) {
        if (params == null || !params.has(key))
            return defaultValue;
        JsonNode node = params.get(key);
        if (node.isBoolean())
            return node.asBoolean();
        if (node.isTextual())
            return "true".equalsIgnoreCase(node.asText().trim());
        return defaultValue;
    }

    // --- Results ---

    /**
     * Build a JSON tool result with a compact text rendering alongside.
     */
    public static DesktopTool.ToolResult jsonResult(Object payload, String compact) {
        return DesktopTool.ToolResult.ok(toJsonString(payload), payload, compact);
    }

    /**
     * Serialize an object to a pretty-printed JSON string.
     */
    public static String toJsonString(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
