package com.tradingrisk.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradingrisk.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over the parsed rule file with nested-key lookups.
 *
 * <p>{@code require*} methods fail with {@link ConfigurationException} when the key is absent
 * or has the wrong type. {@code optional*} methods take the caller's default for absent keys
 * but still reject a present value of the wrong type.
 */
public class RuleDocument {

    private final JsonNode root;
    private final String source;

    public RuleDocument(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Rule file " + source + " must contain a mapping at the top level");
        }
        this.root = root;
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    /** Returns the node at the given path, or null if any segment is missing. */
    public JsonNode find(String... path) {
        JsonNode node = root;
        for (String key : path) {
            if (node == null || !node.isObject()) {
                return null;
            }
            node = node.get(key);
        }
        return node == null || node.isNull() ? null : node;
    }

    public JsonNode require(String... path) {
        JsonNode node = find(path);
        if (node == null) {
            throw new ConfigurationException("Missing required key '" + join(path) + "' in " + source);
        }
        return node;
    }

    public double requireDouble(String... path) {
        return asDouble(require(path), path);
    }

    public double optionalDouble(double defaultValue, String... path) {
        JsonNode node = find(path);
        return node == null ? defaultValue : asDouble(node, path);
    }

    public int requireInt(String... path) {
        JsonNode node = require(path);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw typeError(path, "an integer");
        }
        return node.intValue();
    }

    public int optionalInt(int defaultValue, String... path) {
        JsonNode node = find(path);
        if (node == null) {
            return defaultValue;
        }
        if (!node.isIntegralNumber()) {
            throw typeError(path, "an integer");
        }
        return node.intValue();
    }

    public boolean optionalBoolean(boolean defaultValue, String... path) {
        JsonNode node = find(path);
        if (node == null) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw typeError(path, "a boolean");
        }
        return node.booleanValue();
    }

    public String requireText(String... path) {
        JsonNode node = require(path);
        if (!node.isTextual() || node.textValue().isBlank()) {
            throw typeError(path, "a non-empty string");
        }
        return node.textValue();
    }

    public String optionalText(String defaultValue, String... path) {
        JsonNode node = find(path);
        if (node == null) {
            return defaultValue;
        }
        if (!node.isTextual()) {
            throw typeError(path, "a string");
        }
        return node.textValue();
    }

    /** Returns the elements of a sequence, or an empty list when the key is absent. */
    public List<JsonNode> optionalList(String... path) {
        JsonNode node = find(path);
        if (node == null) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw typeError(path, "a list");
        }
        List<JsonNode> items = new ArrayList<>();
        node.forEach(items::add);
        return items;
    }

    /** Returns the entries of a mapping in file order, or an empty map when the key is absent. */
    public Map<String, JsonNode> optionalMap(String... path) {
        JsonNode node = find(path);
        if (node == null) {
            return Collections.emptyMap();
        }
        if (!node.isObject()) {
            throw typeError(path, "a mapping");
        }
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> entries.put(entry.getKey(), entry.getValue()));
        return entries;
    }

    private double asDouble(JsonNode node, String... path) {
        if (!node.isNumber() || !Double.isFinite(node.doubleValue())) {
            throw typeError(path, "a number");
        }
        return node.doubleValue();
    }

    private ConfigurationException typeError(String[] path, String expected) {
        return new ConfigurationException("Key '" + join(path) + "' in " + source + " must be " + expected);
    }

    private static String join(String... path) {
        return String.join(".", path);
    }
}
