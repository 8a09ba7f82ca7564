package com.guidestore.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Set;

/**
 * Declared type and constraints of one tool argument.
 */
public class ToolArgSpec {
    public enum Type {
        STRING,
        INT,
        BOOLEAN,
        OBJECT_ARRAY
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final Set<String> allowedValues;

    public ToolArgSpec(String name, Type type, boolean required) {
        this(name, type, required, null);
    }

    public ToolArgSpec(String name, Type type, boolean required, Set<String> allowedValues) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.allowedValues = allowedValues;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public Set<String> getAllowedValues() {
        return allowedValues == null ? Set.of() : Collections.unmodifiableSet(allowedValues);
    }

    /** Null when valid, otherwise {@code missing-required:x}, {@code invalid-type:x} or {@code invalid-enum:x}. */
    public String validate(JsonNode node) {
        if (node == null || node.isNull()) {
            return required ? "missing-required:" + name : null;
        }
        switch (type) {
            case STRING:
                if (!node.isTextual()) {
                    return "invalid-type:" + name;
                }
                if (required && node.asText().isBlank()) {
                    return "missing-required:" + name;
                }
                if (allowedValues != null && !allowedValues.isEmpty() && !allowedValues.contains(node.asText())) {
                    return "invalid-enum:" + name;
                }
                return null;
            case INT:
                return node.isIntegralNumber() && node.canConvertToInt() ? null : "invalid-type:" + name;
            case BOOLEAN:
                return node.isBoolean() ? null : "invalid-type:" + name;
            case OBJECT_ARRAY:
                if (!node.isArray()) {
                    return "invalid-type:" + name;
                }
                for (JsonNode child : node) {
                    if (!child.isObject()) {
                        return "invalid-type:" + name;
                    }
                }
                return null;
            default:
                return "invalid-type:" + name;
        }
    }
}
