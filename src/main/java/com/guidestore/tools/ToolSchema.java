package com.guidestore.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Argument schema of one tool. Validation is strict: unknown arguments,
 * missing required ones and wrong types are all rejected.
 */
public class ToolSchema {
    private final String toolId;
    private final Map<String, ToolArgSpec> args = new LinkedHashMap<>();
    // Alias -> canonical arg name
    private final Map<String, String> argAliases = new LinkedHashMap<>();

    public ToolSchema(String toolId) {
        this.toolId = toolId;
    }

    public ToolSchema arg(String name, ToolArgSpec.Type type, boolean required) {
        args.put(name, new ToolArgSpec(name, type, required));
        return this;
    }

    public ToolSchema arg(String name, ToolArgSpec.Type type, boolean required, Set<String> allowedValues) {
        args.put(name, new ToolArgSpec(name, type, required, allowedValues));
        return this;
    }

    public ToolSchema alias(String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || !args.containsKey(canonical)) {
            return this;
        }
        argAliases.put(normalizeArgKey(alias), canonical);
        return this;
    }

    public String getToolId() {
        return toolId;
    }

    public Map<String, ToolArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    /**
     * Copy of {@code argsNode} with keys trimmed and case/separator variants
     * or declared aliases mapped onto canonical names.
     */
    public JsonNode normalizeArgsNode(JsonNode argsNode) {
        if (argsNode == null || !argsNode.isObject()) {
            return argsNode;
        }
        ObjectNode obj = ((ObjectNode) argsNode).deepCopy();
        List<String> keys = new ArrayList<>();
        obj.fieldNames().forEachRemaining(keys::add);
        for (String key : keys) {
            if (args.containsKey(key)) {
                continue;
            }
            String norm = normalizeArgKey(key);
            String canonical = args.containsKey(norm) ? norm : argAliases.get(norm);
            if (canonical == null) {
                continue;
            }
            if (!obj.has(canonical)) {
                obj.set(canonical, obj.get(key));
            }
            obj.remove(key);
        }
        return obj;
    }

    private static String normalizeArgKey(String key) {
        if (key == null) return "";
        return key.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    /** Null when valid, otherwise the first problem found. */
    public String validate(JsonNode argsNode) {
        JsonNode normalized = normalizeArgsNode(argsNode);
        if (normalized == null || !normalized.isObject()) {
            return "args-not-object";
        }
        for (ToolArgSpec spec : args.values()) {
            String error = spec.validate(normalized.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown-arg:" + field;
            }
        }
        return null;
    }
}
