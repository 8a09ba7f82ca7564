package com.guidestore.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Parses a single {@code {"tool": ..., "args": {...}}} object into a
 * validated {@link ToolCall}. A single surrounding code fence and invisible
 * edge characters are tolerated; prose or more than one object is not.
 */
public class ToolCallParser {
    public static final String ERR_INVALID_FORMAT = "tool_call_invalid_format";
    public static final String ERR_MULTIPLE = "tool_call_multiple";
    public static final String ERR_UNKNOWN_TOOL = "tool_call_unknown_tool";
    public static final String ERR_INVALID_ARGS = "tool_call_invalid_args";

    private static final Map<String, String> TOOL_ALIASES = buildToolAliases();

    private final ObjectMapper objectMapper;
    private final ToolSchemaRegistry schemaRegistry;

    public ToolCallParser(ObjectMapper objectMapper, ToolSchemaRegistry schemaRegistry) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.schemaRegistry = schemaRegistry;
    }

    public ToolCallParseResult parse(String content) {
        if (content == null || content.isBlank()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "empty");
        }
        String trimmed = stripInvisibleEdgeChars(unwrapJsonCodeFence(content.trim()));
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "not-an-object");
        }
        if (containsMultipleJsonObjects(trimmed)) {
            return ToolCallParseResult.error(ERR_MULTIPLE);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (Exception e) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "malformed-json");
        }
        if (node == null || !node.isObject()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT);
        }
        JsonNode toolNode = node.get("tool");
        JsonNode argsNode = node.get("args");
        if (toolNode == null || !toolNode.isTextual() || argsNode == null || !argsNode.isObject()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT);
        }
        Iterator<String> fields = node.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!"tool".equals(field) && !"args".equals(field)) {
                return ToolCallParseResult.error(ERR_INVALID_FORMAT, "unknown-field:" + field);
            }
        }
        String toolRaw = toolNode.asText().trim();
        if (toolRaw.isEmpty()) {
            return ToolCallParseResult.error(ERR_INVALID_FORMAT, "blank-tool");
        }
        String tool = canonicalToolId(toolRaw);
        if (tool == null) {
            return ToolCallParseResult.error(ERR_UNKNOWN_TOOL, "unknown-tool:" + truncate(toolRaw, 60));
        }
        ToolSchema schema = schemaRegistry.getSchema(tool);
        JsonNode normalizedArgs = schema.normalizeArgsNode(argsNode);
        String validationError = schema.validate(normalizedArgs);
        if (validationError != null) {
            return ToolCallParseResult.error(ERR_INVALID_ARGS, validationError);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> args = objectMapper.convertValue(normalizedArgs, Map.class);
        return ToolCallParseResult.call(new ToolCall(tool, args, trimmed));
    }

    /** Registry id for {@code raw}, tolerating case, '-' separators and a few aliases; null if unknown. */
    String canonicalToolId(String raw) {
        if (schemaRegistry == null) {
            return null;
        }
        if (schemaRegistry.hasTool(raw)) {
            return raw;
        }
        String underscored = raw.toLowerCase().replace('-', '_').replace(' ', '_');
        if (schemaRegistry.hasTool(underscored)) {
            return underscored;
        }
        String alias = TOOL_ALIASES.get(underscored);
        return alias != null && schemaRegistry.hasTool(alias) ? alias : null;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }

    private static String unwrapJsonCodeFence(String trimmed) {
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        // Exactly one fenced block, nothing around it.
        String[] lines = trimmed.split("\n", -1);
        if (lines.length < 3 || !"```".equals(lines[lines.length - 1].trim())) {
            return trimmed;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < lines.length - 1; i++) {
            sb.append(lines[i]);
            if (i < lines.length - 2) {
                sb.append('\n');
            }
        }
        return sb.toString().trim();
    }

    private static boolean isInvisible(char c) {
        return c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060';
    }

    private static String stripInvisibleEdgeChars(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isInvisible(value.charAt(start))) {
            start++;
        }
        while (end > start && isInvisible(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end).trim();
    }

    /** Brace scan that ignores braces inside JSON strings. */
    private static boolean containsMultipleJsonObjects(String trimmed) {
        int depth = 0;
        boolean seenObject = false;
        boolean inString = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
                if (depth == 1 && seenObject) {
                    return true;
                }
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
                if (depth == 0) {
                    seenObject = true;
                }
            }
        }
        return false;
    }

    private static Map<String, String> buildToolAliases() {
        // Small, high-confidence list; anything else stays unknown.
        HashMap<String, String> map = new HashMap<>();
        map.put("edit_section", ToolSchemaRegistry.SECTION);
        map.put("sections", ToolSchemaRegistry.SECTION);
        map.put("read_section", ToolSchemaRegistry.VIEW_SECTION);
        map.put("get_section", ToolSchemaRegistry.VIEW_SECTION);
        map.put("read_document", ToolSchemaRegistry.VIEW_DOCUMENT);
        map.put("view_doc", ToolSchemaRegistry.VIEW_DOCUMENT);
        map.put("tasks", ToolSchemaRegistry.TASK);
        map.put("finish_task", ToolSchemaRegistry.COMPLETE_TASK);
        map.put("archive", ToolSchemaRegistry.ARCHIVE_DOCUMENT);
        map.put("move_section", ToolSchemaRegistry.MOVE_SECTION);
        map.put("rename_document", ToolSchemaRegistry.MOVE_DOCUMENT);
        return Collections.unmodifiableMap(map);
    }
}
