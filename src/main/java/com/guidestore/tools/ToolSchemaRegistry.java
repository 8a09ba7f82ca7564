package com.guidestore.tools;

import com.guidestore.sections.SectionOperation;
import com.guidestore.tasks.TaskStatus;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class ToolSchemaRegistry {

    public static final String SECTION = "section";
    public static final String VIEW_DOCUMENT = "view_document";
    public static final String VIEW_SECTION = "view_section";
    public static final String CREATE_DOCUMENT = "create_document";
    public static final String DELETE_DOCUMENT = "delete_document";
    public static final String RENAME_SECTION = "rename_section";
    public static final String MOVE_SECTION = "move";
    public static final String MOVE_DOCUMENT = "move_document";
    public static final String TASK = "task";
    public static final String START_TASK = "start_task";
    public static final String COMPLETE_TASK = "complete_task";
    public static final String COMPLETE_COORDINATOR_TASK = "complete_coordinator_task";
    public static final String ARCHIVE_DOCUMENT = "archive_document";

    static final Set<String> TASK_OPERATIONS = Set.of("list", "create", "edit", "next", "summary");
    static final Set<String> MOVE_POSITIONS = Set.of("before", "after", "child");

    private final Map<String, ToolSchema> schemas = new LinkedHashMap<>();

    public ToolSchemaRegistry register(ToolSchema schema) {
        if (schema != null && schema.getToolId() != null) {
            schemas.put(schema.getToolId(), schema);
        }
        return this;
    }

    public boolean hasTool(String toolId) {
        return toolId != null && schemas.containsKey(toolId);
    }

    public ToolSchema getSchema(String toolId) {
        return toolId != null ? schemas.get(toolId) : null;
    }

    public Set<String> getToolIds() {
        return Collections.unmodifiableSet(schemas.keySet());
    }

    /** Schemas of every tool {@link ToolExecutionService} dispatches. */
    public static ToolSchemaRegistry defaults() {
        Set<String> sectionOps = Arrays.stream(SectionOperation.values())
            .map(SectionOperation::getValue)
            .collect(Collectors.toSet());
        Set<String> statuses = Arrays.stream(TaskStatus.values())
            .map(TaskStatus::getValue)
            .collect(Collectors.toSet());

        return new ToolSchemaRegistry()
            .register(new ToolSchema(SECTION)
                .arg("document", ToolArgSpec.Type.STRING, true)
                .arg("operation", ToolArgSpec.Type.STRING, false, sectionOps)
                .arg("section", ToolArgSpec.Type.STRING, false)
                .arg("title", ToolArgSpec.Type.STRING, false)
                .arg("content", ToolArgSpec.Type.STRING, false)
                .arg("depth", ToolArgSpec.Type.INT, false)
                .arg("version", ToolArgSpec.Type.STRING, false)
                .arg("operations", ToolArgSpec.Type.OBJECT_ARRAY, false)
                .alias("path", "document")
                .alias("slug", "section"))
            .register(new ToolSchema(VIEW_DOCUMENT)
                .arg("document", ToolArgSpec.Type.STRING, true)
                .arg("include_content", ToolArgSpec.Type.BOOLEAN, false)
                .alias("path", "document"))
            .register(new ToolSchema(VIEW_SECTION)
                .arg("document", ToolArgSpec.Type.STRING, true)
                .arg("section", ToolArgSpec.Type.STRING, true)
                .alias("path", "document")
                .alias("slug", "section"))
            .register(new ToolSchema(CREATE_DOCUMENT)
                .arg("document", ToolArgSpec.Type.STRING, true)
                .arg("title", ToolArgSpec.Type.STRING, true)
                .arg("content", ToolArgSpec.Type.STRING, false)
                .alias("path", "document"))
            .register(new ToolSchema(DELETE_DOCUMENT)
                .arg("document", ToolArgSpec.Type.STRING, true)
                .alias("path", "document"))
            .register(new ToolSchema(RENAME_SECTION)
                .arg("document", ToolArgSpec.Type.STRING, true)
                .arg("section", ToolArgSpec.Type.STRING, true)
                .arg("title", ToolArgSpec.Type.STRING, true)
                .alias("path", "document"))
            .register(new ToolSchema(MOVE_SECTION)
                .arg("from", ToolArgSpec.Type.STRING, true)
                .arg("to", ToolArgSpec.Type.STRING, true)
                .arg("reference", ToolArgSpec.Type.STRING, true)
                .arg("position", ToolArgSpec.Type.STRING, true, MOVE_POSITIONS))
            .register(new ToolSchema(MOVE_DOCUMENT)
                .arg("from", ToolArgSpec.Type.STRING, true)
                .arg("to", ToolArgSpec.Type.STRING, true))
            .register(new ToolSchema(TASK)
                .arg("document", ToolArgSpec.Type.STRING, true)
                .arg("operation", ToolArgSpec.Type.STRING, true, TASK_OPERATIONS)
                .arg("status", ToolArgSpec.Type.STRING, false, statuses)
                .arg("section", ToolArgSpec.Type.STRING, false)
                .arg("title", ToolArgSpec.Type.STRING, false)
                .arg("content", ToolArgSpec.Type.STRING, false)
                .arg("after", ToolArgSpec.Type.STRING, false)
                .arg("group_by", ToolArgSpec.Type.STRING, false)
                .alias("path", "document"))
            .register(new ToolSchema(START_TASK)
                .arg("task", ToolArgSpec.Type.STRING, true))
            .register(new ToolSchema(COMPLETE_TASK)
                .arg("task", ToolArgSpec.Type.STRING, true)
                .arg("note", ToolArgSpec.Type.STRING, true)
                .arg("return_next_task", ToolArgSpec.Type.BOOLEAN, false))
            .register(new ToolSchema(COMPLETE_COORDINATOR_TASK)
                .arg("note", ToolArgSpec.Type.STRING, true)
                .arg("document", ToolArgSpec.Type.STRING, false)
                .arg("return_next_task", ToolArgSpec.Type.BOOLEAN, false))
            .register(new ToolSchema(ARCHIVE_DOCUMENT)
                .arg("path", ToolArgSpec.Type.STRING, true)
                .arg("audit", ToolArgSpec.Type.BOOLEAN, false)
                .arg("note", ToolArgSpec.Type.STRING, false)
                .alias("document", "path"));
    }
}
