package com.guidestore.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guidestore.errors.AddressingException;
import com.guidestore.tasks.TaskEngine;
import com.guidestore.tasks.TaskStatus;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Task lists inside documents.
 * Handles: list/next/summary, create, start, ad hoc completion, coordinator completion
 */
public class TaskController implements Controller {

    private final TaskEngine tasks;
    private final ObjectMapper objectMapper;

    public TaskController(TaskEngine tasks, ObjectMapper objectMapper) {
        this.tasks = tasks;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/tasks", this::getTasks);
        app.post("/api/tasks", this::createTask);
        app.post("/api/tasks/start", this::startTask);
        app.post("/api/tasks/complete", this::completeTask);
        app.post("/api/coordinator/complete", this::completeCoordinatorTask);
    }

    private void getTasks(Context ctx) {
        String path = Controller.requireQuery(ctx, "path");
        String view = ctx.queryParam("view");
        if ("next".equals(view)) {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("document", path);
            root.set("nextTask", tasks.findNextAvailableTask(path, ctx.queryParam("after"))
                .map(t -> (JsonNode) objectMapper.valueToTree(t))
                .orElse(objectMapper.nullNode()));
            root.put("allComplete", tasks.allTasksComplete(path));
            ctx.json(root);
            return;
        }
        if ("summary".equals(view)) {
            ctx.json(tasks.summarize(path, ctx.queryParam("groupBy")));
            return;
        }
        String status = ctx.queryParam("status");
        TaskStatus filter = status == null || status.isBlank() ? null : TaskStatus.parse(status).orElseThrow(() ->
            AddressingException.invalidParameter("status", "unknown status '" + status + "'"));
        ObjectNode root = objectMapper.createObjectNode();
        root.put("document", path);
        root.set("tasks", objectMapper.valueToTree(tasks.listTasks(path, filter)));
        ctx.json(root);
    }

    private void createTask(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String path = requireText(json, "path");
        ctx.status(201).json(tasks.createTask(path, DocumentController.text(json, "title"),
            DocumentController.text(json, "content"), DocumentController.text(json, "after")));
    }

    private void startTask(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        ctx.json(tasks.startTask(requireText(json, "task")));
    }

    private void completeTask(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        ctx.json(tasks.completeTask(requireText(json, "task"), DocumentController.text(json, "note"),
            json.path("returnNextTask").asBoolean(false)));
    }

    private void completeCoordinatorTask(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        ctx.json(tasks.completeNext(DocumentController.text(json, "path"), DocumentController.text(json, "note"),
            json.path("returnNextTask").asBoolean(false)));
    }

    private static String requireText(JsonNode json, String field) {
        String value = DocumentController.text(json, field);
        if (value == null) {
            throw AddressingException.missingParameter(field);
        }
        return value;
    }
}
