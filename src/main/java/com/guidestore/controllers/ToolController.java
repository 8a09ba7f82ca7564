package com.guidestore.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guidestore.AppLogger;
import com.guidestore.errors.ErrorCode;
import com.guidestore.tools.ToolArgSpec;
import com.guidestore.tools.ToolCallParseResult;
import com.guidestore.tools.ToolCallParser;
import com.guidestore.tools.ToolExecutionContext;
import com.guidestore.tools.ToolExecutionResult;
import com.guidestore.tools.ToolExecutionService;
import com.guidestore.tools.ToolSchemaRegistry;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Agent tool boundary: the body is one raw tool call
 * {@code {"tool": ..., "args": {...}}}, parsed strictly before dispatch.
 */
public class ToolController implements Controller {

    private static final AppLogger.Component LOG = AppLogger.forComponent("ToolController");

    private final ToolSchemaRegistry registry;
    private final ToolCallParser parser;
    private final ToolExecutionService executor;
    private final ObjectMapper objectMapper;

    public ToolController(ToolSchemaRegistry registry, ToolCallParser parser, ToolExecutionService executor,
                          ObjectMapper objectMapper) {
        this.registry = registry;
        this.parser = parser;
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/tools", this::listTools);
        app.post("/api/tools", this::invoke);
    }

    private void listTools(Context ctx) {
        ObjectNode root = objectMapper.createObjectNode();
        for (String toolId : registry.getToolIds()) {
            ObjectNode args = root.putObject(toolId);
            for (ToolArgSpec spec : registry.getSchema(toolId).getArgSpecs().values()) {
                ObjectNode arg = args.putObject(spec.getName());
                arg.put("type", spec.getType().name().toLowerCase());
                arg.put("required", spec.isRequired());
                if (!spec.getAllowedValues().isEmpty()) {
                    ArrayNode allowed = arg.putArray("allowed");
                    spec.getAllowedValues().stream().sorted().forEach(allowed::add);
                }
            }
        }
        ctx.json(root);
    }

    private void invoke(Context ctx) {
        ToolCallParseResult parsed = parser.parse(ctx.body());
        if (!parsed.isToolCall()) {
            LOG.warn("Rejected tool call: " + parsed.getErrorCode()
                + (parsed.getErrorDetail() != null ? " (" + parsed.getErrorDetail() + ")" : ""));
            ObjectNode body = objectMapper.createObjectNode();
            body.put("error", parsed.getErrorCode());
            if (parsed.getErrorDetail() != null) {
                body.put("detail", parsed.getErrorDetail());
            }
            ctx.status(400).json(body);
            return;
        }
        ToolExecutionContext context = new ToolExecutionContext(ctx.header("X-Session-Id"), ctx.header("X-Agent-Id"));
        ToolExecutionResult result = executor.execute(parsed.getCall(), context);
        ctx.status(result.isOk() ? 200 : ErrorCode.valueOf(result.getError()).getHttpStatus()).contentType("application/json").result(result.getOutput());
    }
}
