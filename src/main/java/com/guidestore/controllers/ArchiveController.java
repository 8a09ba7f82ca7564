package com.guidestore.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guidestore.archive.ArchiveManager;
import com.guidestore.errors.AddressingException;
import io.javalin.Javalin;
import io.javalin.http.Context;

public class ArchiveController implements Controller {

    private final ArchiveManager archives;
    private final ObjectMapper objectMapper;

    public ArchiveController(ArchiveManager archives, ObjectMapper objectMapper) {
        this.archives = archives;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/archive", this::archive);
    }

    private void archive(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String path = DocumentController.text(json, "path");
        if (path == null) {
            throw AddressingException.missingParameter("path");
        }
        String archivedBy = DocumentController.text(json, "archivedBy");
        if (archivedBy == null) {
            archivedBy = ctx.header("X-Agent-Id");
        }
        ctx.json(archives.archive(path, json.path("audit").asBoolean(false), archivedBy,
            DocumentController.text(json, "note")));
    }
}
