package com.guidestore.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guidestore.DocumentService;
import com.guidestore.JsonViews;
import com.guidestore.addressing.Address;
import com.guidestore.addressing.Namespace;
import com.guidestore.cache.DocumentRecord;
import com.guidestore.errors.AddressingException;
import com.guidestore.models.SectionEditRequest;
import com.guidestore.sections.Heading;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Arrays;
import java.util.List;

/**
 * Documents and sections.
 * Handles: list, view, create, delete, view section, section edits (single or batch)
 */
public class DocumentController implements Controller {

    private final DocumentService documents;
    private final ObjectMapper objectMapper;

    public DocumentController(DocumentService documents, ObjectMapper objectMapper) {
        this.documents = documents;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/documents", this::listDocuments);
        app.get("/api/document", this::getDocument);
        app.post("/api/document", this::createDocument);
        app.delete("/api/document", this::deleteDocument);
        app.get("/api/section", this::getSection);
        app.post("/api/sections", this::editSections);
    }

    private void listDocuments(Context ctx) {
        String ns = ctx.queryParam("namespace");
        List<Namespace> namespaces;
        if (ns == null || ns.isBlank()) {
            namespaces = Arrays.asList(Namespace.values());
        } else {
            namespaces = List.of(Arrays.stream(Namespace.values())
                .filter(n -> n.getFolder().equalsIgnoreCase(ns.trim()))
                .findFirst()
                .orElseThrow(() -> AddressingException.invalidParameter("namespace", "unknown namespace '" + ns + "'")));
        }
        ObjectNode root = objectMapper.createObjectNode();
        for (Namespace namespace : namespaces) {
            root.set(namespace.getFolder(), objectMapper.valueToTree(documents.listDocuments(namespace)));
        }
        ctx.json(root);
    }

    private void getDocument(Context ctx) {
        DocumentRecord record = documents.requireDocument(Controller.requireQuery(ctx, "path"));
        boolean includeContent = !"false".equalsIgnoreCase(ctx.queryParam("content"));
        ctx.json(JsonViews.document(objectMapper, record, includeContent));
    }

    private void createDocument(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String path = text(json, "path");
        if (path == null) {
            throw AddressingException.missingParameter("path");
        }
        DocumentRecord record = documents.createDocument(path, text(json, "title"), text(json, "content"));
        ctx.status(201).json(JsonViews.document(objectMapper, record, false));
    }

    private void deleteDocument(Context ctx) {
        String path = Controller.requireQuery(ctx, "path");
        documents.deleteDocument(path);
        ctx.json(objectMapper.createObjectNode().put("deleted", path));
    }

    private void getSection(Context ctx) {
        String path = Controller.requireQuery(ctx, "path");
        Address document = documents.resolver().resolve(path);
        String ref = ctx.queryParam("section");
        String slug = document.hasSection() && (ref == null || ref.isBlank())
            ? document.getSectionSlug()
            : documents.resolver().resolveSection(Controller.requireQuery(ctx, "section"), document.documentOnly()).getSectionSlug();
        DocumentRecord record = documents.requireDocument(document.documentOnly());
        Heading heading = record.getTree().require(slug);
        ctx.json(JsonViews.section(objectMapper, record.getPath(), heading, record.getTree().readSection(heading.getSlug())));
    }

    /**
     * Body is either one {@link SectionEditRequest} or
     * {@code {"document": ..., "operations": [...]}}.
     */
    private void editSections(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.isObject()) {
            throw AddressingException.invalidParameter("body", "expected a JSON object");
        }
        JsonNode operations = json.get("operations");
        if (operations != null && operations.isArray()) {
            String document = text(json, "document");
            if (document == null) {
                throw AddressingException.missingParameter("document");
            }
            List<SectionEditRequest> requests = Arrays.asList(
                objectMapper.treeToValue(operations, SectionEditRequest[].class));
            ctx.json(documents.editSections(document, requests));
            return;
        }
        ctx.json(documents.editSection(objectMapper.treeToValue(json, SectionEditRequest.class)));
    }

    static String text(JsonNode json, String field) {
        JsonNode node = json != null ? json.get(field) : null;
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
