package com.guidestore.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guidestore.AppLogger;
import com.guidestore.DocumentService;
import com.guidestore.JsonViews;
import com.guidestore.addressing.Address;
import com.guidestore.archive.ArchiveManager;
import com.guidestore.cache.DocumentRecord;
import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ErrorCode;
import com.guidestore.errors.ErrorDetails;
import com.guidestore.errors.GuideStoreException;
import com.guidestore.models.SectionEditRequest;
import com.guidestore.sections.Heading;
import com.guidestore.tasks.TaskEngine;
import com.guidestore.tasks.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs parsed tool calls against the document, task and archive services.
 * Every outcome, success or failure, is a JSON string.
 */
public class ToolExecutionService {

    private static final AppLogger.Component LOG = AppLogger.forComponent("ToolExecutionService");

    private final DocumentService documents;
    private final TaskEngine tasks;
    private final ArchiveManager archives;
    private final ObjectMapper objectMapper;

    public ToolExecutionService(DocumentService documents, TaskEngine tasks, ArchiveManager archives, ObjectMapper objectMapper) {
        this.documents = documents;
        this.tasks = tasks;
        this.archives = archives;
        this.objectMapper = objectMapper;
    }

    public ToolExecutionResult execute(ToolCall call, ToolExecutionContext context) {
        if (call == null || call.getName() == null) {
            return error(AddressingException.missingParameter("tool"));
        }
        ToolExecutionContext ctx = context != null ? context : ToolExecutionContext.anonymous();
        String tool = call.getName();
        Map<String, Object> args = call.getArgs() != null ? call.getArgs() : Map.of();
        try {
            Object output;
            switch (tool) {
                case ToolSchemaRegistry.SECTION:
                    output = executeSection(args);
                    break;
                case ToolSchemaRegistry.VIEW_DOCUMENT:
                    output = executeViewDocument(args);
                    break;
                case ToolSchemaRegistry.VIEW_SECTION:
                    output = executeViewSection(args);
                    break;
                case ToolSchemaRegistry.CREATE_DOCUMENT:
                    output = JsonViews.document(objectMapper, documents.createDocument(
                        stringArg(args, "document"), stringArg(args, "title"), stringArg(args, "content")), false);
                    break;
                case ToolSchemaRegistry.DELETE_DOCUMENT:
                    documents.deleteDocument(stringArg(args, "document"));
                    output = objectMapper.createObjectNode().put("deleted", stringArg(args, "document"));
                    break;
                case ToolSchemaRegistry.RENAME_SECTION:
                    output = documents.renameSection(stringArg(args, "document"), stringArg(args, "section"),
                        stringArg(args, "title"));
                    break;
                case ToolSchemaRegistry.MOVE_SECTION:
                    output = documents.moveSection(stringArg(args, "from"), stringArg(args, "to"),
                        stringArg(args, "reference"), stringArg(args, "position"));
                    break;
                case ToolSchemaRegistry.MOVE_DOCUMENT: {
                    String from = stringArg(args, "from");
                    ObjectNode moved = JsonViews.document(objectMapper, documents.moveDocument(from, stringArg(args, "to")), false);
                    moved.put("movedFrom", documents.resolver().resolve(from).getDocumentPath());
                    output = moved;
                    break;
                }
                case ToolSchemaRegistry.TASK:
                    output = executeTask(args);
                    break;
                case ToolSchemaRegistry.START_TASK:
                    output = tasks.startTask(stringArg(args, "task"));
                    break;
                case ToolSchemaRegistry.COMPLETE_TASK:
                    output = tasks.completeTask(stringArg(args, "task"), stringArg(args, "note"),
                        boolArg(args, "return_next_task", false));
                    break;
                case ToolSchemaRegistry.COMPLETE_COORDINATOR_TASK:
                    output = tasks.completeNext(stringArg(args, "document"), stringArg(args, "note"),
                        boolArg(args, "return_next_task", false));
                    break;
                case ToolSchemaRegistry.ARCHIVE_DOCUMENT:
                    output = archives.archive(stringArg(args, "path"), boolArg(args, "audit", false),
                        ctx.getAgentId(), stringArg(args, "note"));
                    break;
                default:
                    return error(new AddressingException(ErrorCode.INVALID_PARAMETER, "Unknown tool: " + tool,
                        Map.of("tool", tool)));
            }
            LOG.debug("Tool " + tool + " ok (session=" + ctx.getSessionId() + ")");
            return ToolExecutionResult.ok(write(output));
        } catch (GuideStoreException e) {
            LOG.warn("Tool " + tool + " failed: " + e.getCode() + " " + e.getMessage());
            LOG.debug("Failed call: " + call.getRaw());
            return error(e);
        } catch (RuntimeException e) {
            LOG.error("Tool " + tool + " failed unexpectedly", e);
            return error(GuideStoreException.internal("Tool execution failed: " + tool, e));
        }
    }

    // -------------------------------------------------------------------------
    // Tools
    // -------------------------------------------------------------------------

    private Object executeSection(Map<String, Object> args) {
        String document = stringArg(args, "document");
        Object operations = args.get("operations");
        if (operations instanceof List) {
            List<SectionEditRequest> requests = new ArrayList<>();
            for (Object item : (List<?>) operations) {
                try {
                    requests.add(objectMapper.convertValue(item, SectionEditRequest.class));
                } catch (IllegalArgumentException e) {
                    throw AddressingException.invalidParameter("operations", "entry " + requests.size() + ": " + e.getMessage());
                }
            }
            return documents.editSections(document, requests);
        }
        SectionEditRequest request = new SectionEditRequest(document, stringArg(args, "operation"),
            stringArg(args, "section"), stringArg(args, "title"), stringArg(args, "content"));
        request.setDepth(intArg(args, "depth"));
        request.setVersion(stringArg(args, "version"));
        return documents.editSection(request);
    }

    private Object executeViewDocument(Map<String, Object> args) {
        DocumentRecord record = documents.requireDocument(stringArg(args, "document"));
        return JsonViews.document(objectMapper, record, boolArg(args, "include_content", true));
    }

    private Object executeViewSection(Map<String, Object> args) {
        Address document = documents.resolver().resolve(stringArg(args, "document")).documentOnly();
        String slug = documents.resolver().resolveSection(stringArg(args, "section"), document).getSectionSlug();
        DocumentRecord record = documents.requireDocument(document);
        Heading heading = record.getTree().require(slug);
        return JsonViews.section(objectMapper, record.getPath(), heading, record.getTree().readSection(heading.getSlug()));
    }

    private Object executeTask(Map<String, Object> args) {
        String document = stringArg(args, "document");
        String operation = stringArg(args, "operation");
        switch (operation) {
            case "list": {
                String status = stringArg(args, "status");
                TaskStatus filter = status == null ? null : TaskStatus.parse(status).orElseThrow(() ->
                    AddressingException.invalidParameter("status", "unknown status '" + status + "'"));
                ObjectNode root = objectMapper.createObjectNode();
                root.put("document", document);
                root.set("tasks", objectMapper.valueToTree(tasks.listTasks(document, filter)));
                return root;
            }
            case "create":
                return tasks.createTask(document, stringArg(args, "title"), stringArg(args, "content"),
                    stringArg(args, "after"));
            case "edit":
                return tasks.editTask(document, requireString(args, "section"), stringArg(args, "content"));
            case "next": {
                ObjectNode root = objectMapper.createObjectNode();
                root.put("document", document);
                root.set("nextTask", tasks.findNextAvailableTask(document, stringArg(args, "after"))
                    .map(t -> (JsonNode) objectMapper.valueToTree(t))
                    .orElse(objectMapper.nullNode()));
                root.put("allComplete", tasks.allTasksComplete(document));
                return root;
            }
            case "summary":
                return tasks.summarize(document, stringArg(args, "group_by"));
            default:
                throw AddressingException.invalidParameter("operation", "unknown task operation '" + operation + "'");
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private ToolExecutionResult error(GuideStoreException e) {
        ErrorDetails details = ErrorDetails.from(e);
        String body;
        try {
            body = objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException ex) {
            body = "{\"error\":\"" + details.getCode() + "\"}";
        }
        return ToolExecutionResult.error(body, details.getCode());
    }

    private String write(Object output) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw GuideStoreException.internal("Failed to serialize tool output", e);
        }
    }

    private static String stringArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? value.toString() : null;
    }

    private static String requireString(Map<String, Object> args, String key) {
        String value = stringArg(args, key);
        if (value == null || value.isBlank()) {
            throw AddressingException.missingParameter(key);
        }
        return value;
    }

    private static Integer intArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw AddressingException.invalidParameter(key, "not an integer: " + value);
            }
        }
        return null;
    }

    private static boolean boolArg(Map<String, Object> args, String key, boolean fallback) {
        Object value = args.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return fallback;
    }
}
