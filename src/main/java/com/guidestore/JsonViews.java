package com.guidestore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guidestore.addressing.AddressResolver;
import com.guidestore.cache.DocumentRecord;
import com.guidestore.sections.Heading;
import com.guidestore.tasks.TaskEngine;
import com.guidestore.tasks.TaskRecord;
import com.guidestore.tasks.TaskSummary;

import java.util.List;

/**
 * JSON shapes shared by the HTTP and tool surfaces.
 */
public final class JsonViews {

    private JsonViews() {
    }

    /**
     * Path, title, version token, heading outline and, when the document has a
     * Tasks section, a task summary. Content only if {@code includeContent}.
     */
    public static ObjectNode document(ObjectMapper mapper, DocumentRecord record, boolean includeContent) {
        ObjectNode root = mapper.createObjectNode();
        root.put("path", record.getPath());
        root.put("userPath", AddressResolver.toUserPath(record.getPath()));
        root.put("title", record.getTitle());
        root.put("namespace", record.getNamespace().getFolder());
        root.put("version", record.getLoadedVersion().asToken());
        root.put("contentHash", record.getContentHash());
        root.put("wordCount", record.getWordCount());
        root.put("loadedAt", record.getLoadedAt().toString());
        root.set("headings", headings(mapper, record.getHeadings()));
        if (TaskEngine.findTasksSection(record.getTree()).isPresent()) {
            List<TaskRecord> tasks = TaskEngine.getTasks(record.getTree());
            root.set("tasks", mapper.valueToTree(TaskSummary.of(tasks, null)));
            TaskEngine.findNextAvailableTask(tasks, null)
                .ifPresent(next -> root.put("nextTask", next.getSlug()));
        }
        if (includeContent) {
            root.put("content", record.getContent());
        }
        return root;
    }

    public static ArrayNode headings(ObjectMapper mapper, List<Heading> headings) {
        ArrayNode array = mapper.createArrayNode();
        for (Heading h : headings) {
            ObjectNode node = array.addObject();
            node.put("slug", h.getSlug());
            node.put("path", h.getPath());
            node.put("title", h.getTitle());
            node.put("depth", h.getDepth());
        }
        return array;
    }

    public static ObjectNode section(ObjectMapper mapper, String document, Heading heading, String content) {
        ObjectNode root = mapper.createObjectNode();
        root.put("document", document);
        root.put("section", heading.getSlug());
        root.put("path", heading.getPath());
        root.put("title", heading.getTitle());
        root.put("depth", heading.getDepth());
        root.put("content", content);
        return root;
    }
}
