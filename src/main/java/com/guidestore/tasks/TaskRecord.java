package com.guidestore.tasks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Map;

/**
 * View over one task heading. Status lives in the section body as a
 * {@code - Status: value} line; this record is derived from it, never stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskRecord {

    private final String slug;
    private final String path;
    private final String title;
    private final int depth;
    private final TaskStatus status;
    private final String body;
    private final Map<String, String> fields;

    public TaskRecord(String slug, String path, String title, int depth, TaskStatus status, String body) {
        this.slug = slug;
        this.path = path;
        this.title = title;
        this.depth = depth;
        this.status = status;
        this.body = body;
        this.fields = Collections.unmodifiableMap(TaskFields.extractAll(body));
    }

    public String getSlug() {
        return slug;
    }

    public String getPath() {
        return path;
    }

    public String getTitle() {
        return title;
    }

    public int getDepth() {
        return depth;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public String getNote() {
        return TaskFields.extract(body, "Note").orElse(null);
    }

    public String getCompletedDate() {
        return TaskFields.extract(body, "Completed").orElse(null);
    }

    /** Case-insensitive marker lookup, e.g. {@code Phase} or {@code Category}. */
    public String getField(String key) {
        return TaskFields.extract(body, key).orElse(null);
    }

    public Map<String, String> getFields() {
        return fields;
    }

    @JsonIgnore
    public String getBody() {
        return body;
    }
}
