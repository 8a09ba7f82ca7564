package com.guidestore.tasks;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * pending -> in_progress -> completed, plus pending -> completed.
 * Nothing moves back.
 */
public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Pending and in-progress tasks can be picked up next. */
    public boolean isActionable() {
        return this != COMPLETED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        switch (this) {
            case PENDING:
                return next == IN_PROGRESS || next == COMPLETED;
            case IN_PROGRESS:
                return next == COMPLETED;
            default:
                return false;
        }
    }

    /**
     * Parses a marker value such as {@code in-progress}, {@code In Progress}
     * or {@code completed ✅}. Empty for values outside the vocabulary.
     */
    public static Optional<TaskStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String v = raw.trim().toLowerCase(Locale.ROOT)
            .replace('-', '_')
            .replace(' ', '_')
            .replaceAll("[^a-z_]", "")
            .replaceAll("^_+|_+$", "");
        switch (v) {
            case "pending":
            case "todo":
            case "not_started":
                return Optional.of(PENDING);
            case "in_progress":
            case "inprogress":
            case "started":
                return Optional.of(IN_PROGRESS);
            case "completed":
            case "complete":
            case "done":
                return Optional.of(COMPLETED);
            default:
                return Optional.empty();
        }
    }
}
