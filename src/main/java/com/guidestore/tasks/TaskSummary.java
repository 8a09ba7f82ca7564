package com.guidestore.tasks;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task counts by status and, optionally, by the value of one marker field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskSummary {

    static final String UNASSIGNED = "unassigned";

    private final int total;
    private final Map<String, Integer> byStatus;
    private final String groupField;
    private final Map<String, Map<String, Integer>> byGroup;

    private TaskSummary(int total, Map<String, Integer> byStatus, String groupField,
                        Map<String, Map<String, Integer>> byGroup) {
        this.total = total;
        this.byStatus = byStatus;
        this.groupField = groupField;
        this.byGroup = byGroup;
    }

    public static TaskSummary of(List<TaskRecord> tasks, String groupField) {
        Map<String, Integer> byStatus = emptyCounts();
        Map<String, Map<String, Integer>> byGroup = groupField == null ? null : new LinkedHashMap<>();
        for (TaskRecord task : tasks) {
            byStatus.merge(task.getStatus().getValue(), 1, Integer::sum);
            if (byGroup != null) {
                String value = task.getField(groupField);
                String group = value == null || value.isBlank() ? UNASSIGNED : value;
                byGroup.computeIfAbsent(group, k -> emptyCounts()).merge(task.getStatus().getValue(), 1, Integer::sum);
            }
        }
        return new TaskSummary(tasks.size(), byStatus, groupField, byGroup);
    }

    private static Map<String, Integer> emptyCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status.getValue(), 0);
        }
        return counts;
    }

    public int getTotal() {
        return total;
    }

    public int count(TaskStatus status) {
        return byStatus.getOrDefault(status.getValue(), 0);
    }

    public Map<String, Integer> getByStatus() {
        return byStatus;
    }

    public String getGroupField() {
        return groupField;
    }

    public Map<String, Map<String, Integer>> getByGroup() {
        return byGroup;
    }
}
