package com.guidestore.tasks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.guidestore.addressing.AddressResolver;
import com.guidestore.archive.ArchiveRecord;
import com.guidestore.sections.SectionTree;
import com.guidestore.storage.FileVersion;

/**
 * Result of completing one task. When the completion emptied an
 * auto-archiving document, {@code archived} is set and {@code archivedTo}
 * names the new location.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskCompletion {

    private final String document;
    private final TaskRecord completedTask;
    private final FileVersion version;
    private final boolean allComplete;
    private TaskRecord nextTask;
    private final SectionTree treeAfter;
    private ArchiveRecord archive;
    private String archiveSkipped;

    TaskCompletion(String document, TaskRecord completedTask, FileVersion version, boolean allComplete,
                   SectionTree treeAfter) {
        this.document = document;
        this.completedTask = completedTask;
        this.version = version;
        this.allComplete = allComplete;
        this.treeAfter = treeAfter;
    }

    public String getDocument() {
        return document;
    }

    public String getUserPath() {
        return AddressResolver.toUserPath(document);
    }

    public TaskRecord getCompletedTask() {
        return completedTask;
    }

    @JsonIgnore
    public FileVersion getVersion() {
        return version;
    }

    public boolean isAllComplete() {
        return allComplete;
    }

    public TaskRecord getNextTask() {
        return nextTask;
    }

    void setNextTask(TaskRecord nextTask) {
        this.nextTask = nextTask;
    }

    public boolean isArchived() {
        return archive != null;
    }

    public String getArchivedTo() {
        return archive != null ? archive.getArchivePath() : null;
    }

    void setArchive(ArchiveRecord archive) {
        this.archive = archive;
    }

    /**
     * Why an auto-archive that was due did not happen, or null. The document
     * stays in place and can be archived explicitly.
     */
    public String getArchiveSkipped() {
        return archiveSkipped;
    }

    void setArchiveSkipped(String reason) {
        this.archiveSkipped = reason;
    }

    /** Document as written by this completion. */
    SectionTree getTreeAfter() {
        return treeAfter;
    }
}
