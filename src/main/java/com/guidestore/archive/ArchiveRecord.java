package com.guidestore.archive;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One archive operation: where a document or folder came from and where it
 * went. Returned to the caller; persisted only through the optional audit
 * sidecar.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ArchiveRecord {

    private final String originalPath;
    private final String archivePath;
    private final String archivedAt;
    private final boolean wasFolder;
    private final String auditPath;

    public ArchiveRecord(String originalPath, String archivePath, String archivedAt, boolean wasFolder, String auditPath) {
        this.originalPath = originalPath;
        this.archivePath = archivePath;
        this.archivedAt = archivedAt;
        this.wasFolder = wasFolder;
        this.auditPath = auditPath;
    }

    public String getOriginalPath() {
        return originalPath;
    }

    public String getArchivePath() {
        return archivePath;
    }

    public String getArchivedAt() {
        return archivedAt;
    }

    public boolean isWasFolder() {
        return wasFolder;
    }

    public String getAuditPath() {
        return auditPath;
    }
}
