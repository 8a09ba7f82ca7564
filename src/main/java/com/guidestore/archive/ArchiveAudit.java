package com.guidestore.archive;

/**
 * Contents of the {@code <archivePath>.audit} sidecar.
 */
public class ArchiveAudit {
    private String originalPath;
    private String archivedAt;
    private String archivedBy;
    private String type;
    private String note;

    public ArchiveAudit() {}

    public ArchiveAudit(String originalPath, String archivedAt, String archivedBy, String type, String note) {
        this.originalPath = originalPath;
        this.archivedAt = archivedAt;
        this.archivedBy = archivedBy;
        this.type = type;
        this.note = note;
    }

    public String getOriginalPath() { return originalPath; }
    public void setOriginalPath(String originalPath) { this.originalPath = originalPath; }

    public String getArchivedAt() { return archivedAt; }
    public void setArchivedAt(String archivedAt) { this.archivedAt = archivedAt; }

    public String getArchivedBy() { return archivedBy; }
    public void setArchivedBy(String archivedBy) { this.archivedBy = archivedBy; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }
}
