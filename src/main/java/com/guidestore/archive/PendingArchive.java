package com.guidestore.archive;

/**
 * Journal marker written next to the archive target before a relocation
 * starts and removed once the source is gone.
 */
public class PendingArchive {
    private String source;
    private String target;
    private boolean folder;
    private String startedAt;

    public PendingArchive() {}

    public PendingArchive(String source, String target, boolean folder, String startedAt) {
        this.source = source;
        this.target = target;
        this.folder = folder;
        this.startedAt = startedAt;
    }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public boolean isFolder() { return folder; }
    public void setFolder(boolean folder) { this.folder = folder; }

    public String getStartedAt() { return startedAt; }
    public void setStartedAt(String startedAt) { this.startedAt = startedAt; }
}
