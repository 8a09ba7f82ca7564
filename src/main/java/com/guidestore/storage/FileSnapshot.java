package com.guidestore.storage;

public final class FileSnapshot {

    private final String content;
    private final FileVersion version;

    public FileSnapshot(String content, FileVersion version) {
        this.content = content;
        this.version = version;
    }

    public String getContent() {
        return content;
    }

    public FileVersion getVersion() {
        return version;
    }
}
