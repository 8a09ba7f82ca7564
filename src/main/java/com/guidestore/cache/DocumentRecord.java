package com.guidestore.cache;

import com.guidestore.addressing.Namespace;
import com.guidestore.sections.Heading;
import com.guidestore.sections.SectionTree;
import com.guidestore.storage.FileVersion;

import java.time.Instant;
import java.util.List;

/**
 * Parsed document as held by {@link DocumentCache}. Immutable; a changed file
 * produces a new record after invalidation.
 */
public final class DocumentRecord {

    private final String path;
    private final String title;
    private final SectionTree tree;
    private final FileVersion loadedVersion;
    private final int wordCount;
    private final Instant loadedAt;

    public DocumentRecord(String path, String title, SectionTree tree, FileVersion loadedVersion, Instant loadedAt) {
        this.path = path;
        this.title = title;
        this.tree = tree;
        this.loadedVersion = loadedVersion;
        this.wordCount = countWords(tree.getContent());
        this.loadedAt = loadedAt;
    }

    private static int countWords(String content) {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    public String getPath() {
        return path;
    }

    public String getTitle() {
        return title;
    }

    public Namespace getNamespace() {
        return Namespace.of(path);
    }

    public SectionTree getTree() {
        return tree;
    }

    public List<Heading> getHeadings() {
        return tree.getHeadings();
    }

    public String getContent() {
        return tree.getContent();
    }

    public FileVersion getLoadedVersion() {
        return loadedVersion;
    }

    public String getContentHash() {
        return loadedVersion.getHash();
    }

    public int getWordCount() {
        return wordCount;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }
}
