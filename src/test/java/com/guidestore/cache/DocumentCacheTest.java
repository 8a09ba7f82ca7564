package com.guidestore.cache;

import com.guidestore.WorkspaceService;
import com.guidestore.storage.ConcurrencyGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCacheTest {

    @TempDir
    Path tempDir;

    private WorkspaceService workspace;
    private DocumentCache cache;

    @BeforeEach
    void setUp() throws Exception {
        workspace = new WorkspaceService(tempDir);
        cache = new DocumentCache(workspace, new ConcurrencyGuard(),
            Clock.fixed(Instant.parse("2026-10-16T09:30:00Z"), ZoneOffset.UTC));
    }

    private Path write(String relative, String content) throws Exception {
        Path file = tempDir.resolve("docs").resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void repeatedGetReturnsSameRecord() throws Exception {
        write("guide.md", "# Guide\n\n## Setup\n\nInstall it.\n");

        DocumentRecord first = cache.get("/guide.md").orElseThrow();
        DocumentRecord second = cache.get("/guide.md").orElseThrow();

        assertSame(first, second);
        assertEquals("Guide", first.getTitle());
        assertEquals(2, first.getHeadings().size());
        assertEquals(6, first.getWordCount());
    }

    @Test
    void invalidateThenGetReflectsIntermediateWrites() throws Exception {
        write("guide.md", "# Guide\n");
        DocumentRecord before = cache.get("/guide.md").orElseThrow();

        write("guide.md", "# Renamed\n\n## New\n");
        assertSame(before, cache.get("/guide.md").orElseThrow());

        cache.invalidate("/guide.md");
        DocumentRecord after = cache.get("/guide.md").orElseThrow();
        assertNotSame(before, after);
        assertEquals("Renamed", after.getTitle());
        assertNotEquals(before.getLoadedVersion(), after.getLoadedVersion());
    }

    @Test
    void missingDocumentIsNotCached() {
        assertTrue(cache.get("/nope.md").isEmpty());
        assertFalse(cache.isCached("/nope.md"));
        assertEquals(0, cache.size());
    }

    @Test
    void titleFallsBackToFileName() throws Exception {
        write("notes.md", "Just text.\n");
        assertEquals("notes", cache.get("/notes.md").orElseThrow().getTitle());
    }

    @Test
    void invalidatePrefixDropsFolderEntries() throws Exception {
        write("api/a.md", "# A\n");
        write("api/b.md", "# B\n");
        write("other.md", "# Other\n");
        cache.get("/api/a.md");
        cache.get("/api/b.md");
        cache.get("/other.md");

        assertEquals(2, cache.invalidatePrefix("/api"));
        assertFalse(cache.isCached("/api/a.md"));
        assertTrue(cache.isCached("/other.md"));
    }

    @Test
    void watcherEventInvalidatesChangedDocument() throws Exception {
        Path file = write("guide.md", "# Guide\n");
        cache.get("/guide.md");
        DocumentWatcher watcher = new DocumentWatcher(workspace, cache);

        watcher.onPathChanged(file);

        assertFalse(cache.isCached("/guide.md"));
    }
}
