package com.guidestore.cache;

import com.guidestore.AppLogger;
import com.guidestore.WorkspaceService;
import com.guidestore.errors.GuideStoreException;
import com.guidestore.sections.SectionTree;
import com.guidestore.storage.ConcurrencyGuard;
import com.guidestore.storage.FileSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parsed documents keyed by canonical path. Every component that writes a
 * file must invalidate the paths it touched before reporting success.
 *
 * <p>Loads run inside {@link ConcurrentHashMap#compute}, so an invalidation
 * of the same key waits for an in-flight load and then removes it. No TTL,
 * no size bound.
 */
public class DocumentCache {

    private static final AppLogger.Component LOG = AppLogger.forComponent("DocumentCache");

    private final ConcurrentHashMap<String, DocumentRecord> entries = new ConcurrentHashMap<>();
    private final WorkspaceService workspace;
    private final ConcurrencyGuard guard;
    private final Clock clock;

    public DocumentCache(WorkspaceService workspace, ConcurrencyGuard guard, Clock clock) {
        this.workspace = workspace;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * Cached record for {@code canonicalPath}, loading it on a miss. Empty
     * when no such file exists; nothing is cached in that case.
     */
    public Optional<DocumentRecord> get(String canonicalPath) {
        DocumentRecord cached = entries.get(canonicalPath);
        if (cached != null) {
            return Optional.of(cached);
        }
        DocumentRecord loaded = entries.compute(canonicalPath, (key, existing) -> existing != null ? existing : load(key));
        return Optional.ofNullable(loaded);
    }

    public void invalidate(String canonicalPath) {
        if (entries.remove(canonicalPath) != null) {
            LOG.debug("Invalidated " + canonicalPath);
        }
    }

    /** Drops every entry at or below a folder; returns the number removed. */
    public int invalidatePrefix(String folderPath) {
        String prefix = folderPath.endsWith("/") ? folderPath : folderPath + "/";
        int before = entries.size();
        entries.keySet().removeIf(key -> key.startsWith(prefix) || key.equals(folderPath));
        int removed = Math.max(0, before - entries.size());
        if (removed > 0) {
            LOG.debug("Invalidated " + removed + " entries under " + prefix);
        }
        return removed;
    }

    public boolean isCached(String canonicalPath) {
        return entries.containsKey(canonicalPath);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private DocumentRecord load(String canonicalPath) {
        Path file = workspace.resolvePath(canonicalPath);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            FileSnapshot snapshot = guard.snapshot(file);
            SectionTree tree = SectionTree.parse(snapshot.getContent());
            String title = tree.getTitle().orElseGet(() -> fileTitle(file));
            return new DocumentRecord(canonicalPath, title, tree, snapshot.getVersion(), clock.instant());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to load document " + canonicalPath, e);
        }
    }

    private static String fileTitle(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
