package com.guidestore.cache;

import com.guidestore.AppLogger;
import com.guidestore.WorkspaceService;
import com.guidestore.addressing.AddressResolver;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Invalidates cache entries for files changed or deleted by other processes.
 */
public class DocumentWatcher implements Closeable {

    private static final AppLogger.Component LOG = AppLogger.forComponent("DocumentWatcher");

    private final WorkspaceService workspace;
    private final DocumentCache cache;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public DocumentWatcher(WorkspaceService workspace, DocumentCache cache) {
        this.workspace = workspace;
        this.cache = cache;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(workspace.getWorkspaceRoot());
        running = true;
        thread = new Thread(this::run, "document-watcher");
        thread.setDaemon(true);
        thread.start();
        LOG.info("Watching " + keys.size() + " directories under " + workspace.getWorkspaceRoot());
    }

    private void registerTree(Path start) throws IOException {
        List<Path> dirs;
        try (Stream<Path> stream = Files.walk(start)) {
            dirs = stream.filter(Files::isDirectory).collect(Collectors.toList());
        }
        for (Path dir : dirs) {
            WatchKey key = dir.register(watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_DELETE,
                StandardWatchEventKinds.ENTRY_MODIFY);
            keys.put(key, dir);
        }
    }

    private void run() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    LOG.warn("Watch events overflowed; clearing cache");
                    cache.clear();
                    continue;
                }
                if (dir == null) {
                    continue;
                }
                Path changed = dir.resolve((Path) event.context());
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(changed)) {
                    try {
                        registerTree(changed);
                    } catch (IOException e) {
                        LOG.warn("Failed to watch new directory " + changed + ": " + e.getMessage());
                    }
                }
                onPathChanged(changed);
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    /** Invalidates the entry (or folder of entries) behind a changed file. */
    void onPathChanged(Path changed) {
        String logical = workspace.toLogicalPath(changed);
        if (logical == null) {
            return;
        }
        if (logical.endsWith(AddressResolver.EXTENSION)) {
            cache.invalidate(logical);
        } else if (!Files.isRegularFile(changed)) {
            cache.invalidatePrefix(logical);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        running = false;
        if (watchService != null) {
            watchService.close();
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
