package com.guidestore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guidestore.addressing.AddressResolver;
import com.guidestore.archive.ArchiveManager;
import com.guidestore.cache.DocumentCache;
import com.guidestore.storage.ConcurrencyGuard;
import com.guidestore.tasks.TaskEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Holder for the services bound to one workspace root.
 */
public class StoreContext {

    private static final AppLogger.Component LOG = AppLogger.forComponent("StoreContext");

    private final ObjectMapper objectMapper;
    private final WorkspaceService workspaceService;
    private final AddressResolver addressResolver;
    private final ConcurrencyGuard concurrencyGuard;
    private final DocumentCache documentCache;
    private final DocumentService documentService;
    private final ArchiveManager archiveManager;
    private final TaskEngine taskEngine;

    public StoreContext(Path workspaceRoot, ObjectMapper objectMapper, Clock clock) throws IOException {
        this.objectMapper = objectMapper;
        this.workspaceService = new WorkspaceService(workspaceRoot);
        this.addressResolver = new AddressResolver();
        this.concurrencyGuard = new ConcurrencyGuard();
        this.documentCache = new DocumentCache(workspaceService, concurrencyGuard, clock);
        this.documentService = new DocumentService(workspaceService, addressResolver, documentCache, concurrencyGuard);
        this.archiveManager = new ArchiveManager(workspaceService, addressResolver, documentCache, concurrencyGuard, clock);
        this.taskEngine = new TaskEngine(documentService, archiveManager, clock);
        LOG.info("Store context loaded for " + workspaceService.getWorkspaceRoot());
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public WorkspaceService workspace() {
        return workspaceService;
    }

    public AddressResolver resolver() {
        return addressResolver;
    }

    public DocumentCache cache() {
        return documentCache;
    }

    public DocumentService documents() {
        return documentService;
    }

    public ArchiveManager archives() {
        return archiveManager;
    }

    public TaskEngine tasks() {
        return taskEngine;
    }
}
