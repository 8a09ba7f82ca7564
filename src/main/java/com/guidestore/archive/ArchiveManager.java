package com.guidestore.archive;

import com.guidestore.AppLogger;
import com.guidestore.WorkspaceService;
import com.guidestore.addressing.Address;
import com.guidestore.addressing.AddressResolver;
import com.guidestore.addressing.Namespace;
import com.guidestore.cache.DocumentCache;
import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ArchiveIoException;
import com.guidestore.errors.DocumentNotFoundException;
import com.guidestore.errors.ErrorCode;
import com.guidestore.storage.ConcurrencyGuard;
import com.guidestore.storage.ContentHash;
import com.guidestore.storage.FileVersion;
import com.guidestore.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Moves documents and folders into {@code /archived/} under collision-free
 * names and invalidates the cache for everything moved.
 *
 * <p>Relocation is an atomic rename when the filesystem allows it. Otherwise
 * the source is copied, the copy verified by content hash, and only then is
 * the source deleted. A {@code .pending} journal marker covers that window so
 * {@link #recoverIncomplete()} can finish or roll back an interrupted move.
 */
public class ArchiveManager {

    static final String PENDING_SUFFIX = ".pending";
    static final String AUDIT_SUFFIX = ".audit";

    private static final AppLogger.Component LOG = AppLogger.forComponent("ArchiveManager");

    private final WorkspaceService workspace;
    private final AddressResolver resolver;
    private final DocumentCache cache;
    private final ConcurrencyGuard guard;
    private final Clock clock;
    private volatile boolean atomicMoveEnabled = true;

    public ArchiveManager(WorkspaceService workspace, AddressResolver resolver, DocumentCache cache,
                          ConcurrencyGuard guard, Clock clock) {
        this.workspace = workspace;
        this.resolver = resolver;
        this.cache = cache;
        this.guard = guard;
        this.clock = clock;
    }

    /** Forces the copy-verify-delete path. */
    void setAtomicMoveEnabled(boolean atomicMoveEnabled) {
        this.atomicMoveEnabled = atomicMoveEnabled;
    }

    // -------------------------------------------------------------------------
    // Archive operations
    // -------------------------------------------------------------------------

    /**
     * Archives a document ({@code .md} path) or a folder (any other path).
     * With {@code audit} set, an {@code <archivePath>.audit} JSON sidecar
     * records who archived it and why.
     */
    public ArchiveRecord archive(String rawPath, boolean audit, String archivedBy, String note) {
        if (rawPath == null || rawPath.isBlank()) {
            throw AddressingException.missingParameter("path");
        }
        boolean folder = !rawPath.trim().endsWith(AddressResolver.EXTENSION);
        String source;
        if (folder) {
            source = resolver.resolveFolder(rawPath);
        } else {
            Address address = resolver.resolve(rawPath);
            if (address.hasSection()) {
                throw AddressingException.invalidPath(rawPath, "sections cannot be archived on their own");
            }
            source = address.getDocumentPath();
        }
        Namespace namespace = Namespace.of(source);
        if (namespace == Namespace.ARCHIVED) {
            throw new AddressingException(ErrorCode.NAMESPACE_VIOLATION, "Already archived: " + source,
                Map.of("path", source));
        }
        Path sourceFile = resolve(source);
        if (folder ? !Files.isDirectory(sourceFile) : !Files.isRegularFile(sourceFile)) {
            throw new DocumentNotFoundException(source);
        }

        String base = Namespace.ARCHIVED.getPrefix() + namespace.getFolder() + "/" + namespace.relativePath(source);
        String target = uniqueTarget(base, folder);
        Instant now = clock.instant();
        relocate(sourceFile, resolve(target), source, target, folder, now);
        invalidate(source, target, folder);

        String auditPath = null;
        if (audit) {
            auditPath = target + AUDIT_SUFFIX;
            writeAudit(auditPath, new ArchiveAudit(source, now.toString(),
                archivedBy == null || archivedBy.isBlank() ? "unknown" : archivedBy,
                folder ? "folder" : "file", note));
        }
        LOG.info("Archived " + source + " -> " + target);
        return new ArchiveRecord(source, target, now.toString(), folder, auditPath);
    }

    /**
     * Archives a finished coordinator task list to
     * {@code /archived/coordinator/<timestamp>.md}. With {@code expected} set
     * the move only happens if the file still has that version; otherwise a
     * {@link com.guidestore.errors.ConflictException} is raised and nothing moves.
     */
    public ArchiveRecord archiveCoordinator(Address address, FileVersion expected) {
        String source = address.getDocumentPath();
        Path sourceFile = resolve(source);
        Instant now = clock.instant();
        String target = uniqueTarget(Namespace.ARCHIVED.getPrefix() + Namespace.COORDINATOR.getFolder()
            + "/" + timestampName(now) + AddressResolver.EXTENSION, false);
        Path targetFile = resolve(target);
        if (expected == null) {
            if (!Files.isRegularFile(sourceFile)) {
                throw new DocumentNotFoundException(source);
            }
            relocate(sourceFile, targetFile, source, target, false, now);
        } else {
            try {
                guard.runIfUnchanged(sourceFile, expected, source, () -> {
                    relocate(sourceFile, targetFile, source, target, false, now);
                    return null;
                });
            } catch (IOException e) {
                throw new ArchiveIoException("Failed to archive " + source, Map.of("path", source), e);
            }
        }
        invalidate(source, target, false);
        LOG.info("Auto-archived " + source + " -> " + target);
        return new ArchiveRecord(source, target, now.toString(), false, null);
    }

    /** {@code 2026-10-16T09:30:00.123Z} becomes {@code 2026-10-16T09-30-00}. */
    static String timestampName(Instant instant) {
        String iso = instant.toString().replace(':', '-').replace('.', '-');
        return iso.length() > 19 ? iso.substring(0, 19) : iso;
    }

    // -------------------------------------------------------------------------
    // Recovery
    // -------------------------------------------------------------------------

    /**
     * Finishes relocations interrupted after the copy: a verified copy leads
     * to deleting the source, an unverified one is discarded and the source
     * kept. Returns the relocations that were completed.
     */
    public List<ArchiveRecord> recoverIncomplete() {
        Path archivedRoot = workspace.getNamespaceRoot(Namespace.ARCHIVED);
        List<Path> markers;
        try (Stream<Path> stream = Files.walk(archivedRoot)) {
            markers = stream
                .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(PENDING_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveIoException("Failed to scan " + archivedRoot, Map.of(), e);
        }

        List<ArchiveRecord> completed = new ArrayList<>();
        for (Path marker : markers) {
            try {
                Optional<PendingArchive> pending = JsonStorage.readJson(marker, PendingArchive.class);
                if (pending.isEmpty() || pending.get().getSource() == null || pending.get().getTarget() == null) {
                    LOG.warn("Discarding unreadable archive marker " + marker);
                    Files.deleteIfExists(marker);
                    continue;
                }
                PendingArchive p = pending.get();
                Path source = resolve(p.getSource());
                Path target = resolve(p.getTarget());
                boolean sourceExists = Files.exists(source);
                boolean targetExists = Files.exists(target);
                if (targetExists && sourceExists) {
                    if (sameContent(source, target, p.isFolder())) {
                        deleteTree(source);
                        completed.add(new ArchiveRecord(p.getSource(), p.getTarget(), p.getStartedAt(), p.isFolder(), null));
                        LOG.info("Recovered archive " + p.getSource() + " -> " + p.getTarget());
                    } else {
                        deleteTree(target);
                        LOG.warn("Rolled back partial archive of " + p.getSource());
                    }
                } else if (targetExists) {
                    completed.add(new ArchiveRecord(p.getSource(), p.getTarget(), p.getStartedAt(), p.isFolder(), null));
                }
                Files.deleteIfExists(marker);
                invalidate(p.getSource(), p.getTarget(), p.isFolder());
            } catch (IOException e) {
                throw new ArchiveIoException("Failed to recover archive marker " + marker,
                    Map.of("marker", marker.toString()), e);
            }
        }
        return completed;
    }

    // -------------------------------------------------------------------------
    // Relocation
    // -------------------------------------------------------------------------

    private void relocate(Path source, Path target, String sourcePath, String targetPath, boolean folder, Instant now) {
        Path marker = markerFor(target);
        try {
            Files.createDirectories(target.getParent());
            JsonStorage.writeJson(marker, new PendingArchive(sourcePath, targetPath, folder, now.toString()));
            boolean moved = false;
            if (atomicMoveEnabled) {
                try {
                    Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
                    moved = true;
                } catch (AtomicMoveNotSupportedException e) {
                    LOG.info("Atomic move not supported for " + sourcePath + "; copying instead");
                }
            }
            if (!moved) {
                copyTree(source, target);
                if (!sameContent(source, target, folder)) {
                    deleteTree(target);
                    throw new IOException("Copy of " + sourcePath + " failed verification");
                }
                deleteTree(source);
            }
            Files.deleteIfExists(marker);
        } catch (IOException e) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("source", sourcePath);
            ctx.put("target", targetPath);
            throw new ArchiveIoException("Failed to archive " + sourcePath + ": " + e.getMessage(), ctx, e);
        }
    }

    private String uniqueTarget(String base, boolean folder) {
        if (isFree(base)) {
            return base;
        }
        String stem = base;
        String extension = "";
        if (!folder && base.endsWith(AddressResolver.EXTENSION)) {
            stem = base.substring(0, base.length() - AddressResolver.EXTENSION.length());
            extension = AddressResolver.EXTENSION;
        }
        for (int i = 1; ; i++) {
            String candidate = stem + "_" + i + extension;
            if (isFree(candidate)) {
                return candidate;
            }
        }
    }

    private boolean isFree(String logicalPath) {
        Path file = resolve(logicalPath);
        return !Files.exists(file) && !Files.exists(markerFor(file));
    }

    private static Path markerFor(Path target) {
        return target.resolveSibling(target.getFileName() + PENDING_SUFFIX);
    }

    private static void copyTree(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source)) {
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
            return;
        }
        List<Path> entries;
        try (Stream<Path> stream = Files.walk(source)) {
            entries = stream.collect(Collectors.toList());
        }
        for (Path entry : entries) {
            Path dest = target.resolve(source.relativize(entry).toString());
            if (Files.isDirectory(entry)) {
                Files.createDirectories(dest);
            } else {
                Files.copy(entry, dest, StandardCopyOption.COPY_ATTRIBUTES);
            }
        }
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            Files.deleteIfExists(root);
            return;
        }
        List<Path> entries;
        try (Stream<Path> stream = Files.walk(root)) {
            entries = stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path entry : entries) {
            Files.deleteIfExists(entry);
        }
    }

    private static boolean sameContent(Path source, Path target, boolean folder) throws IOException {
        if (!folder) {
            return Files.isRegularFile(target)
                && ContentHash.of(Files.readAllBytes(source)).equals(ContentHash.of(Files.readAllBytes(target)));
        }
        return fingerprint(source).equals(fingerprint(target));
    }

    private static Map<String, String> fingerprint(Path root) throws IOException {
        Map<String, String> hashes = new LinkedHashMap<>();
        List<Path> files;
        try (Stream<Path> stream = Files.walk(root)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            hashes.put(root.relativize(file).toString(), ContentHash.of(Files.readAllBytes(file)));
        }
        return hashes;
    }

    private void writeAudit(String auditPath, ArchiveAudit audit) {
        try {
            JsonStorage.writeJson(resolve(auditPath), audit);
        } catch (IOException e) {
            throw new ArchiveIoException("Archived, but failed to write audit " + auditPath,
                Map.of("audit", auditPath), e);
        }
    }

    private void invalidate(String source, String target, boolean folder) {
        if (folder) {
            cache.invalidatePrefix(source);
            cache.invalidatePrefix(target);
        } else {
            cache.invalidate(source);
            cache.invalidate(target);
        }
    }

    private Path resolve(String logicalPath) {
        try {
            return workspace.resolvePath(logicalPath);
        } catch (SecurityException e) {
            throw AddressingException.invalidPath(logicalPath, e.getMessage());
        }
    }
}
