package com.guidestore;

import com.guidestore.addressing.AddressResolver;
import com.guidestore.addressing.Namespace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps canonical logical paths onto the workspace folders.
 *
 * <pre>
 * /coordinator/active.md  -> &lt;root&gt;/coordinator/active.md
 * /archived/docs/a.md     -> &lt;root&gt;/archived/docs/a.md
 * /api/auth.md            -> &lt;root&gt;/docs/api/auth.md
 * </pre>
 */
public class WorkspaceService {

    private static final AppLogger.Component LOG = AppLogger.forComponent("WorkspaceService");

    private final Path workspaceRoot;

    public WorkspaceService(Path workspaceRoot) throws IOException {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        for (Namespace ns : Namespace.values()) {
            Files.createDirectories(this.workspaceRoot.resolve(ns.getFolder()));
        }
        LOG.info("Initialized with root: " + this.workspaceRoot);
    }

    // -------------------------------------------------------------------------
    // Path Resolution
    // -------------------------------------------------------------------------

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public Path getNamespaceRoot(Namespace namespace) {
        return workspaceRoot.resolve(namespace.getFolder());
    }

    /**
     * Resolves a canonical logical path (document or folder) to a file below
     * its namespace folder.
     *
     * @throws SecurityException if the path escapes the namespace folder
     */
    public Path resolvePath(String canonicalPath) {
        Namespace ns = Namespace.of(canonicalPath);
        Path base = getNamespaceRoot(ns);
        String relative = ns.relativePath(canonicalPath);
        if (relative.isEmpty()) {
            return base;
        }
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base)) {
            throw new SecurityException("Path escapes workspace root: " + canonicalPath);
        }
        return resolved;
    }

    /**
     * Inverse of {@link #resolvePath}; null for files outside the namespace folders.
     */
    public String toLogicalPath(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        for (Namespace ns : Namespace.values()) {
            Path base = getNamespaceRoot(ns);
            if (normalized.startsWith(base) && !normalized.equals(base)) {
                String relative = base.relativize(normalized).toString().replace('\\', '/');
                return ns.getPrefix() + relative;
            }
        }
        return null;
    }

    /**
     * Logical paths of all documents in a namespace, sorted.
     */
    public List<String> listDocuments(Namespace namespace) throws IOException {
        Path base = getNamespaceRoot(namespace);
        if (!Files.isDirectory(base)) {
            return new ArrayList<>();
        }
        try (Stream<Path> stream = Files.walk(base)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(AddressResolver.EXTENSION))
                .map(this::toLogicalPath)
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
