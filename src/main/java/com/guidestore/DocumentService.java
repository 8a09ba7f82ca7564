package com.guidestore;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.guidestore.addressing.Address;
import com.guidestore.addressing.AddressResolver;
import com.guidestore.addressing.Namespace;
import com.guidestore.cache.DocumentCache;
import com.guidestore.cache.DocumentRecord;
import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ConflictException;
import com.guidestore.errors.DocumentNotFoundException;
import com.guidestore.errors.ErrorCode;
import com.guidestore.errors.ErrorDetails;
import com.guidestore.errors.GuideStoreException;
import com.guidestore.models.BatchEditResult;
import com.guidestore.models.SectionEditRequest;
import com.guidestore.models.SectionEditResult;
import com.guidestore.sections.Heading;
import com.guidestore.sections.SectionEdit;
import com.guidestore.sections.SectionOperation;
import com.guidestore.sections.SectionTree;
import com.guidestore.storage.ConcurrencyGuard;
import com.guidestore.storage.FileSnapshot;
import com.guidestore.storage.FileVersion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read and write path for documents. Every write is one bounded unit:
 * snapshot, transform with {@link SectionTree}, conditional write, cache
 * invalidation.
 */
public class DocumentService {

    public static final int MAX_BATCH_SIZE = 100;

    private static final AppLogger.Component LOG = AppLogger.forComponent("DocumentService");

    private final WorkspaceService workspace;
    private final AddressResolver resolver;
    private final DocumentCache cache;
    private final ConcurrencyGuard guard;

    public DocumentService(WorkspaceService workspace, AddressResolver resolver, DocumentCache cache, ConcurrencyGuard guard) {
        this.workspace = workspace;
        this.resolver = resolver;
        this.cache = cache;
        this.guard = guard;
    }

    public AddressResolver resolver() {
        return resolver;
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    public Optional<DocumentRecord> getDocument(String rawPath) {
        return cache.get(resolver.resolve(rawPath).getDocumentPath());
    }

    public DocumentRecord requireDocument(String rawPath) {
        return requireDocument(resolver.resolve(rawPath));
    }

    public DocumentRecord requireDocument(Address address) {
        String path = address.getDocumentPath();
        return cache.get(path).orElseThrow(() -> new DocumentNotFoundException(path));
    }

    /** Heading line plus span of one section. */
    public String readSection(String rawDocument, String sectionRef) {
        Address document = resolver.resolve(rawDocument);
        Address section = resolver.resolveSection(sectionRef, document);
        return requireDocument(document).getTree().readSection(section.getSectionSlug());
    }

    public List<String> listDocuments(Namespace namespace) {
        try {
            return workspace.listDocuments(namespace);
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to list " + namespace.getPrefix(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Section edits
    // -------------------------------------------------------------------------

    public SectionEditResult editSection(SectionEditRequest request) {
        if (request == null) {
            throw AddressingException.missingParameter("operation");
        }
        SectionOperation operation = parseOperation(request.getOperation());
        if (request.getDocument() == null || request.getDocument().isBlank()) {
            throw AddressingException.missingParameter("document");
        }
        if (operation.createsSection() && (request.getTitle() == null || request.getTitle().isBlank())) {
            throw AddressingException.missingParameter("title");
        }
        if (!operation.createsSection() && operation.requiresContent()
                && (request.getContent() == null || request.getContent().isBlank())) {
            throw AddressingException.missingParameter("content");
        }
        Integer depth = request.getDepth();
        if (depth != null && (depth < 1 || depth > 6)) {
            throw AddressingException.invalidParameter("depth", "must be between 1 and 6, got " + depth);
        }
        FileVersion expected = request.getVersion() == null || request.getVersion().isBlank()
            ? null : FileVersion.parse(request.getVersion());
        Address document = resolver.resolve(request.getDocument()).documentOnly();
        String slug = resolver.resolveSection(request.getSection(), document).getSectionSlug();

        Mutation mutation = mutate(document, expected,
            tree -> tree.apply(operation, slug, request.getTitle(), request.getContent(), depth));
        SectionEdit edit = mutation.getEdit();

        SectionEditResult result = new SectionEditResult();
        result.setDocument(document.getDocumentPath());
        result.setOperation(operation.getValue());
        result.setAction(operation.createsSection() ? "created" : operation == SectionOperation.REMOVE ? "removed" : "edited");
        result.setSection(edit.getSlug());
        result.setSectionPath(edit.getPath());
        result.setDepth(edit.getDepth());
        result.setRemovedContent(edit.getRemovedContent());
        result.setDiff(unifiedDiff(document.getDocumentPath(), mutation.getBefore(), edit.getContent()));
        result.setVersion(mutation.getVersion().asToken());
        LOG.info(operation.getValue() + " " + document.getDocumentPath() + "#" + edit.getSlug());
        return result;
    }

    /**
     * Applies operations in order. Each entry reports its own success or
     * error; a failed operation does not stop later ones.
     */
    public BatchEditResult editSections(String rawDocument, List<SectionEditRequest> operations) {
        if (operations == null || operations.isEmpty()) {
            throw AddressingException.missingParameter("operations");
        }
        if (operations.size() > MAX_BATCH_SIZE) {
            throw new AddressingException(ErrorCode.BATCH_TOO_LARGE,
                "Batch of " + operations.size() + " operations exceeds the limit of " + MAX_BATCH_SIZE,
                Map.of("size", operations.size(), "max", MAX_BATCH_SIZE));
        }
        String documentPath = resolver.resolve(rawDocument).getDocumentPath();
        BatchEditResult batch = new BatchEditResult(documentPath);
        for (int i = 0; i < operations.size(); i++) {
            SectionEditRequest op = operations.get(i);
            if (op != null && (op.getDocument() == null || op.getDocument().isBlank())) {
                op.setDocument(documentPath);
            }
            try {
                batch.add(BatchEditResult.Entry.ok(i, editSection(op)));
            } catch (GuideStoreException e) {
                LOG.warn("Batch operation " + i + " on " + documentPath + " failed: " + e.getMessage());
                batch.add(BatchEditResult.Entry.failed(i, ErrorDetails.from(e)));
            } catch (RuntimeException e) {
                LOG.error("Batch operation " + i + " on " + documentPath + " failed unexpectedly", e);
                GuideStoreException wrapped = GuideStoreException.internal("Operation " + i + " failed", e);
                batch.add(BatchEditResult.Entry.failed(i, ErrorDetails.from(wrapped)));
            }
        }
        return batch;
    }

    public SectionEditResult renameSection(String rawDocument, String sectionRef, String newTitle) {
        Address document = resolver.resolve(rawDocument).documentOnly();
        String slug = resolver.resolveSection(sectionRef, document).getSectionSlug();
        Mutation mutation = mutate(document, tree -> tree.rename(slug, newTitle));
        SectionEditResult result = new SectionEditResult();
        result.setDocument(document.getDocumentPath());
        result.setOperation("rename");
        result.setAction("edited");
        result.setSection(mutation.getEdit().getSlug());
        result.setSectionPath(mutation.getEdit().getPath());
        result.setDepth(mutation.getEdit().getDepth());
        result.setDiff(unifiedDiff(document.getDocumentPath(), mutation.getBefore(), mutation.getEdit().getContent()));
        result.setVersion(mutation.getVersion().asToken());
        return result;
    }

    /**
     * Moves {@code /doc.md#slug} (heading, body and descendants) next to
     * {@code reference} in {@code rawTo}. {@code position} is {@code before},
     * {@code after} or {@code child}. Across documents the destination is
     * written first and the source section removed only afterwards.
     */
    public SectionEditResult moveSection(String rawFrom, String rawTo, String reference, String position) {
        SectionOperation operation = parsePosition(position);
        Address from = resolver.requireFragment(resolver.resolve(rawFrom));
        Address source = from.documentOnly();
        Address destination = rawTo == null || rawTo.isBlank() ? source : resolver.resolve(rawTo).documentOnly();
        String refSlug = resolver.resolveSection(reference, destination).getSectionSlug();
        requireWritable(source);
        requireWritable(destination);

        Mutation mutation;
        if (source.equals(destination)) {
            mutation = mutate(source, tree -> {
                Heading moved = tree.require(from.getSectionSlug());
                Heading anchor = tree.require(refSlug);
                if (anchor.getStartOffset() >= moved.getStartOffset() && anchor.getStartOffset() < moved.getEndOffset()) {
                    throw AddressingException.invalidParameter("reference", "lies inside the section being moved");
                }
                String title = moved.getTitle();
                String body = tree.readBody(moved.getSlug());
                SectionTree without = SectionTree.parse(tree.remove(moved.getSlug()).getContent());
                return without.insert(operation, without.require(anchor.getPath()).getSlug(), title, body, null);
            });
        } else {
            DocumentRecord sourceRecord = requireDocument(source);
            SectionTree sourceTree = sourceRecord.getTree();
            Heading moved = sourceTree.require(from.getSectionSlug());
            String title = moved.getTitle();
            String body = sourceTree.readBody(moved.getSlug());
            mutation = mutate(destination, tree -> tree.insert(operation, refSlug, title, body, null));
            try {
                mutate(source, sourceRecord.getLoadedVersion(), tree -> tree.remove(moved.getSlug()));
            } catch (GuideStoreException e) {
                LOG.warn("Removing " + from + " after copying it to " + destination.getDocumentPath()
                    + " failed; rolling back the copy");
                String inserted = mutation.getEdit().getSlug();
                FileVersion written = mutation.getVersion();
                try {
                    mutate(destination, written, tree -> tree.remove(inserted));
                } catch (GuideStoreException rollback) {
                    LOG.error("Rollback of " + destination.getDocumentPath() + "#" + inserted
                        + " failed; the section now exists in both documents", rollback);
                    e.addSuppressed(rollback);
                }
                throw e;
            }
        }
        SectionEdit edit = mutation.getEdit();
        SectionEditResult result = new SectionEditResult();
        result.setDocument(destination.getDocumentPath());
        result.setOperation(operation.getValue());
        result.setAction("moved");
        result.setMovedFrom(from.toString());
        result.setSection(edit.getSlug());
        result.setSectionPath(edit.getPath());
        result.setDepth(edit.getDepth());
        result.setDiff(unifiedDiff(destination.getDocumentPath(), mutation.getBefore(), edit.getContent()));
        result.setVersion(mutation.getVersion().asToken());
        LOG.info("Moved " + from + " to " + destination.getDocumentPath() + "#" + edit.getSlug());
        return result;
    }

    // -------------------------------------------------------------------------
    // Whole documents
    // -------------------------------------------------------------------------

    public DocumentRecord createDocument(String rawPath, String title, String body) {
        Address address = resolver.resolve(rawPath);
        if (address.hasSection()) {
            throw AddressingException.invalidPath(rawPath, "cannot create a document with a section fragment");
        }
        requireWritable(address);
        if (title == null || title.isBlank()) {
            throw AddressingException.missingParameter("title");
        }
        StringBuilder content = new StringBuilder("# ").append(title.trim()).append('\n');
        String normalized = SectionTree.normalizeBody(body);
        if (!normalized.isEmpty()) {
            content.append('\n').append(normalized).append('\n');
        }
        String path = address.getDocumentPath();
        try {
            guard.create(resolveFile(address), content.toString(), path);
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to create " + path, e);
        }
        cache.invalidate(path);
        LOG.info("Created " + path);
        return requireDocument(address);
    }

    public void deleteDocument(String rawPath) {
        Address address = resolver.resolve(rawPath).documentOnly();
        String path = address.getDocumentPath();
        Path file = resolveFile(address);
        try {
            FileSnapshot snapshot = guard.snapshot(file);
            guard.delete(file, snapshot.getVersion(), path);
        } catch (NoSuchFileException e) {
            cache.invalidate(path);
            throw new DocumentNotFoundException(path);
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to delete " + path, e);
        } finally {
            cache.invalidate(path);
        }
        LOG.info("Deleted " + path);
    }

    /**
     * Relocates a document, creating destination folders as needed. A
     * destination without {@code .md} gets it appended. The destination is
     * written before the source is deleted; both cache entries are dropped.
     */
    public DocumentRecord moveDocument(String rawFrom, String rawTo) {
        Address from = resolver.resolve(rawFrom).documentOnly();
        if (rawTo == null || rawTo.isBlank()) {
            throw AddressingException.missingParameter("to");
        }
        String target = rawTo.trim();
        if (target.indexOf('#') < 0 && !target.endsWith(".md")) {
            target = target + ".md";
        }
        Address to = resolver.resolve(target);
        if (to.hasSection()) {
            throw AddressingException.invalidPath(rawTo, "cannot move a document onto a section fragment");
        }
        requireWritable(from);
        requireWritable(to);
        String fromPath = from.getDocumentPath();
        String toPath = to.getDocumentPath();
        if (fromPath.equals(toPath)) {
            throw AddressingException.invalidParameter("to", "is the same as the source");
        }
        Path sourceFile = resolveFile(from);
        Path targetFile = resolveFile(to);
        FileSnapshot snapshot;
        try {
            snapshot = guard.snapshot(sourceFile);
        } catch (NoSuchFileException e) {
            cache.invalidate(fromPath);
            throw new DocumentNotFoundException(fromPath);
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to read " + fromPath, e);
        }
        try {
            guard.create(targetFile, snapshot.getContent(), toPath);
            try {
                guard.delete(sourceFile, snapshot.getVersion(), fromPath);
            } catch (ConflictException | IOException e) {
                Files.deleteIfExists(targetFile);
                throw e;
            }
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to move " + fromPath + " to " + toPath, e);
        } finally {
            cache.invalidate(fromPath);
            cache.invalidate(toPath);
        }
        LOG.info("Moved " + fromPath + " to " + toPath);
        return requireDocument(to);
    }

    // -------------------------------------------------------------------------
    // Write path
    // -------------------------------------------------------------------------

    /**
     * Snapshot, transform, conditional write, invalidate. A concurrent change
     * between snapshot and write surfaces as {@link ConflictException}.
     */
    public Mutation mutate(Address address, Function<SectionTree, SectionEdit> transform) {
        return mutate(address, null, transform);
    }

    /**
     * As {@link #mutate(Address, Function)}, but fails with a conflict up
     * front when the file no longer has the caller's {@code expected} version.
     */
    public Mutation mutate(Address address, FileVersion expected, Function<SectionTree, SectionEdit> transform) {
        requireWritable(address);
        String path = address.getDocumentPath();
        Path file = resolveFile(address);
        FileSnapshot snapshot;
        try {
            snapshot = guard.snapshot(file);
        } catch (NoSuchFileException e) {
            cache.invalidate(path);
            throw new DocumentNotFoundException(path);
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to read " + path, e);
        }
        if (expected != null && !expected.equals(snapshot.getVersion())) {
            cache.invalidate(path);
            throw new ConflictException(path, expected, snapshot.getVersion());
        }
        SectionEdit edit = transform.apply(SectionTree.parse(snapshot.getContent()));
        FileVersion written;
        try {
            written = guard.writeIfUnchanged(file, snapshot.getVersion(), edit.getContent(), path);
        } catch (ConflictException e) {
            cache.invalidate(path);
            throw e;
        } catch (IOException e) {
            throw GuideStoreException.internal("Failed to write " + path, e);
        }
        cache.invalidate(path);
        return new Mutation(snapshot.getContent(), edit, written);
    }

    Path resolveFile(Address address) {
        try {
            return workspace.resolvePath(address.getDocumentPath());
        } catch (SecurityException e) {
            throw AddressingException.invalidPath(address.getDocumentPath(), e.getMessage());
        }
    }

    private void requireWritable(Address address) {
        if (address.getNamespace() == Namespace.ARCHIVED) {
            throw new AddressingException(ErrorCode.NAMESPACE_VIOLATION,
                "Archived documents are read-only: " + address.getDocumentPath(),
                Map.of("path", address.getDocumentPath()));
        }
    }

    private static SectionOperation parseOperation(String value) {
        if (value == null || value.isBlank()) {
            throw AddressingException.missingParameter("operation");
        }
        return SectionOperation.fromValue(value)
            .orElseThrow(() -> AddressingException.invalidParameter("operation", "unknown operation '" + value + "'"));
    }

    private static SectionOperation parsePosition(String position) {
        if (position == null || position.isBlank()) {
            throw AddressingException.missingParameter("position");
        }
        switch (position.trim().toLowerCase()) {
            case "before":
                return SectionOperation.INSERT_BEFORE;
            case "after":
                return SectionOperation.INSERT_AFTER;
            case "child":
                return SectionOperation.APPEND_CHILD;
            default:
                throw AddressingException.invalidParameter("position", "must be before, after or child");
        }
    }

    static String unifiedDiff(String path, String before, String after) {
        List<String> original = Arrays.asList(before.split("\n", -1));
        List<String> revised = Arrays.asList(after.split("\n", -1));
        var patch = DiffUtils.diff(original, revised);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(path, path, original, patch, 3);
        return String.join("\n", unified);
    }

    /**
     * Result of one successful write.
     */
    public static class Mutation {
        private final String before;
        private final SectionEdit edit;
        private final FileVersion version;

        Mutation(String before, SectionEdit edit, FileVersion version) {
            this.before = before;
            this.edit = edit;
            this.version = version;
        }

        public String getBefore() {
            return before;
        }

        public SectionEdit getEdit() {
            return edit;
        }

        /** Version of the file as written; used to archive only if nobody wrote since. */
        public FileVersion getVersion() {
            return version;
        }
    }
}
