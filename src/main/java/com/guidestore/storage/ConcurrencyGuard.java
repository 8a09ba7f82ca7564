package com.guidestore.storage;

import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ConflictException;
import com.guidestore.errors.ErrorCode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Snapshot-then-conditional-write over plain files that other processes may
 * also edit. A write succeeds only if the file still has the version the
 * caller read; otherwise a {@link ConflictException} is raised and the file
 * is left untouched. Conflicts are never retried here.
 *
 * <p>Within this process the compare and the write happen under a per-path
 * lock, so of several writers holding the same version exactly one wins.
 */
public class ConcurrencyGuard {

    private final Map<Path, Object> locks = new ConcurrentHashMap<>();

    @FunctionalInterface
    public interface GuardedAction<T> {
        T run() throws IOException;
    }

    public FileSnapshot snapshot(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        byte[] bytes = Files.readAllBytes(file);
        FileVersion version = new FileVersion(attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS),
            bytes.length, ContentHash.of(bytes));
        return new FileSnapshot(new String(bytes, StandardCharsets.UTF_8), version);
    }

    public Optional<FileVersion> currentVersion(Path file) throws IOException {
        try {
            return Optional.of(snapshot(file).getVersion());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    public FileVersion writeIfUnchanged(Path file, FileVersion expected, String content) throws IOException {
        return writeIfUnchanged(file, expected, content, file.toString());
    }

    /**
     * Writes {@code content} only if the file's current version equals
     * {@code expected}. Returns the version of the written file.
     */
    public FileVersion writeIfUnchanged(Path file, FileVersion expected, String content, String displayPath)
            throws IOException {
        return runIfUnchanged(file, expected, displayPath, () -> {
            writeAtomically(file, content);
            return currentVersion(file).orElseThrow(() -> new NoSuchFileException(file.toString()));
        });
    }

    /**
     * Runs {@code action} under the path lock after confirming the file still
     * has version {@code expected}.
     */
    public <T> T runIfUnchanged(Path file, FileVersion expected, String displayPath, GuardedAction<T> action)
            throws IOException {
        synchronized (lockFor(file)) {
            FileVersion actual = currentVersion(file).orElse(null);
            if (actual == null || !actual.equals(expected)) {
                throw new ConflictException(displayPath, expected, actual);
            }
            return action.run();
        }
    }

    /** Creates a new file; fails with ALREADY_EXISTS if something is there. */
    public FileVersion create(Path file, String content, String displayPath) throws IOException {
        synchronized (lockFor(file)) {
            if (Files.exists(file)) {
                throw new AddressingException(ErrorCode.ALREADY_EXISTS,
                    "Document already exists: " + displayPath, Map.of("path", displayPath));
            }
            writeAtomically(file, content);
            return currentVersion(file).orElseThrow(() -> new NoSuchFileException(file.toString()));
        }
    }

    public void delete(Path file, FileVersion expected, String displayPath) throws IOException {
        runIfUnchanged(file, expected, displayPath, () -> {
            Files.delete(file);
            return null;
        });
    }

    private Object lockFor(Path file) {
        return locks.computeIfAbsent(file.toAbsolutePath().normalize(), k -> new Object());
    }

    /** Temp file in the same directory, then a rename over the target. */
    static void writeAtomically(Path file, String content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, "." + file.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
