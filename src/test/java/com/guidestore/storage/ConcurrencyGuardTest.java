package com.guidestore.storage;

import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ConflictException;
import com.guidestore.errors.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyGuardTest {

    @TempDir
    Path tempDir;

    private final ConcurrencyGuard guard = new ConcurrencyGuard();

    @Test
    void freshWriteStoresExactContent() throws Exception {
        Path file = tempDir.resolve("a.md");
        Files.writeString(file, "# A\n");
        FileSnapshot snapshot = guard.snapshot(file);

        FileVersion written = guard.writeIfUnchanged(file, snapshot.getVersion(), "# A\n\nmore\n");

        assertEquals("# A\n\nmore\n", Files.readString(file));
        assertEquals(written, guard.currentVersion(file).orElseThrow());
        assertNotEquals(snapshot.getVersion(), written);
    }

    @Test
    void staleWriteConflictsAndLeavesFileUntouched() throws Exception {
        Path file = tempDir.resolve("a.md");
        Files.writeString(file, "one\n");
        FileVersion stale = guard.snapshot(file).getVersion();
        guard.writeIfUnchanged(file, stale, "two\n");

        ConflictException e = assertThrows(ConflictException.class,
            () -> guard.writeIfUnchanged(file, stale, "three\n"));
        assertEquals(ErrorCode.CONFLICT, e.getCode());
        assertEquals("two\n", Files.readString(file));
    }

    @Test
    void writeToDeletedFileConflicts() throws Exception {
        Path file = tempDir.resolve("gone.md");
        Files.writeString(file, "x");
        FileVersion version = guard.snapshot(file).getVersion();
        Files.delete(file);

        assertThrows(ConflictException.class, () -> guard.writeIfUnchanged(file, version, "y"));
        assertFalse(Files.exists(file));
    }

    @Test
    void twoWritersWithSameSnapshotOneWins() throws Exception {
        Path file = tempDir.resolve("race.md");
        Files.writeString(file, "base\n");
        FileVersion version = guard.snapshot(file).getVersion();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<FileVersion>> futures = new ArrayList<>();
            for (String content : List.of("left\n", "right\n")) {
                Callable<FileVersion> writer = () -> {
                    start.await();
                    return guard.writeIfUnchanged(file, version, content);
                };
                futures.add(pool.submit(writer));
            }
            start.countDown();

            int wins = 0;
            int conflicts = 0;
            for (Future<FileVersion> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    wins++;
                } catch (ExecutionException e) {
                    assertInstanceOf(ConflictException.class, e.getCause());
                    conflicts++;
                }
            }
            assertEquals(1, wins);
            assertEquals(1, conflicts);
            String content = Files.readString(file);
            assertTrue(content.equals("left\n") || content.equals("right\n"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void createRefusesExistingFile() throws Exception {
        Path file = tempDir.resolve("new.md");
        guard.create(file, "# New\n", "/new.md");
        assertEquals("# New\n", Files.readString(file));

        AddressingException e = assertThrows(AddressingException.class,
            () -> guard.create(file, "again", "/new.md"));
        assertEquals(ErrorCode.ALREADY_EXISTS, e.getCode());
    }

    @Test
    void malformedVersionTokenIsRejected() {
        AddressingException e = assertThrows(AddressingException.class, () -> FileVersion.parse("not-a-token"));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
    }
}
