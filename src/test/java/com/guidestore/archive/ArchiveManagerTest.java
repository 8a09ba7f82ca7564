package com.guidestore.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guidestore.StoreContext;
import com.guidestore.errors.AddressingException;
import com.guidestore.errors.DocumentNotFoundException;
import com.guidestore.errors.ErrorCode;
import com.guidestore.storage.JsonStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveManagerTest {

    @TempDir
    Path tempDir;

    private StoreContext context;
    private ArchiveManager archives;

    @BeforeEach
    void setUp() throws Exception {
        context = new StoreContext(tempDir, new ObjectMapper(),
            Clock.fixed(Instant.parse("2026-10-16T09:30:00Z"), ZoneOffset.UTC));
        archives = context.archives();
    }

    private Path writeDoc(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void archivesDocumentWithAudit() throws Exception {
        writeDoc("docs/guide.md", "# Guide\n");
        context.documents().requireDocument("/guide.md");

        ArchiveRecord record = archives.archive("/guide.md", true, "agent-7", "obsolete");

        assertEquals("/guide.md", record.getOriginalPath());
        assertEquals("/archived/docs/guide.md", record.getArchivePath());
        assertEquals("/archived/docs/guide.md.audit", record.getAuditPath());
        assertFalse(record.isWasFolder());
        assertFalse(Files.exists(tempDir.resolve("docs/guide.md")));
        assertEquals("# Guide\n", Files.readString(tempDir.resolve("archived/docs/guide.md")));
        assertFalse(context.cache().isCached("/guide.md"));

        ArchiveAudit audit = JsonStorage.readJson(tempDir.resolve("archived/docs/guide.md.audit"), ArchiveAudit.class)
            .orElseThrow();
        assertEquals("/guide.md", audit.getOriginalPath());
        assertEquals("agent-7", audit.getArchivedBy());
        assertEquals("file", audit.getType());
        assertEquals("obsolete", audit.getNote());
        assertEquals("2026-10-16T09:30:00Z", audit.getArchivedAt());
    }

    @Test
    void collidingTargetsGetSuffix() throws Exception {
        writeDoc("docs/guide.md", "# One\n");
        archives.archive("/guide.md", false, null, null);
        writeDoc("docs/guide.md", "# Two\n");

        ArchiveRecord second = archives.archive("/guide.md", false, null, null);

        assertEquals("/archived/docs/guide_1.md", second.getArchivePath());
        assertNull(second.getAuditPath());
        assertEquals("# One\n", Files.readString(tempDir.resolve("archived/docs/guide.md")));
        assertEquals("# Two\n", Files.readString(tempDir.resolve("archived/docs/guide_1.md")));
    }

    @Test
    void auditWithoutAgentRecordsUnknown() throws Exception {
        writeDoc("docs/guide.md", "# Guide\n");
        archives.archive("/guide.md", true, null, null);

        ArchiveAudit audit = JsonStorage.readJson(tempDir.resolve("archived/docs/guide.md.audit"), ArchiveAudit.class)
            .orElseThrow();
        assertEquals("unknown", audit.getArchivedBy());
    }

    @Test
    void archivesFolder() throws Exception {
        writeDoc("docs/api/a.md", "# A\n");
        writeDoc("docs/api/deep/b.md", "# B\n");

        ArchiveRecord record = archives.archive("/api", false, null, null);

        assertTrue(record.isWasFolder());
        assertEquals("/archived/docs/api", record.getArchivePath());
        assertFalse(Files.exists(tempDir.resolve("docs/api")));
        assertTrue(Files.exists(tempDir.resolve("archived/docs/api/a.md")));
        assertTrue(Files.exists(tempDir.resolve("archived/docs/api/deep/b.md")));
    }

    @Test
    void copyPathVerifiesAndDeletesSource() throws Exception {
        writeDoc("docs/api/a.md", "# A\n");
        writeDoc("docs/guide.md", "# Guide\n");
        archives.setAtomicMoveEnabled(false);

        archives.archive("/api", false, null, null);
        archives.archive("/guide.md", false, null, null);

        assertFalse(Files.exists(tempDir.resolve("docs/api")));
        assertFalse(Files.exists(tempDir.resolve("docs/guide.md")));
        assertEquals("# A\n", Files.readString(tempDir.resolve("archived/docs/api/a.md")));
        assertEquals("# Guide\n", Files.readString(tempDir.resolve("archived/docs/guide.md")));
        assertFalse(Files.exists(tempDir.resolve("archived/docs/guide.md.pending")));
    }

    @Test
    void coordinatorDocumentsArchiveUnderTheirFolder() throws Exception {
        writeDoc("coordinator/side.md", "# Side\n");
        ArchiveRecord record = archives.archive("/coordinator/side.md", false, null, null);
        assertEquals("/archived/coordinator/side.md", record.getArchivePath());
    }

    @Test
    void rejectsArchivedAndMissingSources() throws Exception {
        writeDoc("archived/docs/old.md", "# Old\n");

        AddressingException e = assertThrows(AddressingException.class,
            () -> archives.archive("/archived/docs/old.md", false, null, null));
        assertEquals(ErrorCode.NAMESPACE_VIOLATION, e.getCode());
        assertThrows(DocumentNotFoundException.class, () -> archives.archive("/nope.md", false, null, null));
        assertThrows(AddressingException.class, () -> archives.archive("/guide.md#intro", false, null, null));
    }

    @Test
    void recoveryFinishesVerifiedCopy() throws Exception {
        writeDoc("docs/x.md", "# X\n");
        writeDoc("archived/docs/x.md", "# X\n");
        JsonStorage.writeJson(tempDir.resolve("archived/docs/x.md.pending"),
            new PendingArchive("/x.md", "/archived/docs/x.md", false, "2026-10-16T09:00:00Z"));

        List<ArchiveRecord> recovered = archives.recoverIncomplete();

        assertEquals(1, recovered.size());
        assertEquals("/archived/docs/x.md", recovered.get(0).getArchivePath());
        assertFalse(Files.exists(tempDir.resolve("docs/x.md")));
        assertFalse(Files.exists(tempDir.resolve("archived/docs/x.md.pending")));
    }

    @Test
    void recoveryRollsBackUnverifiedCopy() throws Exception {
        writeDoc("docs/x.md", "# X\n");
        writeDoc("archived/docs/x.md", "# X (partial");
        JsonStorage.writeJson(tempDir.resolve("archived/docs/x.md.pending"),
            new PendingArchive("/x.md", "/archived/docs/x.md", false, "2026-10-16T09:00:00Z"));

        assertTrue(archives.recoverIncomplete().isEmpty());
        assertTrue(Files.exists(tempDir.resolve("docs/x.md")));
        assertFalse(Files.exists(tempDir.resolve("archived/docs/x.md")));
        assertFalse(Files.exists(tempDir.resolve("archived/docs/x.md.pending")));
    }

    @Test
    void timestampNamesAreFileSafe() {
        assertEquals("2026-10-16T09-30-00", ArchiveManager.timestampName(Instant.parse("2026-10-16T09:30:00.123Z")));
    }
}
