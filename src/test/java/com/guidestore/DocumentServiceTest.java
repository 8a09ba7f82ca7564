package com.guidestore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guidestore.addressing.Namespace;
import com.guidestore.cache.DocumentRecord;
import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ConflictException;
import com.guidestore.errors.DocumentNotFoundException;
import com.guidestore.errors.ErrorCode;
import com.guidestore.models.BatchEditResult;
import com.guidestore.models.SectionEditRequest;
import com.guidestore.models.SectionEditResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentServiceTest {

    private static final String GUIDE = "# Guide\n\n## Setup\n\nInstall it.\n\n## Usage\n\nRun it.\n";

    @TempDir
    Path tempDir;

    private StoreContext context;
    private DocumentService documents;

    @BeforeEach
    void setUp() throws Exception {
        context = new StoreContext(tempDir, new ObjectMapper(),
            Clock.fixed(Instant.parse("2026-10-16T09:30:00Z"), ZoneOffset.UTC));
        documents = context.documents();
        Files.writeString(tempDir.resolve("docs").resolve("guide.md"), GUIDE);
    }

    private String read() throws Exception {
        return Files.readString(tempDir.resolve("docs").resolve("guide.md"));
    }

    @Test
    void insertAfterWritesAndReportsDiff() throws Exception {
        SectionEditRequest request = new SectionEditRequest("/guide.md", "insert_after", "setup", "Config", "Edit it.");

        SectionEditResult result = documents.editSection(request);

        assertEquals("created", result.getAction());
        assertEquals("config", result.getSection());
        assertEquals(2, result.getDepth());
        assertTrue(result.getDiff().contains("+## Config"));
        assertTrue(read().contains("## Setup\n\nInstall it.\n\n## Config\n\nEdit it.\n\n## Usage"));
        assertEquals(result.getVersion(), documents.requireDocument("/guide.md").getLoadedVersion().asToken());
    }

    @Test
    void editInvalidatesCachedDocument() {
        documents.requireDocument("/guide.md");
        documents.editSection(new SectionEditRequest("/guide.md", "append", "usage", null, "Or stop it."));

        assertEquals("Run it.\n\nOr stop it.", documents.requireDocument("/guide.md").getTree().readOwnBody("usage"));
    }

    @Test
    void validationHappensBeforeIo() {
        AddressingException e = assertThrows(AddressingException.class, () ->
            documents.editSection(new SectionEditRequest("/missing.md", "explode", "x", null, "y")));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());

        e = assertThrows(AddressingException.class, () ->
            documents.editSection(new SectionEditRequest("/missing.md", "insert_after", "x", " ", "y")));
        assertEquals(ErrorCode.MISSING_PARAMETER, e.getCode());
    }

    @Test
    void editOnMissingDocumentFails() {
        assertThrows(DocumentNotFoundException.class, () ->
            documents.editSection(new SectionEditRequest("/missing.md", "append", "x", null, "y")));
    }

    @Test
    void staleVersionTokenConflicts() throws Exception {
        String version = documents.requireDocument("/guide.md").getLoadedVersion().asToken();
        documents.editSection(new SectionEditRequest("/guide.md", "append", "usage", null, "First."));

        SectionEditRequest stale = new SectionEditRequest("/guide.md", "append", "usage", null, "Second.");
        stale.setVersion(version);
        String before = read();

        assertThrows(ConflictException.class, () -> documents.editSection(stale));
        assertEquals(before, read());
    }

    @Test
    void batchReportsEachOperation() throws Exception {
        List<SectionEditRequest> ops = List.of(
            new SectionEditRequest(null, "append", "setup", null, "Then reboot."),
            new SectionEditRequest(null, "replace", "missing", null, "x"),
            new SectionEditRequest(null, "remove", "usage", null, null));

        BatchEditResult batch = documents.editSections("/guide.md", ops);

        assertEquals(2, batch.getSucceeded());
        assertEquals(1, batch.getFailed());
        assertFalse(batch.getResults().get(1).isSuccess());
        assertEquals("SECTION_NOT_FOUND", batch.getResults().get(1).getError().getCode());
        assertEquals("## Usage\n\nRun it.", batch.getResults().get(2).getResult().getRemovedContent());
        assertFalse(read().contains("## Usage"));
        assertTrue(read().contains("Then reboot."));
    }

    @Test
    void titleWithoutTextFailsOnlyItsOwnBatchEntry() throws Exception {
        List<SectionEditRequest> ops = List.of(
            new SectionEditRequest(null, "append", "setup", null, "Then reboot."),
            new SectionEditRequest(null, "insert_after", "setup", "***", "Body."),
            new SectionEditRequest(null, "replace", "usage", null, "## [](x)\n\nGone."),
            new SectionEditRequest(null, "append", "usage", null, "Or stop it."));

        BatchEditResult batch = documents.editSections("/guide.md", ops);

        assertEquals(2, batch.getSucceeded());
        assertEquals(2, batch.getFailed());
        assertEquals("INVALID_PARAMETER", batch.getResults().get(1).getError().getCode());
        assertEquals("INVALID_PARAMETER", batch.getResults().get(2).getError().getCode());
        assertTrue(read().contains("Then reboot."));
        assertTrue(read().contains("Run it.\n\nOr stop it."));
        assertFalse(read().contains("***"));
    }

    @Test
    void renameToMarkupOnlyTitleIsRejected() {
        AddressingException e = assertThrows(AddressingException.class, () ->
            documents.renameSection("/guide.md", "setup", "``"));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
    }

    @Test
    void batchAboveLimitIsRejected() {
        List<SectionEditRequest> ops = new ArrayList<>();
        for (int i = 0; i <= DocumentService.MAX_BATCH_SIZE; i++) {
            ops.add(new SectionEditRequest(null, "append", "setup", null, "line " + i));
        }
        AddressingException e = assertThrows(AddressingException.class, () -> documents.editSections("/guide.md", ops));
        assertEquals(ErrorCode.BATCH_TOO_LARGE, e.getCode());
    }

    @Test
    void createAndDeleteDocument() throws Exception {
        assertEquals("Notes", documents.createDocument("/notes/today.md", "Notes", "Hello.").getTitle());
        assertEquals("# Notes\n\nHello.\n", Files.readString(tempDir.resolve("docs/notes/today.md")));

        AddressingException e = assertThrows(AddressingException.class,
            () -> documents.createDocument("/notes/today.md", "Again", null));
        assertEquals(ErrorCode.ALREADY_EXISTS, e.getCode());

        documents.deleteDocument("/notes/today.md");
        assertTrue(documents.getDocument("/notes/today.md").isEmpty());
        assertThrows(DocumentNotFoundException.class, () -> documents.deleteDocument("/notes/today.md"));
    }

    @Test
    void archivedDocumentsAreReadOnly() {
        AddressingException e = assertThrows(AddressingException.class,
            () -> documents.createDocument("/archived/docs/x.md", "X", null));
        assertEquals(ErrorCode.NAMESPACE_VIOLATION, e.getCode());
    }

    @Test
    void readSectionAndListing() {
        assertEquals("## Usage\n\nRun it.", documents.readSection("/guide.md", "usage"));
        assertEquals(List.of("/guide.md"), documents.listDocuments(Namespace.DOCS));
    }

    @Test
    void moveDocumentRelocatesFileAndCacheEntries() throws Exception {
        documents.requireDocument("/guide.md");

        DocumentRecord moved = documents.moveDocument("/guide.md", "manuals/guide");

        assertEquals("/manuals/guide.md", moved.getPath());
        assertTrue(documents.getDocument("/guide.md").isEmpty());
        assertTrue(documents.getDocument("/manuals/guide.md").isPresent());
        assertEquals(GUIDE, Files.readString(tempDir.resolve("docs/manuals/guide.md")));
        assertFalse(Files.exists(tempDir.resolve("docs/guide.md")));
    }

    @Test
    void moveDocumentRefusesExistingDestination() {
        documents.createDocument("/other.md", "Other", null);

        AddressingException e = assertThrows(AddressingException.class,
            () -> documents.moveDocument("/guide.md", "/other.md"));

        assertEquals(ErrorCode.ALREADY_EXISTS, e.getCode());
        assertTrue(documents.getDocument("/guide.md").isPresent());
    }

    @Test
    void moveSectionWithinDocument() throws Exception {
        SectionEditResult result = documents.moveSection("/guide.md#usage", "/guide.md", "setup", "before");

        assertEquals("moved", result.getAction());
        assertEquals("/guide.md#usage", result.getMovedFrom());
        assertEquals("usage", result.getSection());
        assertTrue(read().contains("## Usage\n\nRun it.\n\n## Setup\n\nInstall it."));
    }

    @Test
    void moveSectionAcrossDocuments() throws Exception {
        documents.createDocument("/other.md", "Other", "Intro.");

        SectionEditResult result = documents.moveSection("/guide.md#setup", "/other.md", "other", "child");

        assertEquals("/other.md", result.getDocument());
        assertEquals(2, result.getDepth());
        assertTrue(Files.readString(tempDir.resolve("docs/other.md")).contains("Intro.\n\n## Setup\n\nInstall it."));
        assertFalse(read().contains("## Setup"));
        assertTrue(read().contains("## Usage"));
    }

    @Test
    void moveSectionIntoItselfIsRejected() throws Exception {
        AddressingException e = assertThrows(AddressingException.class,
            () -> documents.moveSection("/guide.md#guide", "/guide.md", "setup", "after"));

        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
        assertEquals(GUIDE, read());
    }

    @Test
    void renameSection() throws Exception {
        SectionEditResult result = documents.renameSection("/guide.md", "usage", "Running");
        assertEquals("running", result.getSection());
        assertTrue(read().contains("## Running\n\nRun it."));
    }
}
