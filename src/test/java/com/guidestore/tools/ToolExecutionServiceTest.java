package com.guidestore.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guidestore.StoreContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ToolExecutionServiceTest {

    private static final String PLAN = "# Plan\n\n## Tasks\n\n### A\n\n- Status: pending\n\n### B\n\n- Status: pending\n";

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private ToolCallParser parser;
    private ToolExecutionService executor;

    @BeforeEach
    void setUp() throws Exception {
        StoreContext context = new StoreContext(tempDir, mapper,
            Clock.fixed(Instant.parse("2026-10-16T09:30:00Z"), ZoneOffset.UTC));
        parser = new ToolCallParser(mapper, ToolSchemaRegistry.defaults());
        executor = new ToolExecutionService(context.documents(), context.tasks(), context.archives(), mapper);
        Files.writeString(tempDir.resolve("docs/plan.md"), PLAN);
    }

    private ToolExecutionResult run(String json) {
        ToolCallParseResult parsed = parser.parse(json);
        assertTrue(parsed.isToolCall(), () -> "parse failed: " + parsed.getErrorCode() + " " + parsed.getErrorDetail());
        return executor.execute(parsed.getCall(), new ToolExecutionContext("s1", "agent-7"));
    }

    @Test
    void viewDocumentReturnsOutlineAndTaskSummary() throws Exception {
        ToolExecutionResult result = run("{\"tool\":\"view_document\",\"args\":{\"document\":\"/plan.md\"}}");

        assertTrue(result.isOk());
        JsonNode out = mapper.readTree(result.getOutput());
        assertEquals("/plan.md", out.get("path").asText());
        assertEquals("Plan", out.get("title").asText());
        assertEquals(4, out.get("headings").size());
        assertEquals(2, out.get("tasks").get("total").asInt());
        assertEquals("a", out.get("nextTask").asText());
        assertEquals(PLAN, out.get("content").asText());
    }

    @Test
    void sectionEditAndViewSection() throws Exception {
        ToolExecutionResult edit = run("{\"tool\":\"section\",\"args\":{\"document\":\"/plan.md\","
            + "\"operation\":\"prepend\",\"section\":\"plan\",\"content\":\"Overview.\"}}");
        assertTrue(edit.isOk());
        assertEquals("edited", mapper.readTree(edit.getOutput()).get("action").asText());

        ToolExecutionResult view = run("{\"tool\":\"view_section\",\"args\":{\"document\":\"/plan.md\",\"section\":\"a\"}}");
        JsonNode out = mapper.readTree(view.getOutput());
        assertEquals("tasks/a", out.get("path").asText());
        assertEquals("### A\n\n- Status: pending", out.get("content").asText());
    }

    @Test
    void moveDocumentTool() throws Exception {
        ToolExecutionResult result = run("{\"tool\":\"rename-document\",\"args\":{\"from\":\"/plan.md\",\"to\":\"/done/plan\"}}");

        assertTrue(result.isOk());
        JsonNode out = mapper.readTree(result.getOutput());
        assertEquals("/done/plan.md", out.get("path").asText());
        assertEquals("/plan.md", out.get("movedFrom").asText());
        assertTrue(Files.exists(tempDir.resolve("docs/done/plan.md")));
        assertFalse(Files.exists(tempDir.resolve("docs/plan.md")));
    }

    @Test
    void moveTaskBetweenPositions() throws Exception {
        ToolExecutionResult result = run("{\"tool\":\"move\",\"args\":{\"from\":\"/plan.md#b\",\"to\":\"/plan.md\","
            + "\"reference\":\"a\",\"position\":\"before\"}}");

        assertTrue(result.isOk());
        assertEquals("moved", mapper.readTree(result.getOutput()).get("action").asText());
        assertTrue(Files.readString(tempDir.resolve("docs/plan.md")).indexOf("### B")
            < Files.readString(tempDir.resolve("docs/plan.md")).indexOf("### A"));
    }

    @Test
    void batchSectionEdits() throws Exception {
        ToolExecutionResult result = run("{\"tool\":\"section\",\"args\":{\"document\":\"/plan.md\",\"operations\":["
            + "{\"operation\":\"append\",\"section\":\"a\",\"content\":\"- Owner: sam\"},"
            + "{\"operation\":\"remove\",\"section\":\"nope\"}]}}");

        assertTrue(result.isOk());
        JsonNode out = mapper.readTree(result.getOutput());
        assertEquals(1, out.get("succeeded").asInt());
        assertEquals(1, out.get("failed").asInt());
    }

    @Test
    void completeTaskReportsNextTask() throws Exception {
        ToolExecutionResult result = run("{\"tool\":\"complete_task\",\"args\":{\"task\":\"/plan.md#a\","
            + "\"note\":\"done\",\"return_next_task\":true}}");

        assertTrue(result.isOk());
        JsonNode out = mapper.readTree(result.getOutput());
        assertEquals("completed", out.get("completedTask").get("status").asText());
        assertEquals("b", out.get("nextTask").get("slug").asText());
        assertFalse(out.get("archived").asBoolean());
    }

    @Test
    void taskListAndSummary() throws Exception {
        JsonNode list = mapper.readTree(run(
            "{\"tool\":\"task\",\"args\":{\"document\":\"/plan.md\",\"operation\":\"list\",\"status\":\"pending\"}}")
            .getOutput());
        assertEquals(2, list.get("tasks").size());

        JsonNode summary = mapper.readTree(run(
            "{\"tool\":\"task\",\"args\":{\"document\":\"/plan.md\",\"operation\":\"summary\"}}").getOutput());
        assertEquals(2, summary.get("byStatus").get("pending").asInt());
    }

    @Test
    void archiveRecordsAgentAsArchiver() throws Exception {
        ToolExecutionResult result = run("{\"tool\":\"archive_document\",\"args\":{\"path\":\"/plan.md\",\"audit\":true}}");

        assertTrue(result.isOk());
        assertTrue(Files.readString(tempDir.resolve("archived/docs/plan.md.audit")).contains("agent-7"));
    }

    @Test
    void failuresCarryStructuredError() throws Exception {
        ToolExecutionResult result = run("{\"tool\":\"view_section\",\"args\":{\"document\":\"/plan.md\",\"section\":\"zzz\"}}");

        assertFalse(result.isOk());
        assertEquals("SECTION_NOT_FOUND", result.getError());
        JsonNode out = mapper.readTree(result.getOutput());
        assertEquals("ADDRESSING", out.get("category").asText());
        assertEquals("zzz", out.get("context").get("slug").asText());
    }

    @Test
    void missingDocumentIsNotFound() {
        ToolExecutionResult result = run("{\"tool\":\"view_document\",\"args\":{\"document\":\"/none.md\"}}");
        assertEquals("DOCUMENT_NOT_FOUND", result.getError());
    }
}
