package com.guidestore.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallParserTest {

    private final ToolCallParser parser = new ToolCallParser(new ObjectMapper(), ToolSchemaRegistry.defaults());

    @Test
    void parseValidToolCall() {
        String json = "{\"tool\":\"section\",\"args\":{\"document\":\"/guide.md\",\"operation\":\"insert_after\","
            + "\"section\":\"setup\",\"title\":\"Config\",\"content\":\"Edit it.\",\"depth\":2}}";
        ToolCallParseResult result = parser.parse(json);
        assertTrue(result.isToolCall());
        assertEquals("section", result.getCall().getName());
        assertEquals("/guide.md", result.getCall().getArgs().get("document"));
        assertEquals(2, result.getCall().getArgs().get("depth"));
    }

    @Test
    void acceptsSingleCodeFence() {
        String json = "```json\n{\"tool\":\"view_document\",\"args\":{\"document\":\"/guide.md\"}}\n```";
        ToolCallParseResult result = parser.parse(json);
        assertTrue(result.isToolCall());
        assertEquals("view_document", result.getCall().getName());
    }

    @Test
    void stripsInvisibleEdgeCharacters() {
        String json = "\uFEFF{\"tool\":\"start_task\",\"args\":{\"task\":\"/plan.md#a\"}}\u200B";
        assertTrue(parser.parse(json).isToolCall());
    }

    @Test
    void normalizesToolNameAndArgumentAliases() {
        String json = "{\"tool\":\"View-Section\",\"args\":{\"Path\":\"/guide.md\",\"slug\":\"setup\"}}";
        ToolCallParseResult result = parser.parse(json);
        assertTrue(result.isToolCall());
        assertEquals("view_section", result.getCall().getName());
        assertEquals(Map.of("document", "/guide.md", "section", "setup"), result.getCall().getArgs());
    }

    @Test
    void mapsKnownToolAliases() {
        String json = "{\"tool\":\"finish_task\",\"args\":{\"task\":\"/plan.md#a\",\"note\":\"done\"}}";
        assertEquals("complete_task", parser.parse(json).getCall().getName());
    }

    @Test
    void rejectsUnknownTool() {
        ToolCallParseResult result = parser.parse("{\"tool\":\"rm_rf\",\"args\":{}}");
        assertFalse(result.isToolCall());
        assertEquals(ToolCallParser.ERR_UNKNOWN_TOOL, result.getErrorCode());
    }

    @Test
    void rejectsInvalidArgsUnknownKey() {
        String json = "{\"tool\":\"view_document\",\"args\":{\"document\":\"/guide.md\",\"extra\":true}}";
        ToolCallParseResult result = parser.parse(json);
        assertEquals(ToolCallParser.ERR_INVALID_ARGS, result.getErrorCode());
        assertEquals("unknown-arg:extra", result.getErrorDetail());
    }

    @Test
    void rejectsMissingRequiredArg() {
        ToolCallParseResult result = parser.parse("{\"tool\":\"complete_task\",\"args\":{\"task\":\"/plan.md#a\"}}");
        assertEquals(ToolCallParser.ERR_INVALID_ARGS, result.getErrorCode());
        assertEquals("missing-required:note", result.getErrorDetail());
    }

    @Test
    void rejectsWrongTypesAndEnumValues() {
        ToolCallParseResult depth = parser.parse(
            "{\"tool\":\"section\",\"args\":{\"document\":\"/guide.md\",\"depth\":\"two\"}}");
        assertEquals("invalid-type:depth", depth.getErrorDetail());

        ToolCallParseResult op = parser.parse(
            "{\"tool\":\"section\",\"args\":{\"document\":\"/guide.md\",\"operation\":\"explode\"}}");
        assertEquals("invalid-enum:operation", op.getErrorDetail());
    }

    @Test
    void acceptsBatchOperations() {
        String json = "{\"tool\":\"section\",\"args\":{\"document\":\"/guide.md\",\"operations\":["
            + "{\"operation\":\"append\",\"section\":\"setup\",\"content\":\"x\"}]}}";
        ToolCallParseResult result = parser.parse(json);
        assertTrue(result.isToolCall());
        assertEquals(1, ((List<?>) result.getCall().getArgs().get("operations")).size());

        ToolCallParseResult bad = parser.parse(
            "{\"tool\":\"section\",\"args\":{\"document\":\"/guide.md\",\"operations\":[\"append\"]}}");
        assertEquals("invalid-type:operations", bad.getErrorDetail());
    }

    @Test
    void rejectsUnknownTopLevelField() {
        String json = "{\"tool\":\"view_document\",\"args\":{\"document\":\"/guide.md\"},\"extra\":1}";
        ToolCallParseResult result = parser.parse(json);
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
        assertEquals("unknown-field:extra", result.getErrorDetail());
    }

    @Test
    void rejectsMultipleObjects() {
        String json = "{\"tool\":\"view_document\",\"args\":{\"document\":\"/a.md\"}}"
            + "{\"tool\":\"view_document\",\"args\":{\"document\":\"/b.md\"}}";
        assertEquals(ToolCallParser.ERR_MULTIPLE, parser.parse(json).getErrorCode());
    }

    @Test
    void bracesInsideStringsAreNotObjects() {
        String json = "{\"tool\":\"section\",\"args\":{\"document\":\"/guide.md\",\"operation\":\"append\","
            + "\"section\":\"setup\",\"content\":\"use {} and }{ freely\"}}";
        assertTrue(parser.parse(json).isToolCall());
    }

    @Test
    void rejectsInvalidJsonAndProse() {
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, parser.parse("{\"tool\":").getErrorCode());
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, parser.parse("please view the doc").getErrorCode());
        assertEquals(ToolCallParser.ERR_INVALID_FORMAT, parser.parse("   ").getErrorCode());
    }
}
