package me.golemcore.runtime.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentRepairerTest {

    private final ToolArgumentRepairer repairer = new ToolArgumentRepairer(new ObjectMapper());

    @Test
    void shouldParseValidJsonWithoutRepair() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{\"command\": \"ls -la\", \"timeout\": 30}");

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.repaired());
        assertEquals(Map.of("command", "ls -la", "timeout", 30), outcome.arguments());
    }

    @Test
    void shouldTreatBlankArgumentsAsEmptyObject() {
        assertEquals(Map.of(), repairer.parse("").arguments());
        assertEquals(Map.of(), repairer.parse(null).arguments());
        assertTrue(repairer.parse("  ").isSuccess());
    }

    @Test
    void shouldRepairSingleQuotes() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{'pattern': 'foo'}");

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.repaired());
        assertEquals(Map.of("pattern", "foo"), outcome.arguments());
    }

    @Test
    void shouldKeepApostropheInsideSingleQuotedValue() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{'message': 'don't panic'}");

        assertEquals("don't panic", outcome.arguments().get("message"));
    }

    @Test
    void shouldFailOnUnquotedUnterminatedObject() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{pattern: foo");

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.error().startsWith("Could not parse tool arguments as JSON: "));
        assertEquals(Map.of(), outcome.arguments());
    }

    @Test
    void shouldRemoveTrailingCommas() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{\"paths\": [\"a\", \"b\",], \"recursive\": true,}");

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("a", "b"), outcome.arguments().get("paths"));
        assertEquals(true, outcome.arguments().get("recursive"));
    }

    @Test
    void shouldCloseTruncatedObject() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{\"command\": \"git status\", \"cwd\": \"/tmp/pro");

        assertTrue(outcome.isSuccess());
        assertEquals("git status", outcome.arguments().get("command"));
        assertEquals("/tmp/pro", outcome.arguments().get("cwd"));
    }

    @Test
    void shouldExtractObjectFromSurroundingProse() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("Sure! Here you go: {\"path\": \"README.md\"} Done.");

        assertEquals(Map.of("path", "README.md"), outcome.arguments());
    }

    @Test
    void shouldReplacePythonLiterals() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{\"force\": True, \"limit\": None, \"note\": \"True\"}");

        assertTrue(outcome.isSuccess());
        assertEquals(true, outcome.arguments().get("force"));
        assertNull(outcome.arguments().get("limit"));
        assertTrue(outcome.arguments().containsKey("limit"));
        assertEquals("True", outcome.arguments().get("note"));
    }

    @Test
    void shouldEscapeRawNewlinesInsideStrings() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{\"content\": \"line one\nline two\"}");

        assertEquals("line one\nline two", outcome.arguments().get("content"));
    }

    @Test
    void shouldEscapeUnescapedInnerQuotes() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("{\"command\": \"echo \"hi there\" now\"}");

        assertEquals("echo \"hi there\" now", outcome.arguments().get("command"));
    }

    @Test
    void shouldUnwrapDoubleEncodedJson() {
        ToolArgumentRepairer.Outcome outcome = repairer.parse("\"{\\\"query\\\": \\\"weather\\\"}\"");

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.repaired());
        assertEquals(Map.of("query", "weather"), outcome.arguments());
    }

    @Test
    void shouldRejectNonObjectJson() {
        assertFalse(repairer.parse("[1, 2, 3]").isSuccess());
        assertFalse(repairer.parse("42").isSuccess());
    }

    @Test
    void shouldBalanceNestedStructures() {
        assertEquals("{\"a\": [1, {\"b\": 2}]}", ToolArgumentRepairer.balance("{\"a\": [1, {\"b\": 2"));
        assertEquals("{\"a\":null}", ToolArgumentRepairer.balance("{\"a\":"));
    }
}
