package me.golemcore.runtime.domain.compaction;

import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderUsage;
import me.golemcore.runtime.domain.model.StopReason;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptRendererTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldRenderRolesToolCallsAndResults() {
        TranscriptRenderer renderer = new TranscriptRenderer(objectMapper, 2000, 100000);
        List<Message> history = List.of(
                Message.user("hi"),
                Message.assistant(List.of(new ToolUseBlock("t1", "bash", Map.of("command", "ls"))),
                        ProviderUsage.EMPTY, StopReason.TOOL_USE),
                Message.toolProgress("t1", "listing"),
                Message.toolResult(ToolResultBlock.text("t1", "a.txt", false)),
                Message.toolResult(ToolResultBlock.text("t2", "boom", true)));

        String transcript = renderer.render(history);

        assertEquals("USER:\nhi\n\n"
                + "ASSISTANT:\n[Tool call: bash {\"command\":\"ls\"}]\n\n"
                + "USER:\n[Tool result: a.txt]\n\n"
                + "USER:\n[Tool result (error): boom]", transcript);
    }

    @Test
    void shouldCapLongMessages() {
        TranscriptRenderer renderer = new TranscriptRenderer(objectMapper, 20, 100000);

        String rendered = renderer.renderMessage(Message.user("x".repeat(30)));

        assertEquals("USER:\n" + "x".repeat(14) + "... [16 chars omitted]", rendered);
    }

    @Test
    void shouldDropOldestMessagesOverTotalBudget() {
        TranscriptRenderer renderer = new TranscriptRenderer(objectMapper, 2000, 40);
        List<Message> history = List.of(
                Message.user("first-----"),
                Message.user("second----"),
                Message.user("third-----"));

        String transcript = renderer.render(history);

        assertTrue(transcript.startsWith("[1 earlier messages omitted]\n\n"));
        assertFalse(transcript.contains("first"));
        assertTrue(transcript.endsWith("USER:\nthird-----"));
    }

    @Test
    void shouldAlwaysKeepNewestMessage() {
        TranscriptRenderer renderer = new TranscriptRenderer(objectMapper, 2000, 5);

        String transcript = renderer.render(List.of(Message.user("older"), Message.user("newest message")));

        assertEquals("[1 earlier messages omitted]\n\nUSER:\nnewest message", transcript);
    }
}
