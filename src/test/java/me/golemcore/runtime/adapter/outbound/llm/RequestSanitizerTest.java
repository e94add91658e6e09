package me.golemcore.runtime.adapter.outbound.llm;

import me.golemcore.runtime.domain.model.ContentBlock;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderUsage;
import me.golemcore.runtime.domain.model.StopReason;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RequestSanitizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RequestSanitizer sanitizer = new RequestSanitizer(objectMapper, 100, 1000);

    @Test
    void shouldNormalizeLineEndings() {
        assertEquals("a\nb\nc", sanitizer.sanitizeText("a\r\nb\rc"));
    }

    @Test
    void shouldDropControlCharactersButKeepTabsAndNewlines() {
        assertEquals("ab\tc\nd", sanitizer.sanitizeText("a\u0000b\tc\n\u0007d\u007F\u0085"));
    }

    @Test
    void shouldReplaceLoneSurrogates() {
        assertEquals("x\uFFFDy\uFFFD", sanitizer.sanitizeText("x\uD800y\uDC00"));
        assertEquals("ok \uD83D\uDE00", sanitizer.sanitizeText("ok \uD83D\uDE00"));
    }

    @Test
    void shouldCloseUnbalancedCodeFence() {
        assertEquals("```java\nint x;\n```", sanitizer.sanitizeText("```java\nint x;\n"));
        assertEquals("```a```", sanitizer.sanitizeText("```a```"));
    }

    @Test
    void shouldProduceJsonThatRoundTripsForArbitraryInput() throws Exception {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            StringBuilder garbage = new StringBuilder();
            int length = random.nextInt(64);
            for (int j = 0; j < length; j++) {
                garbage.append((char) random.nextInt(0x10000));
            }
            String clean = sanitizer.sanitizeText(garbage.toString());

            String json = objectMapper.writeValueAsString(Map.of("text", clean));
            JsonNode parsed = objectMapper.readTree(json);

            assertEquals(clean, parsed.get("text").asText());
        }
    }

    @Test
    void shouldDropToolProgressMessages() {
        List<Message> prepared = sanitizer.prepare(List.of(
                Message.user("build it"),
                Message.toolProgress("t1", "compiling"),
                Message.assistantText("done")));

        assertEquals(2, prepared.size());
        assertTrue(prepared.stream().noneMatch(Message::isToolProgress));
    }

    @Test
    void shouldKeepOnlyNewestMessages() {
        RequestSanitizer small = new RequestSanitizer(objectMapper, 3, 1000);
        List<Message> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(i % 2 == 0 ? Message.user("u" + i) : Message.assistantText("a" + i));
        }

        List<Message> prepared = small.prepare(history);

        // last three start with an assistant turn, so a user turn is put in front
        assertEquals(4, prepared.size());
        assertEquals(RequestSanitizer.CONTINUATION_PROMPT, prepared.get(0).text());
        assertEquals("a7", prepared.get(1).text());
        assertEquals("u8", prepared.get(2).text());
    }

    @Test
    void shouldStartWithUserTurnAfterSummary() {
        List<Message> prepared = sanitizer.prepare(List.of(Message.assistantText("# Conversation Summary\n...")));

        assertEquals(2, prepared.size());
        assertTrue(prepared.get(0).isUser());
        assertTrue(prepared.get(1).isAssistant());
    }

    @Test
    void shouldKeepMatchedToolPairs() {
        List<Message> prepared = sanitizer.prepare(List.of(
                Message.user("list"),
                assistantWithUse("t1", "Bash"),
                Message.toolResult(ToolResultBlock.text("t1", "a.txt", false))));

        assertEquals(1, prepared.get(1).toolUses().size());
        assertEquals(1, prepared.get(2).toolResults().size());
    }

    @Test
    void shouldFlattenUseWithoutResult() {
        List<Message> prepared = sanitizer.prepare(List.of(
                Message.user("list"),
                assistantWithUse("t1", "Bash")));

        Message assistant = prepared.get(1);
        assertFalse(assistant.hasToolUses());
        assertEquals("[Tool call Bash: {\"command\":\"ls\"}]", assistant.text());
    }

    @Test
    void shouldFlattenResultWithoutUse() {
        List<Message> prepared = sanitizer.prepare(List.of(
                Message.toolResult(ToolResultBlock.text("gone", "permission denied", true)),
                Message.assistantText("I could not read it")));

        Message first = prepared.get(0);
        assertTrue(first.toolResults().isEmpty());
        assertEquals("[Tool error gone]: permission denied", first.text());
    }

    @Test
    void shouldFlattenResultThatPrecedesItsUse() {
        List<Message> prepared = sanitizer.prepare(List.of(
                Message.user("go"),
                Message.toolResult(ToolResultBlock.text("t1", "early", false)),
                assistantWithUse("t1", "Bash")));

        assertTrue(prepared.get(1).toolResults().isEmpty());
        assertFalse(prepared.get(2).hasToolUses());
    }

    @Test
    void shouldCapToolResultText() {
        String output = "row\n".repeat(1000);

        List<Message> prepared = sanitizer.prepare(List.of(
                Message.user("dump"),
                assistantWithUse("t1", "Bash"),
                Message.toolResult(ToolResultBlock.text("t1", output, false))));

        String text = prepared.get(2).toolResults().get(0).textContent();
        assertTrue(text.length() < 1100);
        assertTrue(text.contains("[OUTPUT TRUNCATED"));
    }

    @Test
    void shouldSanitizeToolInputStrings() {
        ToolUseBlock use = new ToolUseBlock("t1", "Write", Map.of("content", "a\u0000b", "nested",
                Map.of("list", List.of("x\r\ny"))));
        List<Message> prepared = sanitizer.prepare(List.of(
                Message.user("write"),
                Message.assistant(List.of(use), ProviderUsage.EMPTY, StopReason.TOOL_USE),
                Message.toolResult(ToolResultBlock.text("t1", "ok", false))));

        ToolUseBlock cleaned = prepared.get(1).toolUses().get(0);
        assertEquals("ab", cleaned.input().get("content"));
        assertEquals(Map.of("list", List.of("x\ny")), cleaned.input().get("nested"));
    }

    @Test
    void shouldFillEmptyMessages() {
        Message empty = Message.user(List.<ContentBlock>of());

        List<Message> prepared = sanitizer.prepare(List.of(empty));

        assertEquals(RequestSanitizer.EMPTY_TURN_TEXT, prepared.get(0).text());
    }

    @Test
    void shouldNotMutateInputHistory() {
        Message user = Message.user("a\u0000b");
        List<Message> history = List.of(user);

        sanitizer.prepare(history);

        assertEquals("a\u0000b", ((TextBlock) user.getContent().get(0)).text());
    }

    private static Message assistantWithUse(String id, String name) {
        return Message.assistant(List.of(new ToolUseBlock(id, name, Map.of("command", "ls"))), ProviderUsage.EMPTY,
                StopReason.TOOL_USE);
    }
}
