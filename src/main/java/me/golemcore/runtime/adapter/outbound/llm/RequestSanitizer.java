package me.golemcore.runtime.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.runtime.domain.model.BlockType;
import me.golemcore.runtime.domain.model.ContentBlock;
import me.golemcore.runtime.domain.model.DocumentBlock;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import me.golemcore.runtime.domain.tool.ToolOutputLimiter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reshapes a request's history into something every backend accepts.
 *
 * <p>
 * Pipeline, in order:
 * <ol>
 * <li>tool progress messages are dropped (they are never sent)</li>
 * <li>history is cut to the newest {@code maxHistoryMessages}; the system
 * prompt travels separately and is always kept</li>
 * <li>tool uses without a matching result, and results without a matching
 * use, are flattened to plain text</li>
 * <li>a conversation that starts with an assistant turn gets a short user
 * message in front</li>
 * <li>all strings are cleaned: control characters other than newline and tab
 * are removed, lone surrogates become U+FFFD and unclosed code fences are
 * closed</li>
 * <li>tool results are capped at {@code maxToolResultChars}</li>
 * </ol>
 * The output serializes to valid JSON for any input.
 */
@Slf4j
public class RequestSanitizer {

    static final String CONTINUATION_PROMPT = "(conversation continues from an earlier summary)";
    static final String EMPTY_TURN_TEXT = "(no content)";

    private static final char REPLACEMENT_CHAR = '\uFFFD';
    private static final String CODE_FENCE = "```";

    private final ObjectMapper objectMapper;
    private final int maxHistoryMessages;
    private final int maxToolResultChars;

    public RequestSanitizer(ObjectMapper objectMapper, int maxHistoryMessages, int maxToolResultChars) {
        this.objectMapper = objectMapper;
        this.maxHistoryMessages = maxHistoryMessages;
        this.maxToolResultChars = maxToolResultChars;
    }

    public List<Message> prepare(List<Message> history) {
        List<Message> sendable = new ArrayList<>();
        for (Message message : history) {
            if (!message.isToolProgress()) {
                sendable.add(message);
            }
        }

        if (maxHistoryMessages > 0 && sendable.size() > maxHistoryMessages) {
            log.debug("[Sanitizer] Truncating history: {} -> {} messages", sendable.size(), maxHistoryMessages);
            sendable = new ArrayList<>(sendable.subList(sendable.size() - maxHistoryMessages, sendable.size()));
        }

        List<Message> flattened = flattenOrphans(sendable);

        if (!flattened.isEmpty() && flattened.get(0).isAssistant()) {
            flattened.add(0, Message.user(CONTINUATION_PROMPT));
        }

        List<Message> prepared = new ArrayList<>(flattened.size());
        for (Message message : flattened) {
            prepared.add(cleanMessage(message));
        }
        return prepared;
    }

    /**
     * Cleans one string so any JSON encoder produces valid output for it.
     */
    public String sanitizeText(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.indexOf('\r') >= 0 ? text.replace("\r\n", "\n").replace('\r', '\n') : text;
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < normalized.length() && Character.isLowSurrogate(normalized.charAt(i + 1))) {
                    sb.append(c).append(normalized.charAt(i + 1));
                    i++;
                } else {
                    sb.append(REPLACEMENT_CHAR);
                }
            } else if (Character.isLowSurrogate(c)) {
                sb.append(REPLACEMENT_CHAR);
            } else if (isDroppedControl(c)) {
                continue;
            } else {
                sb.append(c);
            }
        }
        return closeCodeFences(sb.toString());
    }

    String serializeInput(Map<String, Object> input) {
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            return String.valueOf(input);
        }
    }

    private List<Message> flattenOrphans(List<Message> messages) {
        Set<String> answeredIds = new HashSet<>();
        Set<String> seenUses = new HashSet<>();
        for (Message message : messages) {
            for (ToolUseBlock use : message.toolUses()) {
                seenUses.add(use.id());
            }
            for (ToolResultBlock result : message.toolResults()) {
                if (seenUses.contains(result.toolUseId())) {
                    answeredIds.add(result.toolUseId());
                }
            }
        }

        List<Message> result = new ArrayList<>(messages.size());
        int flattenedCount = 0;
        for (Message message : messages) {
            boolean changed = false;
            List<ContentBlock> blocks = new ArrayList<>(message.getContent().size());
            for (ContentBlock block : message.getContent()) {
                if (block instanceof ToolUseBlock use && (!message.isAssistant() || !answeredIds.contains(use.id()))) {
                    blocks.add(new TextBlock("[Tool call " + use.name() + ": " + serializeInput(use.input()) + "]"));
                    changed = true;
                } else if (block instanceof ToolResultBlock toolResult
                        && (!message.isUser() || !answeredIds.contains(toolResult.toolUseId()))) {
                    String label = toolResult.isError() ? "Tool error" : "Tool result";
                    blocks.add(new TextBlock("[" + label + " " + toolResult.toolUseId() + "]: "
                            + toolResult.textContent()));
                    changed = true;
                } else {
                    blocks.add(block);
                }
            }
            if (changed) {
                flattenedCount++;
                result.add(message.toBuilder().clearContent().content(blocks).build());
            } else {
                result.add(message);
            }
        }
        if (flattenedCount > 0) {
            log.debug("[Sanitizer] Flattened orphan tool blocks in {} messages", flattenedCount);
        }
        return result;
    }

    private Message cleanMessage(Message message) {
        List<ContentBlock> blocks = new ArrayList<>(message.getContent().size());
        for (ContentBlock block : message.getContent()) {
            blocks.add(cleanBlock(block));
        }
        if (blocks.isEmpty()) {
            blocks.add(new TextBlock(EMPTY_TURN_TEXT));
        }
        return message.toBuilder().clearContent().content(blocks).build();
    }

    private ContentBlock cleanBlock(ContentBlock block) {
        if (block.type() == BlockType.TEXT) {
            return new TextBlock(sanitizeText(((TextBlock) block).text()));
        }
        if (block.type() == BlockType.TOOL_USE) {
            ToolUseBlock use = (ToolUseBlock) block;
            return new ToolUseBlock(use.id(), sanitizeText(use.name()), cleanMap(use.input()), use.inputError());
        }
        if (block.type() == BlockType.TOOL_RESULT) {
            ToolResultBlock result = (ToolResultBlock) block;
            String text = ToolOutputLimiter.truncateLines(sanitizeText(result.textContent()), maxToolResultChars);
            return ToolResultBlock.text(result.toolUseId(), text, result.isError());
        }
        if (block.type() == BlockType.DOCUMENT) {
            DocumentBlock document = (DocumentBlock) block;
            String data = document.isText() ? sanitizeText(document.data()) : document.data();
            String title = document.title() != null ? sanitizeText(document.title()) : null;
            return new DocumentBlock(document.mediaType(), title, data);
        }
        return block;
    }

    private Map<String, Object> cleanMap(Map<String, Object> input) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            cleaned.put(sanitizeText(entry.getKey()), cleanValue(entry.getValue()));
        }
        return cleaned;
    }

    @SuppressWarnings("unchecked")
    private Object cleanValue(Object value) {
        if (value instanceof String text) {
            return sanitizeText(text);
        }
        if (value instanceof Map<?, ?> map) {
            return cleanMap((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> cleaned = new ArrayList<>(list.size());
            for (Object item : list) {
                cleaned.add(cleanValue(item));
            }
            return cleaned;
        }
        return value;
    }

    private static boolean isDroppedControl(char c) {
        if (c == '\n' || c == '\t') {
            return false;
        }
        return c < 0x20 || c == 0x7F || (c >= 0x80 && c <= 0x9F);
    }

    private static String closeCodeFences(String text) {
        int count = 0;
        int index = text.indexOf(CODE_FENCE);
        while (index >= 0) {
            count++;
            index = text.indexOf(CODE_FENCE, index + CODE_FENCE.length());
        }
        if (count % 2 == 0) {
            return text;
        }
        return text.endsWith("\n") ? text + CODE_FENCE : text + "\n" + CODE_FENCE;
    }
}
