package me.golemcore.runtime.domain.compaction;

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

import me.golemcore.runtime.domain.model.ContentBlock;
import me.golemcore.runtime.domain.model.DocumentBlock;
import me.golemcore.runtime.domain.model.ImageBlock;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders history as a plain-text transcript for summarization prompts.
 *
 * <p>
 * Each message is capped at {@code maxMessageChars}. When the whole transcript
 * exceeds {@code maxTotalChars}, the oldest messages are left out and a line
 * says how many.
 */
public class TranscriptRenderer {

    private final ObjectMapper objectMapper;
    private final int maxMessageChars;
    private final int maxTotalChars;

    public TranscriptRenderer(ObjectMapper objectMapper, int maxMessageChars, int maxTotalChars) {
        this.objectMapper = objectMapper;
        this.maxMessageChars = maxMessageChars;
        this.maxTotalChars = maxTotalChars;
    }

    public String render(List<Message> messages) {
        Deque<String> entries = new ArrayDeque<>();
        int total = 0;
        int omitted = 0;
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isToolProgress()) {
                continue;
            }
            String entry = renderMessage(message);
            if (total + entry.length() + 2 > maxTotalChars && !entries.isEmpty()) {
                omitted = countSendable(messages, i);
                break;
            }
            entries.addFirst(entry);
            total += entry.length() + 2;
        }
        StringBuilder sb = new StringBuilder();
        if (omitted > 0) {
            sb.append("[").append(omitted).append(" earlier messages omitted]\n\n");
        }
        sb.append(String.join("\n\n", entries));
        return sb.toString();
    }

    String renderMessage(Message message) {
        StringBuilder sb = new StringBuilder();
        sb.append(message.isAssistant() ? "ASSISTANT:" : "USER:");
        for (ContentBlock block : message.getContent()) {
            sb.append('\n').append(renderBlock(block));
        }
        return cap(sb.toString());
    }

    private String renderBlock(ContentBlock block) {
        return switch (block.type()) {
        case TEXT -> ((TextBlock) block).text();
        case TOOL_USE -> {
            ToolUseBlock use = (ToolUseBlock) block;
            yield "[Tool call: " + use.name() + " " + toJson(use) + "]";
        }
        case TOOL_RESULT -> {
            ToolResultBlock result = (ToolResultBlock) block;
            yield "[Tool result" + (result.isError() ? " (error)" : "") + ": " + result.textContent() + "]";
        }
        case IMAGE -> ((ImageBlock) block).placeholderText();
        case DOCUMENT -> {
            DocumentBlock document = (DocumentBlock) block;
            yield document.isText() ? document.data() : document.placeholderText();
        }
        };
    }

    private String toJson(ToolUseBlock use) {
        try {
            return objectMapper.writeValueAsString(use.input());
        } catch (JsonProcessingException e) {
            return String.valueOf(use.input());
        }
    }

    private String cap(String text) {
        if (text.length() <= maxMessageChars) {
            return text;
        }
        int omitted = text.length() - maxMessageChars;
        return text.substring(0, maxMessageChars) + "... [" + omitted + " chars omitted]";
    }

    private static int countSendable(List<Message> messages, int lastIndex) {
        int count = 0;
        for (int i = 0; i <= lastIndex; i++) {
            if (!messages.get(i).isToolProgress()) {
                count++;
            }
        }
        return count;
    }
}
