package me.golemcore.runtime.domain.context;

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
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;

import java.util.List;

/**
 * Estimates token counts of conversation content.
 *
 * <p>
 * The estimate is a pure function of the data: characters divided by a
 * configured chars-per-token ratio, plus a fixed framing overhead per message
 * and per tool block, and a flat cost per image. A history's count is the sum
 * of its messages' counts, so re-counting the same history gives the same
 * number and appending a message can only increase it.
 *
 * <p>
 * Tool progress messages count as zero; they are never sent to a provider.
 */
public class TokenAccountant {

    public static final double DEFAULT_CHARS_PER_TOKEN = 4.0;

    private static final long MESSAGE_OVERHEAD_TOKENS = 4;
    private static final long TOOL_BLOCK_OVERHEAD_TOKENS = 8;
    private static final long IMAGE_TOKENS = 1600;

    private final double charsPerToken;

    public TokenAccountant() {
        this(DEFAULT_CHARS_PER_TOKEN);
    }

    public TokenAccountant(double charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    public long countText(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (long) Math.ceil(text.length() / charsPerToken);
    }

    public long countBlock(ContentBlock block) {
        return switch (block.type()) {
        case TEXT -> countText(((TextBlock) block).text());
        case TOOL_USE -> {
            ToolUseBlock use = (ToolUseBlock) block;
            yield TOOL_BLOCK_OVERHEAD_TOKENS + countText(use.name()) + countText(String.valueOf(use.input()));
        }
        case TOOL_RESULT -> {
            ToolResultBlock result = (ToolResultBlock) block;
            long total = TOOL_BLOCK_OVERHEAD_TOKENS;
            for (ContentBlock nested : result.content()) {
                total += countBlock(nested);
            }
            yield total;
        }
        case IMAGE -> IMAGE_TOKENS;
        case DOCUMENT -> countText(((DocumentBlock) block).data());
        };
    }

    public long countMessage(Message message) {
        if (message.isToolProgress()) {
            return 0;
        }
        long total = MESSAGE_OVERHEAD_TOKENS;
        for (ContentBlock block : message.getContent()) {
            total += countBlock(block);
        }
        return total;
    }

    public long count(List<Message> history) {
        long total = 0;
        for (Message message : history) {
            total += countMessage(message);
        }
        return total;
    }

    /**
     * Full request estimate: system prompt, tool declarations and history.
     */
    public long countRequest(String systemPrompt, List<Message> history, List<ToolDescriptor> tools) {
        long total = countText(systemPrompt) + count(history);
        for (ToolDescriptor tool : tools) {
            total += TOOL_BLOCK_OVERHEAD_TOKENS + countText(tool.getName()) + countText(tool.getDescription())
                    + countText(String.valueOf(tool.getInputSchema()));
        }
        return total;
    }

    /**
     * Running total that decides compaction before the next call. Provider
     * reported usage is the real prompt size of the previous call, so the most
     * recent assistant message at or after {@code reportedFrom} that carries
     * usage contributes its input, cached and output tokens plus the estimate of
     * everything appended after it. The result never drops below
     * {@link #countRequest}. Messages before {@code reportedFrom} carry usage
     * from a history that has since been compacted.
     */
    public long runningTotal(String systemPrompt, List<Message> history, List<ToolDescriptor> tools,
            int reportedFrom) {
        long estimate = countRequest(systemPrompt, history, tools);
        for (int i = history.size() - 1; i >= Math.max(0, reportedFrom); i--) {
            Message message = history.get(i);
            if (message.isAssistant() && message.getUsage() != null && message.getUsage().totalTokens() > 0) {
                long reported = message.getUsage().totalTokens() + count(history.subList(i + 1, history.size()));
                return Math.max(estimate, reported);
            }
        }
        return estimate;
    }
}
