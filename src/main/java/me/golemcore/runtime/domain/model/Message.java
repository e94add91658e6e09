package me.golemcore.runtime.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable conversation message.
 *
 * <p>
 * A message is a tagged variant over {@link MessageType}: user turns (which
 * also carry tool results back to the model), assistant turns produced by a
 * provider, and tool progress updates streamed while a tool runs. Content is
 * an ordered list of {@link ContentBlock}s.
 *
 * <p>
 * Assistant messages carry {@link ProviderUsage} and a {@link StopReason};
 * both are {@code null} on other variants.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    String id;
    MessageType type;
    @Singular("block")
    List<ContentBlock> content;
    ProviderUsage usage;
    StopReason stopReason;
    Instant timestamp;
    /** Tool use this progress update belongs to; only set on TOOL_PROGRESS. */
    String toolUseId;

    public static Message user(String text) {
        return user(List.of(new TextBlock(text)));
    }

    public static Message user(List<ContentBlock> blocks) {
        return Message.builder()
                .id(newId())
                .type(MessageType.USER)
                .content(blocks)
                .timestamp(Instant.now())
                .build();
    }

    public static Message toolResult(ToolResultBlock block) {
        return user(List.of(block));
    }

    public static Message assistant(List<ContentBlock> blocks, ProviderUsage usage, StopReason stopReason) {
        return Message.builder()
                .id(newId())
                .type(MessageType.ASSISTANT)
                .content(blocks)
                .usage(usage != null ? usage : ProviderUsage.EMPTY)
                .stopReason(stopReason != null ? stopReason : StopReason.UNKNOWN)
                .timestamp(Instant.now())
                .build();
    }

    public static Message assistantText(String text) {
        return assistant(List.of(new TextBlock(text)), ProviderUsage.EMPTY, StopReason.END_TURN);
    }

    public static Message toolProgress(String toolUseId, String text) {
        return Message.builder()
                .id(newId())
                .type(MessageType.TOOL_PROGRESS)
                .block(new TextBlock(text))
                .toolUseId(toolUseId)
                .timestamp(Instant.now())
                .build();
    }

    public boolean isUser() {
        return type == MessageType.USER;
    }

    public boolean isAssistant() {
        return type == MessageType.ASSISTANT;
    }

    public boolean isToolProgress() {
        return type == MessageType.TOOL_PROGRESS;
    }

    public List<ToolUseBlock> toolUses() {
        List<ToolUseBlock> uses = new ArrayList<>();
        for (ContentBlock block : content) {
            if (block.type() == BlockType.TOOL_USE) {
                uses.add((ToolUseBlock) block);
            }
        }
        return uses;
    }

    public boolean hasToolUses() {
        return content.stream().anyMatch(block -> block.type() == BlockType.TOOL_USE);
    }

    public List<ToolResultBlock> toolResults() {
        List<ToolResultBlock> results = new ArrayList<>();
        for (ContentBlock block : content) {
            if (block.type() == BlockType.TOOL_RESULT) {
                results.add((ToolResultBlock) block);
            }
        }
        return results;
    }

    /**
     * True for user messages that only carry tool results, as opposed to turns
     * typed by a human.
     */
    public boolean isToolResultMessage() {
        return isUser() && !content.isEmpty()
                && content.stream().allMatch(block -> block.type() == BlockType.TOOL_RESULT);
    }

    /**
     * Concatenation of the text blocks, newline separated.
     */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : content) {
            if (block.type() == BlockType.TEXT) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(((TextBlock) block).text());
            }
        }
        return sb.toString();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
