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


import java.util.ArrayList;
import java.util.List;

/**
 * Shape of a failed request, attached to {@link ProviderException} so the
 * failure can be investigated without logging the whole conversation.
 */
public record RequestDiagnostics(int messageCount, int toolCount, long approximateChars,
        List<String> recentMessages) {

    static final int PREVIEW_MESSAGES = 3;
    static final int PREVIEW_CHARS = 200;

    public static RequestDiagnostics of(ProviderRequest request) {
        List<Message> messages = request.getMessages();
        long chars = request.getSystemPrompt() != null ? request.getSystemPrompt().length() : 0;
        for (Message message : messages) {
            for (ContentBlock block : message.getContent()) {
                chars += blockChars(block);
            }
        }
        List<String> previews = new ArrayList<>();
        for (int i = Math.max(0, messages.size() - PREVIEW_MESSAGES); i < messages.size(); i++) {
            Message message = messages.get(i);
            previews.add(message.getType() + ": " + preview(message));
        }
        return new RequestDiagnostics(messages.size(), request.getTools().size(), chars, List.copyOf(previews));
    }

    public String summary() {
        return messageCount + " messages, " + toolCount + " tools, ~" + approximateChars + " chars";
    }

    private static long blockChars(ContentBlock block) {
        if (block instanceof TextBlock text) {
            return text.text().length();
        }
        if (block instanceof ToolUseBlock use) {
            return use.name().length() + String.valueOf(use.input()).length();
        }
        if (block instanceof ToolResultBlock result) {
            return result.textContent().length();
        }
        if (block instanceof ImageBlock image) {
            return image.base64Data().length();
        }
        return 0;
    }

    private static String preview(Message message) {
        String text = message.text();
        if (text.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (ToolUseBlock use : message.toolUses()) {
                sb.append("[tool_use ").append(use.name()).append("] ");
            }
            for (ToolResultBlock result : message.toolResults()) {
                sb.append("[tool_result] ").append(result.textContent());
            }
            text = sb.toString().trim();
        }
        text = text.replace('\n', ' ');
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS) + "...";
    }
}
