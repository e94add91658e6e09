package me.golemcore.runtime.domain.loop;

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

import me.golemcore.runtime.domain.model.CompactionResult;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderUsage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one agent loop invocation.
 *
 * <p>
 * {@code messages} is the updated conversation to hand back to persistence:
 * the prior history (or its compacted replacement) followed by everything
 * appended during the run. Tool progress messages are not part of it.
 */
@Value
@Builder
public class AgentRunResult {

    public static final String MAX_MODEL_CALLS = "loop.max_model_calls";
    public static final String HOOK_HALTED = "loop.hook_halted";
    public static final String INTERNAL_ERROR = "loop.internal_error";

    AgentOutcome outcome;
    @Singular
    List<Message> messages;
    ProviderUsage usage;
    int modelCalls;
    @Singular
    List<CompactionResult> compactions;
    String errorCode;
    String errorMessage;
    Throwable error;

    public boolean isDone() {
        return outcome == AgentOutcome.DONE;
    }

    public boolean isCancelled() {
        return outcome == AgentOutcome.CANCELLED;
    }

    public boolean isFailed() {
        return outcome == AgentOutcome.FAILED;
    }

    /**
     * Last assistant message of the conversation, the final answer when the run
     * is {@link AgentOutcome#DONE}.
     */
    public Optional<Message> lastAssistantMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isAssistant()) {
                return Optional.of(messages.get(i));
            }
        }
        return Optional.empty();
    }

    public String finalText() {
        return lastAssistantMessage().map(Message::text).orElse("");
    }
}
