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

import me.golemcore.runtime.domain.model.ProviderError;
import me.golemcore.runtime.domain.model.ProviderRequest;

import java.time.Duration;
import java.util.List;

/**
 * One wire protocol. Implementations translate an already sanitized request
 * into their backend's envelope, send it once and translate the reply back.
 * Retries, pacing, pricing and argument repair live in
 * {@link ProviderAdapter}.
 */
public interface ProviderBackend {

    String getBackendId();

    String getModel();

    /**
     * Sends a single attempt. Never throws for backend failures; they come back
     * as a classified {@link ProviderError}.
     */
    ProviderResult<Reply> send(ProviderRequest request, Duration timeout);

    /**
     * Backend reply before tool arguments are parsed.
     */
    record Reply(String text, List<RawToolCall> toolCalls, String finishReason,
            long inputTokens, long outputTokens, long cachedTokens, String model) {

        public Reply {
            toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        }
    }

    /**
     * Tool call with its arguments exactly as the backend returned them.
     */
    record RawToolCall(String id, String name, String arguments) {
    }
}
