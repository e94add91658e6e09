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

import me.golemcore.runtime.domain.model.CancellationToken;
import me.golemcore.runtime.domain.model.Message;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input of one agent loop invocation.
 *
 * <p>
 * {@code history} is the prior conversation as stored by the caller, possibly
 * empty. {@code userMessage} is the new turn; when it is {@code null} the loop
 * continues from the history as is. {@code systemPrompt} may contain
 * {@code {{key}}} placeholders filled from {@code promptContext}.
 */
@Value
@Builder(toBuilder = true)
public class AgentRunRequest {

    @Singular("historyMessage")
    List<Message> history;
    Message userMessage;
    String systemPrompt;
    @Singular("promptVariable")
    Map<String, String> promptContext;
    Integer maxTokens;
    Double temperature;
    @Builder.Default
    CancellationToken cancellation = CancellationToken.create();
}
