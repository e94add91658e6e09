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

import java.util.List;

/**
 * Backend-neutral model request. Adapters rebuild the wire envelope from
 * these fields; nothing here is sent as-is.
 */
@Value
@Builder(toBuilder = true)
public class ProviderRequest {

    String systemPrompt;
    @Singular
    List<Message> messages;
    @Singular
    List<ToolDescriptor> tools;
    Integer maxTokens;
    Double temperature;
    /** Short label for logs, e.g. {@code turn} or {@code compaction}. */
    @Builder.Default
    String purpose = "turn";
    @Builder.Default
    CancellationToken cancellation = CancellationToken.create();
}
