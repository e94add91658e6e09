package me.golemcore.runtime.domain.tool;

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
import lombok.Getter;

import java.util.function.Consumer;

/**
 * Per-call context handed to a tool: identity of the call, an abort signal
 * derived from the turn's cancellation token and a progress sink.
 */
@Getter
public class ToolExecutionContext {

    private final String toolUseId;
    private final String toolName;
    private final CancellationToken cancellation;
    private final Consumer<String> progressSink;

    public ToolExecutionContext(String toolUseId, String toolName, CancellationToken cancellation,
            Consumer<String> progressSink) {
        this.toolUseId = toolUseId;
        this.toolName = toolName;
        this.cancellation = cancellation;
        this.progressSink = progressSink;
    }

    public void reportProgress(String text) {
        if (progressSink != null && text != null && !cancellation.isCancelled()) {
            progressSink.accept(text);
        }
    }
}
