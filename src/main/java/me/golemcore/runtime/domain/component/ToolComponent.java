package me.golemcore.runtime.domain.component;

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

import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.tool.ToolExecutionContext;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An executable tool the model can invoke.
 *
 * <p>
 * Simple tools complete the returned future with their result. Long-running
 * tools may call {@link ToolExecutionContext#reportProgress(String)} any number
 * of times before completing; each call is streamed to the consumer as a
 * progress message. Tools should check
 * {@link ToolExecutionContext#getCancellation()} and stop early once it fires.
 */
public interface ToolComponent {

    ToolDescriptor getDescriptor();

    /**
     * Executes the tool.
     *
     * @param input
     *            arguments as produced by the model (after hook rewrites)
     * @param context
     *            cancellation signal and progress sink for this call
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> input, ToolExecutionContext context);

    default String getToolName() {
        return getDescriptor().getName();
    }
}
