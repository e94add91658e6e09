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

import me.golemcore.runtime.domain.model.Message;

import java.util.List;

/**
 * Tool-result messages for one assistant turn, in the order the tool uses
 * were requested.
 *
 * <p>
 * {@code CANCELLED} batches hold the results completed before the signal;
 * {@code HALTED} batches hold a result for every tool use, the ones after the
 * halt being error results.
 */
public record ToolBatchResult(List<Message> results, Status status, String haltReason) {

    public enum Status {
        COMPLETED,
        CANCELLED,
        HALTED
    }

    public ToolBatchResult {
        results = List.copyOf(results);
    }

    public static ToolBatchResult completed(List<Message> results) {
        return new ToolBatchResult(results, Status.COMPLETED, null);
    }

    public static ToolBatchResult cancelled(List<Message> results) {
        return new ToolBatchResult(results, Status.CANCELLED, null);
    }

    public static ToolBatchResult halted(List<Message> results, String reason) {
        return new ToolBatchResult(results, Status.HALTED, reason);
    }
}
