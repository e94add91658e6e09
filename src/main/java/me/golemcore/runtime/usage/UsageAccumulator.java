package me.golemcore.runtime.usage;

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

import me.golemcore.runtime.domain.model.ProviderUsage;

/**
 * Running usage totals for one agent loop invocation. Only the loop writes
 * to it, after each provider response or compaction run.
 */
public class UsageAccumulator {

    private long inputTokens;
    private long outputTokens;
    private long cachedTokens;
    private long durationMs;
    private double costUsd;
    private int calls;

    public synchronized void record(ProviderUsage usage) {
        if (usage == null) {
            return;
        }
        inputTokens += usage.getInputTokens();
        outputTokens += usage.getOutputTokens();
        cachedTokens += usage.getCachedTokens();
        durationMs += usage.getDurationMs();
        costUsd += usage.getCostUsd();
        calls++;
    }

    public synchronized ProviderUsage snapshot() {
        return ProviderUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cachedTokens(cachedTokens)
                .durationMs(durationMs)
                .costUsd(costUsd)
                .build();
    }

    public synchronized int getCalls() {
        return calls;
    }

    public synchronized long totalTokens() {
        return inputTokens + outputTokens + cachedTokens;
    }
}
