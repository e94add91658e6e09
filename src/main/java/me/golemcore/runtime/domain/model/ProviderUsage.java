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
import lombok.Value;

/**
 * Usage metadata attached to every assistant message: token counts reported
 * by the backend, wall-clock duration of the call and its computed cost.
 */
@Value
@Builder(toBuilder = true)
public class ProviderUsage {

    public static final ProviderUsage EMPTY = ProviderUsage.builder().build();

    long inputTokens;
    long outputTokens;
    long cachedTokens;
    long durationMs;
    double costUsd;
    String model;

    public long totalTokens() {
        return inputTokens + outputTokens + cachedTokens;
    }

    /**
     * Field-wise sum. The model of {@code this} wins unless it is missing.
     */
    public ProviderUsage plus(ProviderUsage other) {
        if (other == null) {
            return this;
        }
        return ProviderUsage.builder()
                .inputTokens(inputTokens + other.inputTokens)
                .outputTokens(outputTokens + other.outputTokens)
                .cachedTokens(cachedTokens + other.cachedTokens)
                .durationMs(durationMs + other.durationMs)
                .costUsd(costUsd + other.costUsd)
                .model(model != null ? model : other.model)
                .build();
    }
}
