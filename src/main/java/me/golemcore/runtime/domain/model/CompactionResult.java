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
 * Outcome of one compaction run.
 *
 * <p>
 * {@code messages} is the history to continue with. {@code summaryMessage} is
 * the synthetic assistant message (also present in {@code messages}) or
 * {@code null} for strategies that only drop messages.
 */
@Value
@Builder
public class CompactionResult {

    RetentionStrategy strategy;
    @Singular
    List<CompactionSection> sections;
    Message summaryMessage;
    @Singular
    List<Message> messages;
    int removedCount;
    int preservedCount;
    ProviderUsage usage;

    public boolean hasSummary() {
        return summaryMessage != null;
    }

    public long failedSectionCount() {
        return sections.stream().filter(CompactionSection::failed).count();
    }
}
