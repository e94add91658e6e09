package me.golemcore.runtime.domain.context;

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
import me.golemcore.runtime.domain.model.RetentionConfig;
import me.golemcore.runtime.domain.model.RetentionPreference;
import me.golemcore.runtime.domain.model.RetentionStrategy;

import java.util.List;

/**
 * Decides when history must be compacted and sizes retention budgets.
 *
 * <p>
 * Compaction is required once the running token total reaches
 * {@code contextLength * thresholdRatio}. With the defaults (200,000 tokens,
 * 0.85) that is 170,000 tokens.
 */
public class ContextWindowManager {

    public static final int MIN_PRESERVED_MESSAGES = 3;

    private static final double RETENTION_BUDGET_RATIO = 0.7;
    private static final int AGGRESSIVE_TOKENS_PER_MESSAGE = 200;
    private static final int IMPORTANT_RECENT_COUNT = 5;

    private final long contextLength;
    private final double thresholdRatio;
    private final int minMessagesBeforeCompact;
    private final int averageTokensPerMessage;

    public ContextWindowManager(long contextLength, double thresholdRatio, int minMessagesBeforeCompact,
            int averageTokensPerMessage) {
        if (contextLength <= 0) {
            throw new IllegalArgumentException("contextLength must be positive: " + contextLength);
        }
        if (thresholdRatio <= 0 || thresholdRatio > 1) {
            throw new IllegalArgumentException("thresholdRatio must be in (0, 1]: " + thresholdRatio);
        }
        if (averageTokensPerMessage <= 0) {
            throw new IllegalArgumentException("averageTokensPerMessage must be positive");
        }
        this.contextLength = contextLength;
        this.thresholdRatio = thresholdRatio;
        this.minMessagesBeforeCompact = minMessagesBeforeCompact;
        this.averageTokensPerMessage = averageTokensPerMessage;
    }

    public long getContextLength() {
        return contextLength;
    }

    public long thresholdTokens() {
        return Math.round(contextLength * thresholdRatio);
    }

    public boolean shouldCompact(long runningTotal) {
        return runningTotal >= thresholdTokens();
    }

    /**
     * Same as {@link #shouldCompact(long)}, but never compacts histories too
     * short to shrink.
     */
    public boolean shouldCompact(List<Message> history, long runningTotal) {
        return history.size() >= minMessagesBeforeCompact && shouldCompact(runningTotal);
    }

    /**
     * How many recent messages fit in {@code maxTokens}, never fewer than
     * {@value #MIN_PRESERVED_MESSAGES}.
     */
    public int estimatePreservableCount(long maxTokens) {
        return estimatePreservableCount(maxTokens, averageTokensPerMessage);
    }

    public int estimatePreservableCount(long maxTokens, int tokensPerMessage) {
        long count = maxTokens / tokensPerMessage;
        return (int) Math.max(MIN_PRESERVED_MESSAGES, Math.min(Integer.MAX_VALUE, count));
    }

    /**
     * Retention preset for a coarse preference. The token budget is 70% of the
     * context length.
     */
    public RetentionConfig retentionFor(RetentionPreference preference) {
        long maxTokens = Math.round(contextLength * RETENTION_BUDGET_RATIO);
        return switch (preference) {
        case AGGRESSIVE -> RetentionConfig.builder()
                .maxTokens(maxTokens)
                .preserveCount(estimatePreservableCount(maxTokens, AGGRESSIVE_TOKENS_PER_MESSAGE))
                .strategy(RetentionStrategy.PRESERVE_RECENT)
                .build();
        case BALANCED -> RetentionConfig.builder()
                .maxTokens(maxTokens)
                .preserveCount(IMPORTANT_RECENT_COUNT)
                .strategy(RetentionStrategy.PRESERVE_IMPORTANT)
                .build();
        case CONSERVATIVE -> RetentionConfig.builder()
                .maxTokens(maxTokens)
                .preserveCount(estimatePreservableCount(maxTokens))
                .strategy(RetentionStrategy.SMART_COMPRESSION)
                .build();
        };
    }

    /**
     * Retention for an explicitly configured strategy. A non-positive
     * {@code preserveCount} means "derive from the budget".
     */
    public RetentionConfig retentionFor(RetentionStrategy strategy, int preserveCount) {
        long maxTokens = Math.round(contextLength * RETENTION_BUDGET_RATIO);
        int count = preserveCount > 0 ? preserveCount : estimatePreservableCount(maxTokens);
        return RetentionConfig.builder()
                .maxTokens(maxTokens)
                .preserveCount(count)
                .strategy(strategy)
                .build();
    }
}
