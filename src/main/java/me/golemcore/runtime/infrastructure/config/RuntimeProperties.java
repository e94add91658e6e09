package me.golemcore.runtime.infrastructure.config;

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

import me.golemcore.runtime.domain.model.RetentionStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration bound from {@code runtime.*} properties.
 *
 * <p>
 * Nested groups:
 * <ul>
 * <li>{@link ProviderProperties} - backend selection, credentials, request
 * shaping and pacing</li>
 * <li>{@link RetryProperties} - attempts, backoff and per-attempt timeouts</li>
 * <li>{@link ContextProperties} - context length and compaction trigger</li>
 * <li>{@link CompactionProperties} - extraction and summary limits</li>
 * <li>{@link ToolsProperties} - output ceilings, timeouts and permissions</li>
 * <li>{@link LoopProperties} - per-invocation budgets</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link AgentDefinition} - nested agents exposed as tools</li>
 * </ul>
 *
 * <p>
 * {@code pricing} maps a model name (or a backend id used as fallback) to its
 * per-million-token rates and is merged over the built-in table.
 */
@ConfigurationProperties(prefix = "runtime")
@Data
public class RuntimeProperties {

    private ProviderProperties provider = new ProviderProperties();
    private RetryProperties retry = new RetryProperties();
    private Map<String, ModelPricing> pricing = new LinkedHashMap<>();
    private ContextProperties context = new ContextProperties();
    private CompactionProperties compaction = new CompactionProperties();
    private ToolsProperties tools = new ToolsProperties();
    private LoopProperties loop = new LoopProperties();
    private HttpProperties http = new HttpProperties();
    private List<AgentDefinition> agents = new ArrayList<>();

    // ==================== PROVIDER ====================

    @Data
    public static class ProviderProperties {
        /** {@code anthropic} or {@code openai-compatible}. */
        private String type = "anthropic";
        private String model = "claude-sonnet-4-20250514";
        private String apiKey;
        private String baseUrl;
        private int maxTokens = 8192;
        private Double temperature;
        /**
         * Minimum delay between two requests to the backend. 0 disables pacing;
         * unset means 0 for anthropic and 1000 for openai-compatible.
         */
        private Long minRequestIntervalMs;
        /** Hard ceiling on messages per request; older ones are dropped. */
        private int maxHistoryMessages = 100;
        /** Max characters of a single tool result sent to the backend. */
        private int maxToolResultChars = 40000;
        /** Images above this size are replaced by a placeholder once sent. */
        private long imagePlaceholderThresholdBytes = 64 * 1024;
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private int maxAttempts = 4;
        private long initialBackoffMs = 1000;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 30000;
        /** Random extra delay as a fraction of the computed backoff. */
        private double jitterRatio = 0.25;
        private long initialAttemptTimeoutMs = 30000;
        private double attemptTimeoutMultiplier = 1.5;
        private long maxAttemptTimeoutMs = 180000;
    }

    @Data
    public static class ModelPricing {
        /** USD per million input tokens. */
        private double input;
        /** USD per million output tokens. */
        private double output;
        /** USD per million cached input tokens. */
        private double cached;
    }

    // ==================== CONTEXT ====================

    @Data
    public static class ContextProperties {
        private long contextLength = 200000;
        private double compactThresholdRatio = 0.85;
        private int minMessagesBeforeCompact = 3;
        private RetentionStrategy strategy = RetentionStrategy.AUTO_COMPACT;
        /** Recent messages kept by non-summary strategies; 0 derives it from the budget. */
        private int preserveCount = 0;
        private int averageTokensPerMessage = 150;
        private double charsPerToken = 4.0;
    }

    // ==================== COMPACTION ====================

    @Data
    public static class CompactionProperties {
        /** Output ceiling of each extraction section and of single-pass summaries. */
        private int sectionMaxTokens = 2000;
        private long extractionTimeoutSeconds = 120;
        private int transcriptMessageChars = 2000;
        /** Transcript ceiling; 0 derives it from the context length. */
        private int transcriptMaxChars = 0;
        private int smartRecentCap = 10;
        private double smartRecentRatio = 0.3;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private int maxOutputTokens = 10000;
        private Map<String, Integer> perToolMaxTokens = new HashMap<>(Map.of(
                "Read", 15000,
                "Grep", 8000,
                "Bash", 10000));
        private long executionTimeoutSeconds = 600;
        private List<String> disabled = new ArrayList<>();
        private List<String> autoApprove = new ArrayList<>();
        private boolean skipPermissions = false;
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        /** Max provider calls within one invocation. */
        private int maxModelCalls = 200;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 180000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== AGENTS ====================

    @Data
    public static class AgentDefinition {
        /** Tool name becomes {@code agent__<id>}. */
        private String id;
        private String description;
        private String systemPrompt;
    }
}
