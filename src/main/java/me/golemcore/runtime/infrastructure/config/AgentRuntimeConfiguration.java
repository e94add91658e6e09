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

import me.golemcore.runtime.adapter.outbound.llm.ProviderAdapterFactory;
import me.golemcore.runtime.domain.compaction.CompactionPipeline;
import me.golemcore.runtime.domain.compaction.TranscriptRenderer;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.context.ContextWindowManager;
import me.golemcore.runtime.domain.context.TokenAccountant;
import me.golemcore.runtime.domain.loop.AgentLoop;
import me.golemcore.runtime.domain.loop.ImagePayloadCompactor;
import me.golemcore.runtime.domain.loop.SubAgentTool;
import me.golemcore.runtime.domain.model.RetentionConfig;
import me.golemcore.runtime.domain.tool.DefaultPermissionPolicy;
import me.golemcore.runtime.domain.tool.InMemoryToolRegistry;
import me.golemcore.runtime.domain.tool.MatchingToolHooks;
import me.golemcore.runtime.domain.tool.ToolExecutor;
import me.golemcore.runtime.domain.tool.ToolOutputLimiter;
import me.golemcore.runtime.infrastructure.http.FeignClientFactory;
import me.golemcore.runtime.infrastructure.http.OkHttpConfig;
import me.golemcore.runtime.port.outbound.ApprovalPort;
import me.golemcore.runtime.port.outbound.PermissionPort;
import me.golemcore.runtime.port.outbound.ProviderPort;
import me.golemcore.runtime.port.outbound.ToolHookPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring wiring of the runtime: provider adapter, tool execution, context
 * management and the agent loop.
 *
 * <p>
 * Every bean backs off when the application defines its own. Tools are all
 * {@link ToolComponent} beans of the context plus one {@link SubAgentTool} per
 * {@code runtime.agents} entry. Tool-use approval is asked through the
 * application's {@link ApprovalPort}; without one, tools that need approval
 * are denied.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(RuntimeProperties.class)
@Import(OkHttpConfig.class)
@Slf4j
public class AgentRuntimeConfiguration {

    private static final double TRANSCRIPT_CONTEXT_SHARE = 0.5;

    private static final ApprovalPort NO_APPROVER = new ApprovalPort() {
        @Override
        public CompletableFuture<Boolean> requestApproval(String toolName, Map<String, Object> input) {
            return CompletableFuture.completedFuture(false);
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    };

    @Bean
    @ConditionalOnMissingBean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "agentRuntimeExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "agentRuntimeExecutor")
    public ExecutorService agentRuntimeExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-runtime-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderPort providerPort(RuntimeProperties properties, ObjectMapper objectMapper,
            FeignClientFactory feignClientFactory, ExecutorService agentRuntimeExecutor, Clock clock) {
        return new ProviderAdapterFactory(properties, objectMapper, feignClientFactory, agentRuntimeExecutor, clock)
                .create();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenAccountant tokenAccountant(RuntimeProperties properties) {
        return new TokenAccountant(properties.getContext().getCharsPerToken());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextWindowManager contextWindowManager(RuntimeProperties properties) {
        RuntimeProperties.ContextProperties context = properties.getContext();
        return new ContextWindowManager(context.getContextLength(), context.getCompactThresholdRatio(),
                context.getMinMessagesBeforeCompact(), context.getAverageTokensPerMessage());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetentionConfig retentionConfig(RuntimeProperties properties, ContextWindowManager windowManager) {
        RuntimeProperties.ContextProperties context = properties.getContext();
        return windowManager.retentionFor(context.getStrategy(), context.getPreserveCount());
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscriptRenderer transcriptRenderer(RuntimeProperties properties, ObjectMapper objectMapper) {
        RuntimeProperties.CompactionProperties compaction = properties.getCompaction();
        int maxChars = compaction.getTranscriptMaxChars();
        if (maxChars <= 0) {
            RuntimeProperties.ContextProperties context = properties.getContext();
            maxChars = (int) Math.min(Integer.MAX_VALUE,
                    context.getContextLength() * context.getCharsPerToken() * TRANSCRIPT_CONTEXT_SHARE);
        }
        return new TranscriptRenderer(objectMapper, compaction.getTranscriptMessageChars(), maxChars);
    }

    @Bean
    @ConditionalOnMissingBean
    public CompactionPipeline compactionPipeline(ProviderPort providerPort, TokenAccountant tokenAccountant,
            ContextWindowManager windowManager, TranscriptRenderer transcriptRenderer, RuntimeProperties properties,
            Clock clock) {
        return new CompactionPipeline(providerPort, tokenAccountant, windowManager, transcriptRenderer,
                properties.getCompaction(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public InMemoryToolRegistry toolRegistry(ObjectProvider<ToolComponent> toolComponents) {
        List<ToolComponent> tools = toolComponents.orderedStream().toList();
        InMemoryToolRegistry registry = new InMemoryToolRegistry(tools);
        log.info("[Tools] Registered {} tools", tools.size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(ToolHookPort.class)
    public MatchingToolHooks toolHooks() {
        return new MatchingToolHooks();
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionPort permissionPort(InMemoryToolRegistry toolRegistry, RuntimeProperties properties) {
        RuntimeProperties.ToolsProperties tools = properties.getTools();
        return new DefaultPermissionPolicy(toolRegistry, new HashSet<>(tools.getDisabled()),
                new HashSet<>(tools.getAutoApprove()), tools.isSkipPermissions());
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolOutputLimiter toolOutputLimiter(RuntimeProperties properties) {
        RuntimeProperties.ToolsProperties tools = properties.getTools();
        return new ToolOutputLimiter(tools.getMaxOutputTokens(), tools.getPerToolMaxTokens(),
                properties.getContext().getCharsPerToken());
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolExecutor toolExecutor(InMemoryToolRegistry toolRegistry, PermissionPort permissionPort,
            ObjectProvider<ApprovalPort> approvalPort, ToolHookPort toolHooks, ToolOutputLimiter outputLimiter,
            RuntimeProperties properties) {
        return new ToolExecutor(toolRegistry, permissionPort, approvalPort.getIfAvailable(() -> NO_APPROVER),
                toolHooks, outputLimiter, Duration.ofSeconds(properties.getTools().getExecutionTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ImagePayloadCompactor imagePayloadCompactor(RuntimeProperties properties) {
        return new ImagePayloadCompactor(properties.getProvider().getImagePlaceholderThresholdBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentLoop agentLoop(ProviderPort providerPort, ToolExecutor toolExecutor,
            ContextWindowManager windowManager, CompactionPipeline compactionPipeline,
            TokenAccountant tokenAccountant, ImagePayloadCompactor imageCompactor, RetentionConfig retentionConfig,
            InMemoryToolRegistry toolRegistry, ExecutorService agentRuntimeExecutor, RuntimeProperties properties,
            Clock clock) {
        AgentLoop loop = new AgentLoop(providerPort, toolExecutor, windowManager, compactionPipeline,
                tokenAccountant, imageCompactor, retentionConfig, properties.getLoop().getMaxModelCalls(), clock);
        for (RuntimeProperties.AgentDefinition agent : properties.getAgents()) {
            SubAgentTool tool = new SubAgentTool(agent.getId(), agent.getDescription(), agent.getSystemPrompt(),
                    loop, agentRuntimeExecutor);
            toolRegistry.registerTool(tool);
            log.info("[Tools] Registered nested agent '{}' as {}", agent.getId(), tool.getToolName());
        }
        return loop;
    }
}
