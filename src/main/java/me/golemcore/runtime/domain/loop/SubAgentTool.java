package me.golemcore.runtime.domain.loop;

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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ToolCapability;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import me.golemcore.runtime.domain.tool.ToolExecutionContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Exposes a nested agent as a tool named {@code agent__<id>}.
 *
 * <p>
 * Each call starts a fresh conversation containing only the prompt. The
 * nested loop sees every tool of the parent except other agent tools, shares
 * the parent's provider and is cancelled together with the calling turn. Its
 * final answer becomes the tool output; tool calls it makes are reported as
 * progress.
 */
@Slf4j
public class SubAgentTool implements ToolComponent {

    public static final String NAME_PREFIX = "agent__";
    public static final String PROMPT_PARAM = "prompt";

    private final String agentId;
    private final ToolDescriptor descriptor;
    private final String systemPrompt;
    private final AgentLoop nestedLoop;
    private final Executor executor;

    public SubAgentTool(String agentId, String description, String systemPrompt, AgentLoop parentLoop,
            Executor executor) {
        if (agentId == null || !agentId.matches("[a-zA-Z0-9_-]+")) {
            throw new IllegalArgumentException("Agent id must match [a-zA-Z0-9_-]+: " + agentId);
        }
        this.agentId = agentId;
        this.systemPrompt = systemPrompt;
        this.nestedLoop = parentLoop.forSubAgent();
        this.executor = executor;
        this.descriptor = ToolDescriptor.builder()
                .name(NAME_PREFIX + agentId)
                .description(description)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PROMPT_PARAM, Map.of(
                                        "type", "string",
                                        "description", "Task for the agent, with all context it needs")),
                        "required", List.of(PROMPT_PARAM)))
                .capability(ToolCapability.AGENT)
                .capability(ToolCapability.STREAMING)
                .build();
    }

    public String getAgentId() {
        return agentId;
    }

    @Override
    public ToolDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> input, ToolExecutionContext context) {
        Object prompt = input.get(PROMPT_PARAM);
        if (!(prompt instanceof String text) || text.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_INPUT,
                    "Missing required parameter: " + PROMPT_PARAM));
        }
        AgentRunRequest request = AgentRunRequest.builder()
                .systemPrompt(systemPrompt)
                .userMessage(Message.user(text))
                .cancellation(context.getCancellation())
                .build();
        return CompletableFuture.supplyAsync(() -> toToolResult(nestedLoop.run(request,
                message -> reportToolCalls(message, context))), executor);
    }

    private void reportToolCalls(Message message, ToolExecutionContext context) {
        if (!message.isAssistant()) {
            return;
        }
        for (ToolUseBlock toolUse : message.toolUses()) {
            context.reportProgress("[" + agentId + "] " + toolUse.name());
        }
    }

    private ToolResult toToolResult(AgentRunResult result) {
        log.info("[SubAgent] '{}' finished: {} after {} model calls", agentId, result.getOutcome(),
                result.getModelCalls());
        return switch (result.getOutcome()) {
        case DONE -> ToolResult.success(result.finalText());
        case FAILED -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                "Agent " + agentId + " failed: " + result.getErrorMessage());
        case CANCELLED -> throw new CancellationException("Agent " + agentId + " was cancelled");
        };
    }
}
