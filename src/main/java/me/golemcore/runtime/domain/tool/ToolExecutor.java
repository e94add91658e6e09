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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.CancellationToken;
import me.golemcore.runtime.domain.model.ContentBlock;
import me.golemcore.runtime.domain.model.HookDecision;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.PermissionDecision;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ToolResultBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import me.golemcore.runtime.port.outbound.ApprovalPort;
import me.golemcore.runtime.port.outbound.PermissionPort;
import me.golemcore.runtime.port.outbound.ToolHookPort;
import me.golemcore.runtime.port.outbound.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Executes the tool uses of one assistant turn.
 *
 * <p>
 * Calls run one after another in the order the model listed them, so a later
 * call observes the side effects of an earlier one. For each call: resolve the
 * tool, run pre-hooks (which may refuse or rewrite the input), check
 * permission, execute under a per-call abort signal, cap the output, run
 * post-hooks. Every failure along the way becomes an error tool result; only
 * cancellation and a hook halt end the batch early.
 */
@Slf4j
public class ToolExecutor {

    static final String PERMISSION_DENIED_BY_USER = "Permission denied by user";

    private final ToolRegistry toolRegistry;
    private final PermissionPort permissionPort;
    private final ApprovalPort approvalPort;
    private final ToolHookPort hooks;
    private final ToolOutputLimiter outputLimiter;
    private final Duration executionTimeout;

    public ToolExecutor(ToolRegistry toolRegistry, PermissionPort permissionPort, ApprovalPort approvalPort,
            ToolHookPort hooks, ToolOutputLimiter outputLimiter, Duration executionTimeout) {
        this.toolRegistry = toolRegistry;
        this.permissionPort = permissionPort;
        this.approvalPort = approvalPort;
        this.hooks = hooks != null ? hooks : new ToolHookPort() {
        };
        this.outputLimiter = outputLimiter;
        this.executionTimeout = executionTimeout;
    }

    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    /**
     * Same permissions, hooks and limits over a different set of tools.
     */
    public ToolExecutor withToolRegistry(ToolRegistry registry) {
        return new ToolExecutor(registry, permissionPort, approvalPort, hooks, outputLimiter, executionTimeout);
    }

    /**
     * Runs all tool uses of a turn.
     *
     * @param toolUses
     *            tool uses in model order
     * @param cancellation
     *            the turn's cancellation token
     * @param progressListener
     *            receives tool progress messages as they are reported
     */
    public ToolBatchResult executeAll(List<ToolUseBlock> toolUses, CancellationToken cancellation,
            Consumer<Message> progressListener) {
        if (progressListener == null) {
            progressListener = message -> {
            };
        }
        List<Message> results = new ArrayList<>();
        for (int i = 0; i < toolUses.size(); i++) {
            ToolUseBlock toolUse = toolUses.get(i);
            if (cancellation.isCancelled()) {
                log.info("[ToolExecutor] Cancelled before '{}' ({} of {})", toolUse.name(), i + 1, toolUses.size());
                return ToolBatchResult.cancelled(results);
            }
            Invocation invocation;
            try {
                invocation = executeOne(toolUse, cancellation, progressListener);
            } catch (CancellationException e) {
                log.info("[ToolExecutor] '{}' cancelled while running", toolUse.name());
                return ToolBatchResult.cancelled(results);
            } catch (HookHaltException e) {
                log.warn("[ToolExecutor] Pre-hook halted the turn at '{}': {}", toolUse.name(), e.getMessage());
                haltRemaining(toolUses, i, e.getMessage(), results);
                return ToolBatchResult.halted(results, e.getMessage());
            }

            results.add(Message.toolResult(invocation.result()));
            try {
                hooks.postToolUse(toolUse.name(), invocation.input(), invocation.result());
            } catch (HookHaltException e) {
                log.warn("[ToolExecutor] Post-hook halted the turn after '{}': {}", toolUse.name(), e.getMessage());
                haltRemaining(toolUses, i + 1, e.getMessage(), results);
                return ToolBatchResult.halted(results, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[ToolExecutor] Post-hook failed for '{}': {}", toolUse.name(), e.getMessage());
            }
        }
        return ToolBatchResult.completed(results);
    }

    private Invocation executeOne(ToolUseBlock toolUse, CancellationToken cancellation,
            Consumer<Message> progressListener) {
        Map<String, Object> input = toolUse.input();

        if (toolUse.hasInputError()) {
            return failed(toolUse, input, ToolFailureKind.INVALID_INPUT,
                    "Invalid arguments for tool \"" + toolUse.name() + "\": " + toolUse.inputError()
                            + ". Resend the call with arguments as a valid JSON object.");
        }

        ToolComponent tool = toolRegistry.findTool(sanitizeToolName(toolUse.name())).orElse(null);
        if (tool == null) {
            String available = toolRegistry.listTools().stream()
                    .map(descriptor -> descriptor.getName())
                    .collect(Collectors.joining(", "));
            return failed(toolUse, input, ToolFailureKind.UNKNOWN_TOOL,
                    "Tool \"" + toolUse.name() + "\" not found. Available tools: " + available);
        }

        HookDecision decision = runPreHook(toolUse.name(), input);
        if (decision.action() == HookDecision.Action.REFUSE) {
            return failed(toolUse, input, ToolFailureKind.HOOK_REFUSED,
                    "Blocked by hook: " + decision.reason());
        }
        if (decision.action() == HookDecision.Action.REWRITE) {
            log.debug("[ToolExecutor] Pre-hook rewrote input of '{}'", toolUse.name());
            input = decision.rewrittenInput();
        }

        String denial = checkPermission(toolUse.name(), input, cancellation);
        if (denial != null) {
            return failed(toolUse, input, ToolFailureKind.PERMISSION_DENIED, denial);
        }

        ToolResult result = invoke(tool, toolUse, input, cancellation, progressListener);
        return new Invocation(input, toResultBlock(toolUse, result));
    }

    private HookDecision runPreHook(String toolName, Map<String, Object> input) {
        try {
            HookDecision decision = hooks.preToolUse(toolName, input);
            return decision != null ? decision : HookDecision.proceed();
        } catch (HookHaltException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[ToolExecutor] Pre-hook failed for '{}': {}", toolName, e.getMessage());
            return HookDecision.proceed();
        }
    }

    /**
     * @return {@code null} when execution may proceed, otherwise the denial
     *         message
     */
    private String checkPermission(String toolName, Map<String, Object> input, CancellationToken cancellation) {
        PermissionDecision decision;
        try {
            decision = permissionPort.checkPermission(toolName, input);
        } catch (RuntimeException e) {
            log.error("[ToolExecutor] Permission check failed for '{}', denying", toolName, e);
            return "Permission check failed: " + safeCauseMessage(e);
        }
        if (decision == null) {
            decision = PermissionDecision.DENY;
        }
        return switch (decision) {
        case ALLOW -> null;
        case DENY -> "Permission denied for tool \"" + toolName + "\"";
        case ASK -> requestApproval(toolName, input, cancellation) ? null : PERMISSION_DENIED_BY_USER;
        };
    }

    private boolean requestApproval(String toolName, Map<String, Object> input, CancellationToken cancellation) {
        if (approvalPort == null || !approvalPort.isAvailable()) {
            log.info("[ToolExecutor] No approver available for '{}', denying", toolName);
            return false;
        }
        CompletableFuture<Boolean> approval = approvalPort.requestApproval(toolName, input);
        try (CancellationToken.Registration ignored = cancellation.onCancel(() -> approval.cancel(true))) {
            return Boolean.TRUE.equals(approval.join());
        } catch (CancellationException e) {
            cancellation.throwIfCancelled();
            return false;
        } catch (RuntimeException e) {
            log.error("[ToolExecutor] Approval request failed for '{}', denying", toolName, e);
            return false;
        }
    }

    private ToolResult invoke(ToolComponent tool, ToolUseBlock toolUse, Map<String, Object> input,
            CancellationToken cancellation, Consumer<Message> progressListener) {
        CancellationToken callToken = cancellation.child();
        ToolExecutionContext context = new ToolExecutionContext(toolUse.id(), toolUse.name(), callToken,
                text -> progressListener.accept(Message.toolProgress(toolUse.id(), text)));
        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(input, context);
        } catch (RuntimeException e) {
            log.error("[ToolExecutor] '{}' threw before starting", toolUse.name(), e);
            callToken.cancel();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
        if (future == null) {
            callToken.cancel();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        }

        CompletableFuture<ToolResult> running = future;
        try (CancellationToken.Registration ignored = callToken.onCancel(() -> running.cancel(true))) {
            ToolResult result = running.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result
                    : ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        } catch (TimeoutException e) {
            running.cancel(true);
            log.warn("[ToolExecutor] '{}' timed out after {}s", toolUse.name(), executionTimeout.toSeconds());
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool execution timed out after " + executionTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while running " + toolUse.name());
        } catch (CancellationException e) {
            cancellation.throwIfCancelled();
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Tool execution was cancelled");
        } catch (ExecutionException e) {
            log.error("[ToolExecutor] '{}' failed", toolUse.name(), e.getCause());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        } finally {
            // detaches the call token from the turn token
            callToken.cancel();
        }
    }

    private ToolResultBlock toResultBlock(ToolUseBlock toolUse, ToolResult result) {
        String text = result.displayText();
        if (!result.isSuccess() && !text.startsWith("Error")) {
            text = "Error: " + text;
        }
        List<ContentBlock> content = new ArrayList<>();
        content.add(new TextBlock(outputLimiter.limit(toolUse.name(), text)));
        content.addAll(result.getAttachments());
        return new ToolResultBlock(toolUse.id(), content, !result.isSuccess());
    }

    private Invocation failed(ToolUseBlock toolUse, Map<String, Object> input, ToolFailureKind kind,
            String message) {
        log.info("[ToolExecutor] '{}' ({}) rejected: {}", toolUse.name(), kind, message);
        return new Invocation(input, ToolResultBlock.text(toolUse.id(), "Error: " + message, true));
    }

    private static void haltRemaining(List<ToolUseBlock> toolUses, int from, String reason, List<Message> results) {
        for (int i = from; i < toolUses.size(); i++) {
            ToolUseBlock pending = toolUses.get(i);
            results.add(Message.toolResult(ToolResultBlock.text(pending.id(),
                    "Error: Turn halted by hook: " + reason, true)));
        }
    }

    /**
     * Strip special tokens and garbage some models leak into tool names, e.g.
     * {@code Bash<|channel|>commentary}.
     */
    static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[ToolExecutor] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record Invocation(Map<String, Object> input, ToolResultBlock result) {
    }
}
