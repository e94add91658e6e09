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

import me.golemcore.runtime.domain.compaction.CompactionPipeline;
import me.golemcore.runtime.domain.context.ContextWindowManager;
import me.golemcore.runtime.domain.context.TokenAccountant;
import me.golemcore.runtime.domain.model.CancellationToken;
import me.golemcore.runtime.domain.model.CompactionResult;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderException;
import me.golemcore.runtime.domain.model.ProviderRequest;
import me.golemcore.runtime.domain.model.RetentionConfig;
import me.golemcore.runtime.domain.model.ToolCapability;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.domain.tool.ToolBatchResult;
import me.golemcore.runtime.domain.tool.ToolExecutor;
import me.golemcore.runtime.port.outbound.ProviderPort;
import me.golemcore.runtime.port.outbound.ToolRegistry;
import me.golemcore.runtime.usage.UsageAccumulator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Turn-taking state machine of one conversation.
 *
 * <p>
 * Scenario: the new user turn is appended and the model is called. An answer
 * without tool calls ends the run. Otherwise all tool uses of that answer are
 * handed to the {@link ToolExecutor} at once, the results are appended in
 * request order and the model is called again. Before every model call the
 * {@link ContextWindowManager} is consulted and, when the request would be
 * over the threshold, the {@link CompactionPipeline} replaces the history.
 *
 * <p>
 * Every assistant message, tool result and tool progress update is handed to
 * the listener as soon as it exists. The run ends in one of three outcomes:
 * {@link AgentOutcome#DONE}, {@link AgentOutcome#CANCELLED} (the token fired;
 * nothing is rolled back and no assistant turn is invented) or
 * {@link AgentOutcome#FAILED}.
 */
@Slf4j
public class AgentLoop {

    static final String CONTINUE_AFTER_COMPACTION = "Continue the task from where the summary above leaves off.";

    private final ProviderPort providerPort;
    private final ToolExecutor toolExecutor;
    private final ContextWindowManager windowManager;
    private final CompactionPipeline compactionPipeline;
    private final TokenAccountant tokenAccountant;
    private final ImagePayloadCompactor imageCompactor;
    private final RetentionConfig retention;
    private final int maxModelCalls;
    private final Clock clock;

    public AgentLoop(ProviderPort providerPort, ToolExecutor toolExecutor, ContextWindowManager windowManager,
            CompactionPipeline compactionPipeline, TokenAccountant tokenAccountant,
            ImagePayloadCompactor imageCompactor, RetentionConfig retention, int maxModelCalls, Clock clock) {
        this.providerPort = providerPort;
        this.toolExecutor = toolExecutor;
        this.windowManager = windowManager;
        this.compactionPipeline = compactionPipeline;
        this.tokenAccountant = tokenAccountant;
        this.imageCompactor = imageCompactor;
        this.retention = retention;
        this.maxModelCalls = maxModelCalls;
        this.clock = clock;
    }

    public ToolRegistry getToolRegistry() {
        return toolExecutor.getToolRegistry();
    }

    /**
     * Loop for nested runs: identical except that tools with the
     * {@link ToolCapability#AGENT} capability are not visible.
     */
    public AgentLoop forSubAgent() {
        ToolRegistry visible = toolExecutor.getToolRegistry().excluding(ToolCapability.AGENT);
        return new AgentLoop(providerPort, toolExecutor.withToolRegistry(visible), windowManager,
                compactionPipeline, tokenAccountant, imageCompactor, retention, maxModelCalls, clock);
    }

    public AgentRunResult run(AgentRunRequest request) {
        return run(request, null);
    }

    /**
     * Runs until the model answers without tool calls, the token is cancelled
     * or an unrecoverable error occurs. Blocks the calling thread.
     */
    public AgentRunResult run(AgentRunRequest request, Consumer<Message> listener) {
        Consumer<Message> sink = listener != null ? listener : message -> {
        };
        CancellationToken cancellation = request.getCancellation();
        Run run = new Run(request.getHistory());
        if (request.getUserMessage() != null) {
            run.history().add(request.getUserMessage());
        }
        String systemPrompt = SystemPromptFormatter.format(request.getSystemPrompt(), request.getPromptContext());
        long start = clock.millis();
        log.info("[AgentLoop] Run started: {} messages, {} tools", run.history().size(),
                toolExecutor.getToolRegistry().listTools().size());

        LoopState state = LoopState.AWAITING_MODEL;
        try {
            while (!state.isTerminal()) {
                cancellation.throwIfCancelled();
                if (run.modelCalls >= maxModelCalls) {
                    log.warn("[AgentLoop] Reached max model calls ({})", maxModelCalls);
                    return failed(run, AgentRunResult.MAX_MODEL_CALLS,
                            "Reached the maximum of " + maxModelCalls + " model calls in one run", null);
                }

                List<ToolDescriptor> tools = toolExecutor.getToolRegistry().listTools();
                long estimate = tokenAccountant.runningTotal(systemPrompt, run.history(), tools,
                        run.reportedFrom);
                if (windowManager.shouldCompact(run.history(), estimate)) {
                    state = LoopState.COMPACTING;
                    compact(run, systemPrompt, tools, estimate, cancellation);
                    state = LoopState.AWAITING_MODEL;
                }

                Message assistant = await(providerPort.chat(ProviderRequest.builder()
                        .systemPrompt(systemPrompt)
                        .messages(run.history())
                        .tools(tools)
                        .maxTokens(request.getMaxTokens())
                        .temperature(request.getTemperature())
                        .cancellation(cancellation)
                        .build()));
                run.modelCalls++;
                run.usage().record(assistant.getUsage());
                run.history().add(assistant);
                sink.accept(assistant);
                int replaced = imageCompactor.compact(run.history());
                if (replaced > 0) {
                    log.debug("[AgentLoop] Replaced {} sent images with placeholders", replaced);
                }

                if (!assistant.hasToolUses()) {
                    state = LoopState.DONE;
                    continue;
                }

                state = LoopState.TOOL_DISPATCH;
                ToolBatchResult batch = toolExecutor.executeAll(assistant.toolUses(), cancellation, sink);
                for (Message result : batch.results()) {
                    run.history().add(result);
                    sink.accept(result);
                }
                state = switch (batch.status()) {
                case COMPLETED -> LoopState.AWAITING_MODEL;
                case CANCELLED -> LoopState.CANCELLED;
                case HALTED -> LoopState.FAILED;
                };
                if (state == LoopState.FAILED) {
                    return failed(run, AgentRunResult.HOOK_HALTED, "Turn halted by hook: " + batch.haltReason(),
                            null);
                }
            }
            if (state == LoopState.CANCELLED) {
                return cancelled(run);
            }
            log.info("[AgentLoop] Run done: {} model calls, {} tokens in {}ms", run.modelCalls,
                    run.usage().totalTokens(), clock.millis() - start);
            return result(run, AgentOutcome.DONE).build();
        } catch (CancellationException e) {
            return cancelled(run);
        } catch (ProviderException e) {
            return failed(run, e.getCode(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("[AgentLoop] Run failed unexpectedly", e);
            return failed(run, AgentRunResult.INTERNAL_ERROR, e.getMessage(), e);
        }
    }

    /**
     * Same run as {@link #run(AgentRunRequest, Consumer)} exposed as a
     * sequence of messages. The run starts on subscription on a
     * bounded-elastic worker; cancelling the subscription cancels the run.
     * Messages are buffered, so a slow subscriber never stalls the loop. A run
     * that does not end in {@link AgentOutcome#DONE} terminates the sequence
     * with an {@link AgentRunException}.
     */
    public Flux<Message> stream(AgentRunRequest request) {
        return Flux.<Message>create(sink -> {
            CancellationToken cancellation = request.getCancellation();
            sink.onCancel(cancellation::cancel);
            AgentRunResult result = run(request, sink::next);
            if (result.isDone()) {
                sink.complete();
            } else {
                sink.error(new AgentRunException(result));
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void compact(Run run, String systemPrompt, List<ToolDescriptor> tools, long estimate,
            CancellationToken cancellation) {
        log.info("[AgentLoop] ~{} tokens >= threshold {}, compacting {} messages with {}", estimate,
                windowManager.thresholdTokens(), run.history().size(), retention.getStrategy());

        CompactionResult compaction = compactionPipeline.compact(List.copyOf(run.history()), retention,
                cancellation);
        run.compactions().add(compaction);
        run.usage().record(compaction.getUsage());
        run.history().clear();
        run.history().addAll(compaction.getMessages());
        if (!run.history().isEmpty() && run.history().get(run.history().size() - 1).isAssistant()) {
            // a request must end with a user turn
            run.history().add(Message.user(CONTINUE_AFTER_COMPACTION));
        }
        run.reportedFrom = run.history().size();

        long after = tokenAccountant.countRequest(systemPrompt, run.history(), tools);
        if (windowManager.shouldCompact(after)) {
            log.warn("[AgentLoop] Still ~{} tokens after compaction (threshold {})", after,
                    windowManager.thresholdTokens());
        }
    }

    private static Message await(CompletableFuture<Message> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private AgentRunResult cancelled(Run run) {
        log.info("[AgentLoop] Run cancelled after {} model calls", run.modelCalls);
        return result(run, AgentOutcome.CANCELLED).build();
    }

    private AgentRunResult failed(Run run, String code, String message, Throwable error) {
        log.warn("[AgentLoop] Run failed: [{}] {}", code, message);
        return result(run, AgentOutcome.FAILED)
                .errorCode(code)
                .errorMessage(message)
                .error(error)
                .build();
    }

    private AgentRunResult.AgentRunResultBuilder result(Run run, AgentOutcome outcome) {
        return AgentRunResult.builder()
                .outcome(outcome)
                .messages(run.history())
                .usage(run.usage().snapshot())
                .modelCalls(run.modelCalls)
                .compactions(run.compactions());
    }

    private static final class Run {

        private final List<Message> history;
        private final UsageAccumulator usage = new UsageAccumulator();
        private final List<CompactionResult> compactions = new ArrayList<>();
        private int modelCalls;
        private int reportedFrom;

        private Run(List<Message> initial) {
            this.history = new ArrayList<>(initial);
        }

        List<Message> history() {
            return history;
        }

        UsageAccumulator usage() {
            return usage;
        }

        List<CompactionResult> compactions() {
            return compactions;
        }
    }
}
