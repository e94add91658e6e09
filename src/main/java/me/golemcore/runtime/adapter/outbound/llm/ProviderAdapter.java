package me.golemcore.runtime.adapter.outbound.llm;

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

import me.golemcore.runtime.domain.model.CancellationToken;
import me.golemcore.runtime.domain.model.ContentBlock;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.MessageType;
import me.golemcore.runtime.domain.model.ProviderError;
import me.golemcore.runtime.domain.model.ProviderException;
import me.golemcore.runtime.domain.model.ProviderRequest;
import me.golemcore.runtime.domain.model.ProviderUsage;
import me.golemcore.runtime.domain.model.RequestDiagnostics;
import me.golemcore.runtime.domain.model.StopReason;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import me.golemcore.runtime.port.outbound.ProviderPort;
import me.golemcore.runtime.ratelimit.RequestPacer;
import me.golemcore.runtime.ratelimit.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link ProviderPort} over a single {@link ProviderBackend}.
 *
 * <p>
 * For every request:
 * <ol>
 * <li>the history is sanitized ({@link RequestSanitizer})</li>
 * <li>the call is paced ({@link RequestPacer}) and sent with a per-attempt
 * timeout</li>
 * <li>transient failures are retried with backoff ({@link RetryPolicy});
 * permanent ones fail at once</li>
 * <li>tool-call arguments are parsed and repaired
 * ({@link ToolArgumentRepairer})</li>
 * <li>usage, duration and cost are attached to the assistant message</li>
 * </ol>
 *
 * <p>
 * Cancelling the request's token completes the returned future with a
 * {@link java.util.concurrent.CancellationException} immediately; an attempt
 * already on the wire finishes in the background and its reply is dropped.
 */
@Slf4j
public class ProviderAdapter implements ProviderPort {

    private final ProviderBackend backend;
    private final RequestSanitizer sanitizer;
    private final ToolArgumentRepairer argumentRepairer;
    private final RetryPolicy retryPolicy;
    private final RequestPacer pacer;
    private final PricingTable pricing;
    private final Sleeper sleeper;
    private final Executor executor;
    private final Clock clock;

    public ProviderAdapter(ProviderBackend backend, RequestSanitizer sanitizer,
            ToolArgumentRepairer argumentRepairer, RetryPolicy retryPolicy, RequestPacer pacer,
            PricingTable pricing, Sleeper sleeper, Executor executor, Clock clock) {
        this.backend = backend;
        this.sanitizer = sanitizer;
        this.argumentRepairer = argumentRepairer;
        this.retryPolicy = retryPolicy;
        this.pacer = pacer;
        this.pricing = pricing;
        this.sleeper = sleeper;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public String getProviderId() {
        return backend.getBackendId();
    }

    @Override
    public String getCurrentModel() {
        return backend.getModel();
    }

    @Override
    public CompletableFuture<Message> chat(ProviderRequest request) {
        CompletableFuture<Message> future = new CompletableFuture<>();
        CancellationToken.Registration registration = request.getCancellation()
                .onCancel(() -> future.cancel(true));
        try {
            executor.execute(() -> {
                try {
                    future.complete(execute(request));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                } finally {
                    registration.close();
                }
            });
        } catch (RejectedExecutionException e) {
            registration.close();
            future.completeExceptionally(e);
        }
        return future;
    }

    Message execute(ProviderRequest request) {
        CancellationToken token = request.getCancellation();
        token.throwIfCancelled();

        ProviderRequest prepared = request.toBuilder()
                .systemPrompt(request.getSystemPrompt() != null ? sanitizer.sanitizeText(request.getSystemPrompt())
                        : null)
                .clearMessages()
                .messages(sanitizer.prepare(request.getMessages()))
                .build();

        int maxAttempts = retryPolicy.getMaxAttempts();
        ProviderError lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            token.throwIfCancelled();
            pacer.acquire(token);

            Duration timeout = retryPolicy.attemptTimeout(attempt);
            long start = clock.millis();
            log.debug("[Provider] {} request: {} messages, {} tools, attempt {}/{}, timeout {}ms",
                    request.getPurpose(), prepared.getMessages().size(), prepared.getTools().size(),
                    attempt + 1, maxAttempts, timeout.toMillis());
            ProviderResult<ProviderBackend.Reply> result = backend.send(prepared, timeout);
            long durationMs = clock.millis() - start;
            token.throwIfCancelled();

            if (result.isSuccess()) {
                return toMessage(result.getValue(), durationMs);
            }

            lastError = result.getError();
            if (!lastError.isTransient()) {
                throw failure(lastError, attempt + 1, prepared);
            }
            if (attempt + 1 < maxAttempts) {
                long delay = retryPolicy.backoffMs(attempt, lastError);
                log.warn("[Provider] {} (attempt {}/{}), retrying in {}ms",
                        lastError.describe(), attempt + 1, maxAttempts, delay);
                sleeper.sleep(delay, token);
            }
        }
        throw failure(lastError, maxAttempts, prepared);
    }

    private ProviderException failure(ProviderError error, int attempts, ProviderRequest prepared) {
        RequestDiagnostics diagnostics = RequestDiagnostics.of(prepared);
        log.error("[Provider] {} failed after {} attempt(s): {} | request: {} | recent: {}",
                prepared.getPurpose(), attempts, error.describe(), diagnostics.summary(),
                diagnostics.recentMessages());
        return new ProviderException(error, attempts, diagnostics);
    }

    private Message toMessage(ProviderBackend.Reply reply, long durationMs) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (reply.text() != null && !reply.text().isBlank()) {
            blocks.add(new TextBlock(reply.text()));
        }
        for (ProviderBackend.RawToolCall call : reply.toolCalls()) {
            String id = call.id() != null && !call.id().isBlank() ? call.id() : "call_" + UUID.randomUUID();
            String name = call.name() != null ? call.name() : "";
            ToolArgumentRepairer.Outcome outcome = argumentRepairer.parse(call.arguments());
            blocks.add(new ToolUseBlock(id, name, outcome.arguments(), outcome.error()));
        }

        String model = reply.model() != null ? reply.model() : backend.getModel();
        ProviderUsage usage = ProviderUsage.builder()
                .inputTokens(reply.inputTokens())
                .outputTokens(reply.outputTokens())
                .cachedTokens(reply.cachedTokens())
                .durationMs(durationMs)
                .costUsd(pricing.cost(backend.getBackendId(), model, reply.inputTokens(), reply.outputTokens(),
                        reply.cachedTokens()))
                .model(model)
                .build();

        StopReason stopReason = StopReason.fromWire(reply.finishReason());
        if (stopReason == StopReason.UNKNOWN && !reply.toolCalls().isEmpty()) {
            stopReason = StopReason.TOOL_USE;
        }

        log.debug("[Provider] Reply: {} tool calls, {} in / {} out tokens, {}ms, ${}",
                reply.toolCalls().size(), usage.getInputTokens(), usage.getOutputTokens(), durationMs,
                String.format("%.6f", usage.getCostUsd()));

        return Message.builder()
                .id(UUID.randomUUID().toString())
                .type(MessageType.ASSISTANT)
                .content(blocks)
                .usage(usage)
                .stopReason(stopReason)
                .timestamp(clock.instant())
                .build();
    }
}
