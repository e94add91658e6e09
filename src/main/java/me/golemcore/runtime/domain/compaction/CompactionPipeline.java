package me.golemcore.runtime.domain.compaction;

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

import me.golemcore.runtime.domain.context.ContextWindowManager;
import me.golemcore.runtime.domain.context.TokenAccountant;
import me.golemcore.runtime.domain.model.CancellationToken;
import me.golemcore.runtime.domain.model.CompactionResult;
import me.golemcore.runtime.domain.model.CompactionSection;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderRequest;
import me.golemcore.runtime.domain.model.ProviderUsage;
import me.golemcore.runtime.domain.model.RetentionConfig;
import me.golemcore.runtime.domain.model.RetentionStrategy;
import me.golemcore.runtime.domain.model.StopReason;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ProviderPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shrinks conversation history according to a {@link RetentionConfig}.
 *
 * <p>
 * {@code PRESERVE_RECENT} and {@code PRESERVE_IMPORTANT} only drop messages.
 * {@code SMART_COMPRESSION} keeps a recent slice and asks the provider for one
 * summary of the rest, falling back to a statistical summary when that call
 * fails. {@code AUTO_COMPACT} sends the whole transcript to eight extraction
 * prompts at once, waits for all of them, and replaces the history with the
 * merged sections. A failed extraction yields a placeholder for its section and
 * does not affect the others.
 */
@Slf4j
public class CompactionPipeline {

    static final String SUMMARY_HEADER = "# Conversation Summary";
    static final String SECTION_SEPARATOR = "\n\n---\n\n";
    static final int IMPORTANT_RECENT_COUNT = 5;

    private static final String[] IMPORTANT_KEYWORDS = { "error", "fail", "warning", "critical", "issue" };

    private static final String SMART_SUMMARY_PROMPT = """
            Summarize the conversation transcript you are given so that the assistant can continue
            the work without it. Include, when applicable:
            - what has been accomplished
            - what is being worked on right now
            - decisions made and their rationale
            - user preferences and constraints
            - referenced files, commands, settings, IDs and URLs
            - errors seen and how they were resolved
            - open questions and the next steps
            Keep it factual. Output only the summary.""";

    private final ProviderPort providerPort;
    private final TokenAccountant tokenAccountant;
    private final ContextWindowManager windowManager;
    private final TranscriptRenderer transcriptRenderer;
    private final RuntimeProperties.CompactionProperties settings;
    private final Clock clock;

    public CompactionPipeline(ProviderPort providerPort, TokenAccountant tokenAccountant,
            ContextWindowManager windowManager, TranscriptRenderer transcriptRenderer,
            RuntimeProperties.CompactionProperties settings, Clock clock) {
        this.providerPort = providerPort;
        this.tokenAccountant = tokenAccountant;
        this.windowManager = windowManager;
        this.transcriptRenderer = transcriptRenderer;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Compacts {@code history}. Blocks until done.
     *
     * @throws CancellationException
     *             if {@code cancellation} fires while summaries are being produced
     */
    public CompactionResult compact(List<Message> history, RetentionConfig config, CancellationToken cancellation) {
        long start = clock.millis();
        CompactionResult result = switch (config.getStrategy()) {
        case PRESERVE_RECENT -> preserveRecent(history, config.getPreserveCount());
        case PRESERVE_IMPORTANT -> preserveImportant(history);
        case SMART_COMPRESSION -> smartCompression(history, cancellation);
        case AUTO_COMPACT -> autoCompact(history, cancellation);
        };
        log.info("[Compaction] {}: {} -> {} messages ({} removed, {} failed sections) in {}ms",
                config.getStrategy(), history.size(), result.getMessages().size(), result.getRemovedCount(),
                result.failedSectionCount(), clock.millis() - start);
        return result;
    }

    // ==================== DROP-ONLY STRATEGIES ====================

    CompactionResult preserveRecent(List<Message> history, int keep) {
        int k = Math.max(1, keep);
        if (history.size() <= k) {
            return unchanged(history, RetentionStrategy.PRESERVE_RECENT);
        }
        List<Message> kept = history.subList(history.size() - k, history.size());
        return CompactionResult.builder()
                .strategy(RetentionStrategy.PRESERVE_RECENT)
                .messages(kept)
                .removedCount(history.size() - k)
                .preservedCount(k)
                .usage(ProviderUsage.EMPTY)
                .build();
    }

    CompactionResult preserveImportant(List<Message> history) {
        if (history.size() <= IMPORTANT_RECENT_COUNT) {
            return unchanged(history, RetentionStrategy.PRESERVE_IMPORTANT);
        }
        int recentStart = history.size() - IMPORTANT_RECENT_COUNT;
        List<Message> kept = new ArrayList<>();
        for (int i = 0; i < history.size(); i++) {
            Message message = history.get(i);
            if (i >= recentStart || isImportant(message)) {
                kept.add(message);
            }
        }
        return CompactionResult.builder()
                .strategy(RetentionStrategy.PRESERVE_IMPORTANT)
                .messages(kept)
                .removedCount(history.size() - kept.size())
                .preservedCount(kept.size())
                .usage(ProviderUsage.EMPTY)
                .build();
    }

    static boolean isImportant(Message message) {
        if (message.isUser()) {
            return true;
        }
        if (!message.isAssistant()) {
            return false;
        }
        String text = message.text().toLowerCase(Locale.ROOT);
        for (String keyword : IMPORTANT_KEYWORDS) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    // ==================== SMART COMPRESSION ====================

    CompactionResult smartCompression(List<Message> history, CancellationToken cancellation) {
        int n = history.size();
        int recentCount = Math.max(1, Math.min(settings.getSmartRecentCap(),
                (int) Math.floor(n * settings.getSmartRecentRatio())));
        if (n <= recentCount + 1) {
            return unchanged(history, RetentionStrategy.SMART_COMPRESSION);
        }
        List<Message> older = history.subList(0, n - recentCount);
        List<Message> recent = history.subList(n - recentCount, n);

        ProviderUsage usage = ProviderUsage.EMPTY;
        String summary;
        CancellationToken call = cancellation.child();
        try {
            Message response = await(providerPort.chat(ProviderRequest.builder()
                    .systemPrompt(SMART_SUMMARY_PROMPT)
                    .message(Message.user("<transcript>\n" + transcriptRenderer.render(older) + "\n</transcript>"))
                    .maxTokens(settings.getSectionMaxTokens())
                    .purpose("compaction:summary")
                    .cancellation(call)
                    .build()), cancellation);
            usage = response.getUsage();
            summary = response.text();
            if (summary.isBlank()) {
                log.warn("[Compaction] Provider returned an empty summary, using statistics");
                summary = statisticalSummary(older);
            }
        } catch (ExtractionFailure e) {
            log.warn("[Compaction] Summary request failed, using statistics: {}", e.getMessage());
            summary = statisticalSummary(older);
        } finally {
            // stops retries of a call that timed out
            call.cancel();
        }

        Message summaryMessage = summaryMessage(SUMMARY_HEADER + "\nEarlier part of the conversation ("
                + older.size() + " messages), summarized:\n\n" + summary, usage);
        List<Message> messages = new ArrayList<>();
        messages.add(summaryMessage);
        messages.addAll(recent);
        return CompactionResult.builder()
                .strategy(RetentionStrategy.SMART_COMPRESSION)
                .summaryMessage(summaryMessage)
                .messages(messages)
                .removedCount(older.size())
                .preservedCount(recent.size())
                .usage(usage)
                .build();
    }

    static String statisticalSummary(List<Message> messages) {
        long user = messages.stream().filter(m -> m.isUser() && !m.isToolResultMessage()).count();
        long assistant = messages.stream().filter(Message::isAssistant).count();
        long toolCalls = messages.stream().mapToLong(m -> m.toolUses().size()).sum();
        StringBuilder sb = new StringBuilder();
        sb.append("- ").append(user).append(" user messages, ").append(assistant)
                .append(" assistant messages, ").append(toolCalls).append(" tool calls\n");
        messages.stream()
                .filter(m -> m.isUser() && !m.isToolResultMessage())
                .map(Message::text)
                .filter(text -> !text.isBlank())
                .map(text -> text.lines().findFirst().orElse(""))
                .map(line -> line.length() > 160 ? line.substring(0, 160) + "..." : line)
                .forEach(line -> sb.append("- user asked: ").append(line).append('\n'));
        return sb.toString().trim();
    }

    // ==================== AUTO COMPACT ====================

    CompactionResult autoCompact(List<Message> history, CancellationToken cancellation) {
        String transcript = transcriptRenderer.render(history);
        ExtractionSection[] sections = ExtractionSection.values();

        List<CompletableFuture<Extraction>> futures = new ArrayList<>();
        for (ExtractionSection section : sections) {
            futures.add(extract(section, transcript, cancellation));
        }
        // settle all: every future is already mapped to a value, none completes exceptionally
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        cancellation.throwIfCancelled();

        List<CompactionSection> results = new ArrayList<>();
        ProviderUsage usage = ProviderUsage.EMPTY;
        for (CompletableFuture<Extraction> future : futures) {
            Extraction extraction = future.join();
            results.add(extraction.section());
            usage = usage.plus(extraction.usage());
        }

        Message summaryMessage = summaryMessage(merge(results, history.size()), usage);
        long summaryTokens = tokenAccountant.countMessage(summaryMessage);
        if (windowManager.shouldCompact(summaryTokens)) {
            log.warn("[Compaction] Merged summary is {} tokens, still over the {} threshold", summaryTokens,
                    windowManager.thresholdTokens());
        }
        return CompactionResult.builder()
                .strategy(RetentionStrategy.AUTO_COMPACT)
                .sections(results)
                .summaryMessage(summaryMessage)
                .message(summaryMessage)
                .removedCount(history.size())
                .preservedCount(0)
                .usage(usage)
                .build();
    }

    private CompletableFuture<Extraction> extract(ExtractionSection section, String transcript,
            CancellationToken cancellation) {
        CancellationToken call = cancellation.child();
        ProviderRequest request = ProviderRequest.builder()
                .systemPrompt(section.systemPrompt())
                .message(Message.user(section.instructions()
                        + "\n\n<transcript>\n" + transcript + "\n</transcript>"))
                .maxTokens(settings.getSectionMaxTokens())
                .purpose("compaction:" + section.name().toLowerCase(Locale.ROOT))
                .cancellation(call)
                .build();
        CompletableFuture<Message> response;
        try {
            response = providerPort.chat(request);
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }
        return response
                .orTimeout(settings.getExtractionTimeoutSeconds(), TimeUnit.SECONDS)
                .handle((message, error) -> {
                    // a timed out extraction must not keep retrying in the background
                    call.cancel();
                    if (error != null) {
                        String reason = reasonOf(error);
                        log.warn("[Compaction] Extraction '{}' failed: {}", section.getTitle(), reason);
                        return new Extraction(new CompactionSection(section.getTitle(),
                                "[EXTRACTION FAILED: " + reason + "]", true), ProviderUsage.EMPTY);
                    }
                    String text = capSection(message.text().trim());
                    if (text.isEmpty()) {
                        text = "[No relevant information found]";
                    }
                    return new Extraction(new CompactionSection(section.getTitle(), text, false),
                            message.getUsage());
                });
    }

    private String capSection(String text) {
        long tokens = tokenAccountant.countText(text);
        int maxTokens = settings.getSectionMaxTokens();
        if (tokens <= maxTokens) {
            return text;
        }
        int maxChars = (int) (text.length() * (double) maxTokens / tokens);
        int cut = text.lastIndexOf('\n', maxChars);
        if (cut <= 0) {
            cut = maxChars;
        }
        return text.substring(0, cut) + "\n[section truncated]";
    }

    static String merge(List<CompactionSection> sections, int messageCount) {
        StringBuilder sb = new StringBuilder();
        sb.append(SUMMARY_HEADER).append('\n')
                .append("Generated by parallel extraction of ").append(sections.size())
                .append(" sections from ").append(messageCount)
                .append(" messages. It replaces all earlier conversation history.")
                .append(SECTION_SEPARATOR);
        for (int i = 0; i < sections.size(); i++) {
            if (i > 0) {
                sb.append(SECTION_SEPARATOR);
            }
            CompactionSection section = sections.get(i);
            sb.append(section.title()).append("\n\n").append(section.content());
        }
        return sb.toString();
    }

    // ==================== HELPERS ====================

    private Message summaryMessage(String text, ProviderUsage extractionUsage) {
        ProviderUsage usage = ProviderUsage.builder()
                .outputTokens(extractionUsage.getOutputTokens())
                .costUsd(extractionUsage.getCostUsd())
                .durationMs(extractionUsage.getDurationMs())
                .model(extractionUsage.getModel())
                .build();
        return Message.assistant(List.of(new TextBlock(text)), usage, StopReason.END_TURN);
    }

    private static CompactionResult unchanged(List<Message> history, RetentionStrategy strategy) {
        return CompactionResult.builder()
                .strategy(strategy)
                .messages(history)
                .removedCount(0)
                .preservedCount(history.size())
                .usage(ProviderUsage.EMPTY)
                .build();
    }

    private Message await(CompletableFuture<Message> future, CancellationToken cancellation) {
        try {
            return future.get(settings.getExtractionTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during compaction");
        } catch (CancellationException e) {
            cancellation.throwIfCancelled();
            throw new ExtractionFailure("cancelled");
        } catch (ExecutionException e) {
            cancellation.throwIfCancelled();
            throw new ExtractionFailure(reasonOf(e));
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionFailure("timed out after " + settings.getExtractionTimeoutSeconds() + "s");
        }
    }

    private static String reasonOf(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        if (cause instanceof CancellationException) {
            return "cancelled";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private record Extraction(CompactionSection section, ProviderUsage usage) {
    }

    private static final class ExtractionFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        ExtractionFailure(String message) {
            super(message);
        }
    }
}
