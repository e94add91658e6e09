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

import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.http.FeignClientFactory;
import me.golemcore.runtime.ratelimit.RequestPacer;
import me.golemcore.runtime.ratelimit.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Builds the {@link ProviderAdapter} for the backend selected by
 * {@code runtime.provider.type}.
 */
@Slf4j
@RequiredArgsConstructor
public class ProviderAdapterFactory {

    public static final String ANTHROPIC = "anthropic";
    public static final String OPENAI_COMPATIBLE = "openai-compatible";

    static final long OPENAI_COMPATIBLE_MIN_INTERVAL_MS = 1000;

    private final RuntimeProperties properties;
    private final ObjectMapper objectMapper;
    private final FeignClientFactory feignClientFactory;
    private final Executor executor;
    private final Clock clock;

    public ProviderAdapter create() {
        return create(createBackend());
    }

    public ProviderAdapter create(ProviderBackend backend) {
        RuntimeProperties.ProviderProperties provider = properties.getProvider();
        log.info("[Provider] Using {} backend, model {}", backend.getBackendId(), backend.getModel());
        return new ProviderAdapter(
                backend,
                new RequestSanitizer(objectMapper, provider.getMaxHistoryMessages(), provider.getMaxToolResultChars()),
                new ToolArgumentRepairer(objectMapper),
                new RetryPolicy(properties.getRetry()),
                new RequestPacer(minRequestIntervalMs(backend)),
                new PricingTable(properties.getPricing()),
                Sleeper.cancellable(),
                executor,
                clock);
    }

    long minRequestIntervalMs(ProviderBackend backend) {
        Long configured = properties.getProvider().getMinRequestIntervalMs();
        if (configured != null) {
            return configured;
        }
        return OPENAI_COMPATIBLE.equals(backend.getBackendId()) ? OPENAI_COMPATIBLE_MIN_INTERVAL_MS : 0;
    }

    ProviderBackend createBackend() {
        RuntimeProperties.ProviderProperties provider = properties.getProvider();
        String type = provider.getType() != null ? provider.getType().toLowerCase(Locale.ROOT) : ANTHROPIC;
        return switch (type) {
        case ANTHROPIC -> new AnthropicBackend(provider, objectMapper);
        case OPENAI_COMPATIBLE, "openai", "custom" -> new OpenAiCompatibleBackend(provider, properties.getHttp(),
                feignClientFactory, objectMapper);
        default -> throw new IllegalStateException("Unknown provider type: " + provider.getType()
                + " (expected " + ANTHROPIC + " or " + OPENAI_COMPATIBLE + ")");
        };
    }
}
