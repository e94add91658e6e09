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

import me.golemcore.runtime.domain.model.ProviderError;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Backoff and per-attempt timeout schedule for provider calls.
 *
 * <p>
 * Attempt {@code n} (zero based) waits
 * {@code min(maxBackoff, initial * multiplier^n)} plus up to
 * {@code jitterRatio} of that at random, or the server's retry-after hint when
 * it is longer. Each attempt also gets a longer timeout than the previous one,
 * up to a ceiling.
 */
public class RetryPolicy {

    private static final long MAX_SERVER_HINT_MS = 300_000;

    private final RuntimeProperties.RetryProperties properties;
    private final DoubleSupplier random;

    public RetryPolicy(RuntimeProperties.RetryProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(RuntimeProperties.RetryProperties properties, DoubleSupplier random) {
        this.properties = properties;
        this.random = random;
    }

    public int getMaxAttempts() {
        return Math.max(1, properties.getMaxAttempts());
    }

    public long backoffMs(int attempt, ProviderError error) {
        double base = properties.getInitialBackoffMs() * Math.pow(properties.getBackoffMultiplier(), attempt);
        long capped = (long) Math.min(properties.getMaxBackoffMs(), base);
        long jitter = (long) (capped * properties.getJitterRatio() * random.getAsDouble());
        long delay = capped + jitter;
        if (error != null && error.retryAfterMs() != null) {
            delay = Math.max(delay, Math.min(error.retryAfterMs(), MAX_SERVER_HINT_MS));
        }
        return delay;
    }

    public Duration attemptTimeout(int attempt) {
        double timeout = properties.getInitialAttemptTimeoutMs()
                * Math.pow(properties.getAttemptTimeoutMultiplier(), attempt);
        return Duration.ofMillis((long) Math.min(properties.getMaxAttemptTimeoutMs(), timeout));
    }
}
