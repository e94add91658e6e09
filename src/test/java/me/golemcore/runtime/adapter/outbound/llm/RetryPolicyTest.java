package me.golemcore.runtime.adapter.outbound.llm;

import me.golemcore.runtime.domain.model.ProviderError;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RuntimeProperties.RetryProperties properties = new RuntimeProperties.RetryProperties();

    @Test
    void shouldGrowBackoffExponentiallyUpToCap() {
        RetryPolicy policy = new RetryPolicy(properties, () -> 0.0);

        assertEquals(1000, policy.backoffMs(0, null));
        assertEquals(2000, policy.backoffMs(1, null));
        assertEquals(4000, policy.backoffMs(2, null));
        assertEquals(30000, policy.backoffMs(10, null));
    }

    @Test
    void shouldAddBoundedJitter() {
        RetryPolicy policy = new RetryPolicy(properties, () -> 1.0);

        assertEquals(1250, policy.backoffMs(0, null));
        assertEquals(37500, policy.backoffMs(10, null));
    }

    @Test
    void shouldHonorLargerRetryAfterHint() {
        RetryPolicy policy = new RetryPolicy(properties, () -> 0.0);
        ProviderError rateLimited = ProviderError.transientError(ProviderErrorClassifier.RATE_LIMIT, 429, "slow down")
                .withRetryAfter(12000L);
        ProviderError smallHint = rateLimited.withRetryAfter(10L);
        ProviderError hugeHint = rateLimited.withRetryAfter(3_600_000L);

        assertEquals(12000, policy.backoffMs(0, rateLimited));
        assertEquals(1000, policy.backoffMs(0, smallHint));
        assertEquals(300000, policy.backoffMs(0, hugeHint));
    }

    @Test
    void shouldGrowAttemptTimeoutUpToMax() {
        RetryPolicy policy = new RetryPolicy(properties);

        assertEquals(Duration.ofMillis(30000), policy.attemptTimeout(0));
        assertEquals(Duration.ofMillis(45000), policy.attemptTimeout(1));
        assertEquals(Duration.ofMillis(180000), policy.attemptTimeout(20));
    }

    @Test
    void shouldAlwaysAllowOneAttempt() {
        properties.setMaxAttempts(0);

        assertEquals(1, new RetryPolicy(properties).getMaxAttempts());
    }
}
