package me.golemcore.runtime.ratelimit;

import me.golemcore.runtime.domain.model.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class RequestPacerTest {

    private final AtomicLong now = new AtomicLong(TimeUnit.SECONDS.toNanos(100));
    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper sleeper = (millis, token) -> {
        sleeps.add(millis);
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    };

    @Test
    void shouldNotWaitForFirstRequest() {
        RequestPacer pacer = new RequestPacer(1000, now::get, sleeper);

        pacer.acquire(CancellationToken.create());

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldSpaceConsecutiveRequests() {
        RequestPacer pacer = new RequestPacer(1000, now::get, sleeper);
        CancellationToken token = CancellationToken.create();

        pacer.acquire(token);
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(300));
        pacer.acquire(token);
        pacer.acquire(token);

        assertEquals(List.of(700L, 1000L), sleeps);
    }

    @Test
    void shouldNotWaitWhenIntervalAlreadyElapsed() {
        RequestPacer pacer = new RequestPacer(1000, now::get, sleeper);
        CancellationToken token = CancellationToken.create();

        pacer.acquire(token);
        now.addAndGet(TimeUnit.SECONDS.toNanos(5));
        pacer.acquire(token);

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldBeNoOpWhenDisabled() {
        RequestPacer pacer = new RequestPacer(0, now::get, sleeper);
        CancellationToken token = CancellationToken.create();

        pacer.acquire(token);
        pacer.acquire(token);

        assertTrue(sleeps.isEmpty());
        assertEquals(0, pacer.getMinIntervalMs());
    }

    @Test
    void shouldRejectCancelledToken() {
        RequestPacer pacer = new RequestPacer(1000, now::get, sleeper);
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(CancellationException.class, () -> pacer.acquire(token));
    }

    @Test
    void shouldWakeCancellableSleeperOnCancel() {
        CancellationToken token = CancellationToken.create();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        canceller.start();
        long start = System.nanoTime();

        assertThrows(CancellationException.class, () -> Sleeper.cancellable().sleep(10_000, token));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 5000);
    }
}
