package me.golemcore.runtime.ratelimit;

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
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum interval between consecutive backend requests.
 *
 * <p>
 * Shared by every call that goes through one provider adapter, so bursts from
 * parallel compaction extractions are spread out as well. The wait honors the
 * caller's cancellation token.
 */
@Slf4j
public class RequestPacer {

    private final long minIntervalNanos;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;

    private long lastRequestNanos;
    private boolean started;

    public RequestPacer(long minIntervalMs) {
        this(minIntervalMs, System::nanoTime, Sleeper.cancellable());
    }

    public RequestPacer(long minIntervalMs, LongSupplier nanoTime, Sleeper sleeper) {
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, minIntervalMs));
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the next request may be sent and reserves that slot.
     */
    public synchronized void acquire(CancellationToken token) {
        token.throwIfCancelled();
        if (minIntervalNanos == 0) {
            return;
        }
        if (started) {
            long waitNanos = lastRequestNanos + minIntervalNanos - nanoTime.getAsLong();
            if (waitNanos > 0) {
                long waitMs = TimeUnit.NANOSECONDS.toMillis(waitNanos + 999_999);
                log.debug("[Pacer] Waiting {}ms before next request", waitMs);
                sleeper.sleep(waitMs, token);
            }
        }
        lastRequestNanos = nanoTime.getAsLong();
        started = true;
    }

    public long getMinIntervalMs() {
        return TimeUnit.NANOSECONDS.toMillis(minIntervalNanos);
    }
}
