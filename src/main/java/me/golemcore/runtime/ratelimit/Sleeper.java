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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait that ends early when the token is cancelled. Tests substitute
 * a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @throws CancellationException
     *             if the token is cancelled before or during the wait
     */
    void sleep(long millis, CancellationToken token);

    static Sleeper cancellable() {
        return (millis, token) -> {
            token.throwIfCancelled();
            if (millis <= 0) {
                return;
            }
            CountDownLatch latch = new CountDownLatch(1);
            try (CancellationToken.Registration ignored = token.onCancel(latch::countDown)) {
                latch.await(millis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting");
            }
            token.throwIfCancelled();
        };
    }
}
