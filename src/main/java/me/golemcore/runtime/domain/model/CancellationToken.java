package me.golemcore.runtime.domain.model;

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

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed top-down from the caller of an agent
 * loop into provider calls and running tools.
 *
 * <p>
 * Listeners registered with {@link #onCancel(Runnable)} run exactly once, on
 * the thread that calls {@link #cancel()}, or immediately if the token is
 * already cancelled. {@link #child()} derives a token that is cancelled along
 * with its parent but can also be cancelled on its own, which is how a single
 * tool call gets its own abort signal.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        // whoever removes a listener runs it, so a racing onCancel() cannot run it twice
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
    }

    /**
     * Registers a listener. The returned handle removes it again; callers close
     * it once the guarded operation is over.
     */
    public Registration onCancel(Runnable listener) {
        if (isCancelled()) {
            runListener(listener);
            return () -> {
            };
        }
        listeners.add(listener);
        // cancel() may have raced with add()
        if (isCancelled() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Cancelled");
        }
    }

    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Registration registration = onCancel(child::cancel);
        child.onCancel(registration::close);
        return child;
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[Cancel] Listener failed: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
