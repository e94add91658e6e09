package me.golemcore.runtime.port.outbound;

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

import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ProviderRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for model calls. Implementations hide retries, pacing and the wire
 * format; callers see an assistant {@link Message} with usage attached, or a
 * future completed exceptionally with
 * {@link me.golemcore.runtime.domain.model.ProviderException} (or
 * {@link java.util.concurrent.CancellationException} when the request's token
 * was cancelled).
 */
public interface ProviderPort {

    String getProviderId();

    CompletableFuture<Message> chat(ProviderRequest request);

    default String getCurrentModel() {
        return getProviderId();
    }
}
