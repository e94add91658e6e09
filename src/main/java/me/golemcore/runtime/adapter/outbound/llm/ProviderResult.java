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

import java.util.Objects;

/**
 * Either a backend reply or a {@link ProviderError}. Backends return this
 * instead of throwing so the retry driver can branch on the error kind.
 */
public final class ProviderResult<T> {

    private final T value;
    private final ProviderError error;

    private ProviderResult(T value, ProviderError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ProviderResult<T> success(T value) {
        return new ProviderResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ProviderResult<T> failure(ProviderError error) {
        return new ProviderResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value: " + error.describe());
        }
        return value;
    }

    public ProviderError getError() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }
}
