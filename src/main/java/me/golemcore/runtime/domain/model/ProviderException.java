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

/**
 * Terminal provider failure: a permanent error, or a transient one that
 * outlasted every retry. Carries the classified error and the shape of the
 * request that failed.
 */
public class ProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ProviderError error;
    private final int attempts;
    private final transient RequestDiagnostics diagnostics;

    public ProviderException(ProviderError error, int attempts, RequestDiagnostics diagnostics) {
        super(error.describe() + " (after " + attempts + (attempts == 1 ? " attempt" : " attempts")
                + (diagnostics != null ? "; request: " + diagnostics.summary() : "") + ")");
        this.error = error;
        this.attempts = attempts;
        this.diagnostics = diagnostics;
    }

    public ProviderError getError() {
        return error;
    }

    public String getCode() {
        return error.code();
    }

    public int getAttempts() {
        return attempts;
    }

    public RequestDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
