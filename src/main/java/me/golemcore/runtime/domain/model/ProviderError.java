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
 * Classified backend failure.
 *
 * <p>
 * {@link Kind#TRANSIENT} errors (rate limits, timeouts, server errors) are
 * retried; {@link Kind#PERMANENT} ones (validation, authentication) are
 * surfaced immediately. {@code retryAfterMs} carries a server supplied delay
 * hint when there was one.
 */
public record ProviderError(Kind kind, String code, Integer statusCode, String message, Long retryAfterMs) {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    public static ProviderError transientError(String code, Integer statusCode, String message) {
        return new ProviderError(Kind.TRANSIENT, code, statusCode, message, null);
    }

    public static ProviderError permanentError(String code, Integer statusCode, String message) {
        return new ProviderError(Kind.PERMANENT, code, statusCode, message, null);
    }

    public ProviderError withRetryAfter(Long millis) {
        return new ProviderError(kind, code, statusCode, message, millis);
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    /**
     * Diagnostic line with the code in front, e.g.
     * {@code [provider.rate_limit] HTTP 429: slow down}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder("[").append(code).append("]");
        if (statusCode != null) {
            sb.append(" HTTP ").append(statusCode).append(':');
        }
        if (message != null && !message.isBlank()) {
            sb.append(' ').append(message);
        }
        return sb.toString();
    }
}
