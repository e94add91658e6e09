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
import feign.FeignException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps backend exceptions to {@link ProviderError}s.
 *
 * <p>
 * langchain4j exceptions are recognized by class name so the classifier does
 * not depend on which of them a given langchain4j release ships. Feign
 * exceptions and plain I/O failures are recognized by type. When nothing
 * structured matches, the message is checked for well-known rate-limit and
 * context-overflow phrases.
 */
public final class ProviderErrorClassifier {

    public static final String RATE_LIMIT = "provider.rate_limit";
    public static final String TIMEOUT = "provider.timeout";
    public static final String SERVER_ERROR = "provider.server_error";
    public static final String NETWORK = "provider.network";
    public static final String AUTHENTICATION = "provider.authentication";
    public static final String INVALID_REQUEST = "provider.invalid_request";
    public static final String MODEL_NOT_FOUND = "provider.model_not_found";
    public static final String CONTENT_FILTERED = "provider.content_filtered";
    public static final String CONTEXT_LENGTH_EXCEEDED = "provider.context_length_exceeded";
    public static final String MALFORMED_RESPONSE = "provider.malformed_response";
    public static final String UNKNOWN = "provider.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"?reset_seconds\"?\\s*[:=]\\s*(\\d+)");
    private static final int MAX_MESSAGE_LENGTH = 500;

    private ProviderErrorClassifier() {
    }

    public static ProviderError classify(Throwable throwable) {
        if (throwable == null) {
            return ProviderError.permanentError(UNKNOWN, null, "unknown error");
        }
        ProviderError error = classifyChain(throwable);
        Long retryAfter = extractRetryAfterMs(throwable);
        return retryAfter != null ? error.withRetryAfter(retryAfter) : error;
    }

    /**
     * Classification by HTTP status alone.
     */
    public static ProviderError fromStatus(int status, String message) {
        String trimmed = truncate(message);
        if (status == 429) {
            return ProviderError.transientError(RATE_LIMIT, status, trimmed);
        }
        if (status == 408 || status == 504) {
            return ProviderError.transientError(TIMEOUT, status, trimmed);
        }
        if (status >= 500) {
            return ProviderError.transientError(SERVER_ERROR, status, trimmed);
        }
        if (status == 401 || status == 403) {
            return ProviderError.permanentError(AUTHENTICATION, status, trimmed);
        }
        if (status == 404) {
            return ProviderError.permanentError(MODEL_NOT_FOUND, status, trimmed);
        }
        if (status == 413 || isContextOverflow(message)) {
            return ProviderError.permanentError(CONTEXT_LENGTH_EXCEEDED, status, trimmed);
        }
        return ProviderError.permanentError(INVALID_REQUEST, status, trimmed);
    }

    private static ProviderError classifyChain(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            ProviderError byType = classifyKnownThrowable(current);
            if (byType != null) {
                return byType;
            }
            current = current.getCause();
        }

        current = throwable;
        visited.clear();
        while (current != null && visited.add(current)) {
            ProviderError byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != null) {
                return byMessage;
            }
            current = current.getCause();
        }
        return ProviderError.permanentError(UNKNOWN, null, truncate(describe(throwable)));
    }

    private static ProviderError classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof FeignException feignException && feignException.status() > 0) {
            return fromStatus(feignException.status(), bodyOrMessage(feignException));
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ProviderError.transientError(TIMEOUT, null, truncate(describe(throwable)));
        }

        String className = throwable.getClass().getName();
        if (className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return classifyLangchain4j(throwable, className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length()));
        }

        if (throwable instanceof InterruptedIOException) {
            return ProviderError.transientError(TIMEOUT, null, truncate(describe(throwable)));
        }
        if (throwable instanceof IOException) {
            // connection refused/reset, DNS hiccups
            return ProviderError.transientError(NETWORK, null, truncate(describe(throwable)));
        }
        return null;
    }

    private static ProviderError classifyLangchain4j(Throwable throwable, String simpleName) {
        String message = truncate(describe(throwable));
        return switch (simpleName) {
        case "RateLimitException" -> ProviderError.transientError(RATE_LIMIT, 429, message);
        case "TimeoutException" -> ProviderError.transientError(TIMEOUT, null, message);
        case "InternalServerException" -> ProviderError.transientError(SERVER_ERROR, null, message);
        case "RetriableException" -> ProviderError.transientError(SERVER_ERROR, null, message);
        case "AuthenticationException" -> ProviderError.permanentError(AUTHENTICATION, null, message);
        case "ModelNotFoundException" -> ProviderError.permanentError(MODEL_NOT_FOUND, null, message);
        case "ContentFilteredException" -> ProviderError.permanentError(CONTENT_FILTERED, null, message);
        case "InvalidRequestException" -> isContextOverflow(throwable.getMessage())
                ? ProviderError.permanentError(CONTEXT_LENGTH_EXCEEDED, 400, message)
                : ProviderError.permanentError(INVALID_REQUEST, 400, message);
        case "HttpException" -> {
            Integer status = readHttpStatusCode(throwable);
            yield status != null ? fromStatus(status, throwable.getMessage())
                    : ProviderError.permanentError(INVALID_REQUEST, null, message);
        }
        default -> null;
        };
    }

    private static ProviderError classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate_limit") || normalized.contains("rate limit")
                || normalized.contains("too many requests") || normalized.contains("token_quota_exceeded")
                || normalized.contains("too_many_tokens") || normalized.contains("model_cooldown")
                || normalized.contains("cooling down")) {
            return ProviderError.transientError(RATE_LIMIT, null, truncate(message));
        }
        if (normalized.contains("overloaded")) {
            return ProviderError.transientError(SERVER_ERROR, null, truncate(message));
        }
        if (isContextOverflow(message)) {
            return ProviderError.permanentError(CONTEXT_LENGTH_EXCEEDED, null, truncate(message));
        }
        return null;
    }

    static boolean isContextOverflow(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("context_length_exceeded")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long");
    }

    /**
     * Server requested delay: a {@code Retry-After} header in seconds, or a
     * {@code reset_seconds} field some proxies put in the error body.
     */
    static Long extractRetryAfterMs(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof FeignException feignException) {
                Long fromHeader = retryAfterHeader(feignException.responseHeaders());
                if (fromHeader != null) {
                    return fromHeader;
                }
            }
            String message = current.getMessage();
            if (message != null && message.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(message);
                if (matcher.find()) {
                    Long fromBody = resetSecondsToMs(matcher.group(1));
                    if (fromBody != null) {
                        return fromBody;
                    }
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static Long resetSecondsToMs(String seconds) {
        try {
            long value = Long.parseLong(seconds);
            return value > Long.MAX_VALUE / 1000 ? Long.MAX_VALUE : value * 1000;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long retryAfterHeader(Map<String, Collection<String>> headers) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, Collection<String>> entry : headers.entrySet()) {
            if (!"retry-after".equalsIgnoreCase(entry.getKey()) || entry.getValue() == null) {
                continue;
            }
            for (String value : entry.getValue()) {
                try {
                    return (long) (Double.parseDouble(value.trim()) * 1000);
                } catch (NumberFormatException ignored) {
                    // HTTP-date form is not used by the backends we talk to
                }
            }
        }
        return null;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String bodyOrMessage(FeignException e) {
        String body = e.contentUTF8();
        return body != null && !body.isBlank() ? body : e.getMessage();
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
