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

import java.util.Locale;

/**
 * Why the provider stopped generating. Wire values differ per backend and are
 * normalized through {@link #fromWire(String)}.
 */
public enum StopReason {
    END_TURN,
    TOOL_USE,
    MAX_TOKENS,
    STOP_SEQUENCE,
    CONTENT_FILTER,
    UNKNOWN;

    public static StopReason fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
        case "stop", "end_turn" -> END_TURN;
        case "tool_calls", "tool_use", "tool_execution", "function_call" -> TOOL_USE;
        case "length", "max_tokens" -> MAX_TOKENS;
        case "stop_sequence" -> STOP_SEQUENCE;
        case "content_filter", "refusal" -> CONTENT_FILTER;
        default -> UNKNOWN;
        };
    }
}
