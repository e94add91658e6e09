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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Parses tool-call arguments returned by a model, repairing the malformations
 * models commonly produce.
 *
 * <p>
 * Strict parsing runs first. On failure a fixed sequence of repairs is applied
 * cumulatively, re-parsing after each one:
 * <ol>
 * <li>keep only the outermost {@code {...}} (drops prose and code fences)</li>
 * <li>escape raw control characters inside strings, drop them outside</li>
 * <li>Python literals {@code True}, {@code False}, {@code None}</li>
 * <li>single-quoted strings to double-quoted</li>
 * <li>escape unescaped double quotes inside strings</li>
 * <li>remove trailing commas</li>
 * <li>close an unterminated string and unbalanced brackets</li>
 * </ol>
 * If every step fails the call is reported as unparseable and the arguments
 * are empty.
 */
@Slf4j
public class ToolArgumentRepairer {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final List<UnaryOperator<String>> repairs = List.of(
            ToolArgumentRepairer::extractOutermostObject,
            ToolArgumentRepairer::escapeControlCharacters,
            ToolArgumentRepairer::replacePythonLiterals,
            ToolArgumentRepairer::singleToDoubleQuotes,
            ToolArgumentRepairer::escapeInnerQuotes,
            ToolArgumentRepairer::removeTrailingCommas,
            ToolArgumentRepairer::balance);

    public ToolArgumentRepairer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Outcome parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Outcome.parsed(Map.of(), false);
        }

        String firstError;
        try {
            return Outcome.parsed(readObject(raw), false);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            firstError = shortMessage(e);
        }

        String candidate = raw;
        for (UnaryOperator<String> repair : repairs) {
            candidate = repair.apply(candidate);
            try {
                Map<String, Object> args = readObject(candidate);
                log.debug("[ToolArgs] Repaired malformed arguments ({} chars)", raw.length());
                return Outcome.parsed(args, true);
            } catch (JsonProcessingException | IllegalArgumentException ignored) {
                // next repair
            }
        }

        log.warn("[ToolArgs] Unparseable tool arguments: {}", firstError);
        return Outcome.failed("Could not parse tool arguments as JSON: " + firstError);
    }

    private Map<String, Object> readObject(String json) throws JsonProcessingException {
        JsonNode node = strictReader.readTree(json);
        if (node != null && node.isTextual()) {
            // double-encoded: "{\"a\":1}"
            node = strictReader.readTree(node.asText());
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("arguments must be a JSON object");
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    // ==================== REPAIRS ====================

    static String extractOutermostObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return text;
        }
        int end = text.lastIndexOf('}');
        return end > start ? text.substring(start, end + 1) : text.substring(start);
    }

    static String escapeControlCharacters(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                    sb.append(c);
                } else if (c == '\\') {
                    escaped = true;
                    sb.append(c);
                } else if (c == '"') {
                    inString = false;
                    sb.append(c);
                } else if (c == '\n') {
                    sb.append("\\n");
                } else if (c == '\t') {
                    sb.append("\\t");
                } else if (c == '\r') {
                    sb.append("\\r");
                } else if (c >= 0x20) {
                    sb.append(c);
                }
            } else {
                if (c == '"') {
                    inString = true;
                }
                if (c >= 0x20 || c == '\n' || c == '\t' || c == '\r') {
                    sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    static String replacePythonLiterals(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        char quote = 0;
        boolean escaped = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                sb.append(c);
                i++;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                sb.append(c);
                i++;
                continue;
            }
            if (Character.isLetter(c) && (i == 0 || !Character.isLetterOrDigit(text.charAt(i - 1)))) {
                int end = i;
                while (end < text.length() && Character.isLetterOrDigit(text.charAt(end))) {
                    end++;
                }
                String word = text.substring(i, end);
                sb.append(switch (word) {
                case "True" -> "true";
                case "False" -> "false";
                case "None" -> "null";
                default -> word;
                });
                i = end;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    static String singleToDoubleQuotes(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inDouble = false;
        boolean inSingle = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inDouble) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inDouble = false;
                }
                sb.append(c);
            } else if (inSingle) {
                if (escaped) {
                    escaped = false;
                    sb.append(c == '\'' ? "'" : "\\" + c);
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    sb.append("\\\"");
                } else if (c == '\'' && closesString(text, i + 1)) {
                    inSingle = false;
                    sb.append('"');
                } else {
                    sb.append(c);
                }
            } else if (c == '"') {
                inDouble = true;
                sb.append(c);
            } else if (c == '\'') {
                inSingle = true;
                sb.append('"');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeInnerQuotes(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!inString) {
                if (c == '"') {
                    inString = true;
                }
                sb.append(c);
            } else if (escaped) {
                escaped = false;
                sb.append(c);
            } else if (c == '\\') {
                escaped = true;
                sb.append(c);
            } else if (c == '"') {
                if (closesString(text, i + 1)) {
                    inString = false;
                    sb.append(c);
                } else {
                    sb.append("\\\"");
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String removeTrailingCommas(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                sb.append(c);
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == ',') {
                int next = nextNonWhitespace(text, i + 1);
                if (next < 0 || text.charAt(next) == '}' || text.charAt(next) == ']') {
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    static String balance(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                sb.append(c);
                continue;
            }
            switch (c) {
            case '"' -> inString = true;
            case '{' -> open.push('}');
            case '[' -> open.push(']');
            case '}', ']' -> {
                if (open.isEmpty() || open.peek() != c) {
                    continue;
                }
                open.pop();
            }
            default -> {
                // plain character
            }
            }
            sb.append(c);
        }
        if (inString) {
            if (escaped) {
                sb.setLength(sb.length() - 1);
            }
            sb.append('"');
        }
        String trimmed = sb.toString().stripTrailing();
        sb.setLength(0);
        sb.append(trimmed);
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ',') {
            sb.setLength(sb.length() - 1);
        }
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ':') {
            sb.append("null");
        }
        while (!open.isEmpty()) {
            sb.append(open.pop());
        }
        return sb.toString();
    }

    /**
     * True when the quote just before {@code index} is a closing one: the
     * next non-blank character is structural or the text ends.
     */
    private static boolean closesString(String text, int index) {
        int next = nextNonWhitespace(text, index);
        if (next < 0) {
            return true;
        }
        char c = text.charAt(next);
        return c == ',' || c == ':' || c == '}' || c == ']';
    }

    private static int nextNonWhitespace(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static String shortMessage(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return e.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }

    /**
     * Parsed arguments or the reason they could not be parsed.
     */
    public record Outcome(Map<String, Object> arguments, boolean repaired, String error) {

        static Outcome parsed(Map<String, Object> arguments, boolean repaired) {
            return new Outcome(arguments, repaired, null);
        }

        static Outcome failed(String error) {
            return new Outcome(Map.of(), false, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
