package me.golemcore.runtime.domain.tool;

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

import java.util.Map;

/**
 * Caps tool output before it enters the conversation.
 *
 * <p>
 * Each tool has a token ceiling (a default plus per-tool overrides), converted
 * to characters. Oversized output is cut at a line boundary within 90% of the
 * budget, leaving room for a marker that states the original size and the
 * fraction shown. Output without usable line breaks is cut on a character
 * boundary that never splits a surrogate pair.
 */
@Slf4j
public class ToolOutputLimiter {

    private static final double KEEP_RATIO = 0.9;

    private final int defaultMaxTokens;
    private final Map<String, Integer> perToolMaxTokens;
    private final double charsPerToken;

    public ToolOutputLimiter(int defaultMaxTokens, Map<String, Integer> perToolMaxTokens, double charsPerToken) {
        this.defaultMaxTokens = defaultMaxTokens;
        this.perToolMaxTokens = perToolMaxTokens != null ? Map.copyOf(perToolMaxTokens) : Map.of();
        this.charsPerToken = charsPerToken;
    }

    public int maxCharsFor(String toolName) {
        int tokens = perToolMaxTokens.getOrDefault(toolName, defaultMaxTokens);
        return (int) Math.min(Integer.MAX_VALUE, Math.round(tokens * charsPerToken));
    }

    public String limit(String toolName, String output) {
        if (output == null) {
            return null;
        }
        int maxChars = maxCharsFor(toolName);
        String limited = truncateLines(output, maxChars);
        if (!limited.equals(output)) {
            log.warn("[ToolExecutor] Truncated '{}' output: {} chars over a {} char ceiling", toolName,
                    output.length(), maxChars);
        }
        return limited;
    }

    /**
     * Cuts {@code output} to roughly {@code maxChars} and appends a marker. Returns the
     * input unchanged when it already fits or the ceiling is not positive.
     */
    public static String truncateLines(String output, int maxChars) {
        if (output == null || maxChars <= 0 || output.length() <= maxChars) {
            return output;
        }

        int budget = (int) (maxChars * KEEP_RATIO);
        String[] lines = output.split("\n", -1);
        StringBuilder kept = new StringBuilder();
        int keptLines = 0;
        for (String line : lines) {
            int needed = line.length() + (keptLines > 0 ? 1 : 0);
            if (kept.length() + needed > budget) {
                break;
            }
            if (keptLines > 0) {
                kept.append('\n');
            }
            kept.append(line);
            keptLines++;
        }

        if (keptLines == 0) {
            int cut = budget;
            if (cut > 0 && Character.isHighSurrogate(output.charAt(cut - 1))) {
                cut--;
            }
            kept.append(output, 0, cut);
        }

        int shown = kept.length();
        long percent = Math.round(shown * 100.0 / output.length());
        String marker = keptLines > 0
                ? "[OUTPUT TRUNCATED: showing " + keptLines + " of " + lines.length + " lines, "
                        + shown + " of " + output.length() + " chars (" + percent + "%)]"
                : "[OUTPUT TRUNCATED: showing " + shown + " of " + output.length() + " chars ("
                        + percent + "%)]";
        return kept + "\n\n" + marker;
    }
}
