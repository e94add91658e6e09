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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tool-name pattern a hook is registered for.
 *
 * <p>
 * Supported forms: {@code *} (or blank) matches every tool, {@code Edit|Write}
 * matches any listed name, and each alternative may use {@code *} and
 * {@code ?} wildcards. Matching ignores case.
 */
public final class HookMatcher {

    private static final String MATCH_ALL = "*";

    private final String pattern;
    private final List<Pattern> alternatives;
    private final boolean matchAll;

    private HookMatcher(String pattern) {
        this.pattern = pattern;
        String trimmed = pattern == null ? "" : pattern.trim();
        this.matchAll = trimmed.isEmpty() || MATCH_ALL.equals(trimmed);
        this.alternatives = new ArrayList<>();
        if (!matchAll) {
            for (String part : trimmed.split("\\|")) {
                String alternative = part.trim();
                if (!alternative.isEmpty()) {
                    alternatives.add(Pattern.compile(globToRegex(alternative), Pattern.CASE_INSENSITIVE));
                }
            }
        }
    }

    public static HookMatcher of(String pattern) {
        return new HookMatcher(pattern);
    }

    public static HookMatcher all() {
        return new HookMatcher(MATCH_ALL);
    }

    public boolean matches(String toolName) {
        if (matchAll) {
            return true;
        }
        if (toolName == null) {
            return false;
        }
        for (Pattern alternative : alternatives) {
            if (alternative.matcher(toolName).matches()) {
                return true;
            }
        }
        return false;
    }

    public String getPattern() {
        return pattern;
    }

    private static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return "HookMatcher[" + pattern + "]";
    }
}
