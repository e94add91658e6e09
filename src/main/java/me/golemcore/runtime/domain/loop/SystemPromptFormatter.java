package me.golemcore.runtime.domain.loop;

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

import java.util.List;
import java.util.Map;

/**
 * Fills {@code {{key}}} placeholders of a system prompt from a context map
 * (working directory, date, git status and the like). Unknown placeholders
 * are left untouched.
 */
public final class SystemPromptFormatter {

    private static final String SECTION_SEPARATOR = "\n\n";

    private SystemPromptFormatter() {
    }

    public static String format(String template, Map<String, String> context) {
        if (template == null || context == null || context.isEmpty() || !template.contains("{{")) {
            return template;
        }
        String formatted = template;
        for (Map.Entry<String, String> entry : context.entrySet()) {
            String value = entry.getValue() != null ? entry.getValue() : "";
            formatted = formatted.replace("{{" + entry.getKey() + "}}", value);
        }
        return formatted;
    }

    /**
     * Formats every section and joins them with blank lines.
     */
    public static String format(List<String> sections, Map<String, String> context) {
        StringBuilder sb = new StringBuilder();
        for (String section : sections) {
            String formatted = format(section, context);
            if (formatted == null || formatted.isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(SECTION_SEPARATOR);
            }
            sb.append(formatted);
        }
        return sb.toString();
    }
}
