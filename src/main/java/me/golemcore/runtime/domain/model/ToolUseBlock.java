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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A model request to invoke a named tool.
 *
 * <p>
 * {@code inputError} is set when the provider returned arguments that could not
 * be parsed even after repair. Such a block still gets a tool result (an error
 * one) so the conversation stays well formed.
 */
public record ToolUseBlock(String id, String name, Map<String, Object> input, String inputError)
        implements ContentBlock {

    public ToolUseBlock {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    public ToolUseBlock(String id, String name, Map<String, Object> input) {
        this(id, name, input, null);
    }

    public boolean hasInputError() {
        return inputError != null;
    }

    public ToolUseBlock withInput(Map<String, Object> newInput) {
        return new ToolUseBlock(id, name, newInput, inputError);
    }

    @Override
    public BlockType type() {
        return BlockType.TOOL_USE;
    }
}
