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

import java.util.List;
import java.util.Objects;

/**
 * Response to one {@link ToolUseBlock}, referenced by id.
 */
public record ToolResultBlock(String toolUseId, List<ContentBlock> content, boolean isError)
        implements ContentBlock {

    public ToolResultBlock {
        Objects.requireNonNull(toolUseId, "toolUseId");
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ToolResultBlock text(String toolUseId, String text, boolean isError) {
        return new ToolResultBlock(toolUseId, List.of(new TextBlock(text)), isError);
    }

    /**
     * Concatenated text of the result, with images and documents rendered as
     * short markers.
     */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : content) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            switch (block.type()) {
            case TEXT -> sb.append(((TextBlock) block).text());
            case IMAGE -> sb.append(((ImageBlock) block).placeholderText());
            case DOCUMENT -> sb.append(((DocumentBlock) block).placeholderText());
            case TOOL_USE, TOOL_RESULT -> {
                // nested tool blocks are not meaningful inside a result
            }
            }
        }
        return sb.toString();
    }

    @Override
    public BlockType type() {
        return BlockType.TOOL_RESULT;
    }
}
