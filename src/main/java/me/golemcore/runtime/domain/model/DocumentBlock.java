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

import java.util.Objects;

/**
 * Attached document. Text documents carry their content in {@code data};
 * binary ones carry base64.
 */
public record DocumentBlock(String mediaType, String title, String data) implements ContentBlock {

    public DocumentBlock {
        Objects.requireNonNull(mediaType, "mediaType");
        data = Objects.requireNonNullElse(data, "");
    }

    public boolean isText() {
        return mediaType.startsWith("text/");
    }

    public String placeholderText() {
        return "[document: " + (title != null ? title : mediaType) + ", " + data.length() + " chars]";
    }

    /**
     * Form sent to backends: text documents inline, binary ones as a marker.
     */
    public String promptText() {
        if (!isText()) {
            return placeholderText();
        }
        String name = title != null ? title : "document";
        return "<document title=\"" + name + "\">\n" + data + "\n</document>";
    }

    @Override
    public BlockType type() {
        return BlockType.DOCUMENT;
    }
}
