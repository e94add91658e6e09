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
 * Inline image, base64 encoded.
 */
public record ImageBlock(String mediaType, String base64Data) implements ContentBlock {

    public ImageBlock {
        Objects.requireNonNull(mediaType, "mediaType");
        base64Data = Objects.requireNonNullElse(base64Data, "");
    }

    /**
     * Decoded payload size, derived from the base64 length.
     */
    public long sizeBytes() {
        int len = base64Data.length();
        int padding = 0;
        if (len > 0 && base64Data.charAt(len - 1) == '=') {
            padding++;
            if (len > 1 && base64Data.charAt(len - 2) == '=') {
                padding++;
            }
        }
        return (long) len * 3 / 4 - padding;
    }

    public String placeholderText() {
        return "[image: " + mediaType + ", " + sizeBytes() + " bytes]";
    }

    @Override
    public BlockType type() {
        return BlockType.IMAGE;
    }
}
