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

import me.golemcore.runtime.domain.model.ContentBlock;
import me.golemcore.runtime.domain.model.ImageBlock;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolResultBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces large image payloads in a history that has already been sent with
 * {@code [image: <type>, N bytes]} placeholders. The message keeps its id;
 * only the image block changes.
 */
public class ImagePayloadCompactor {

    private final long thresholdBytes;

    public ImagePayloadCompactor(long thresholdBytes) {
        this.thresholdBytes = thresholdBytes;
    }

    /**
     * Rewrites {@code history} in place.
     *
     * @return number of images replaced
     */
    public int compact(List<Message> history) {
        if (thresholdBytes <= 0) {
            return 0;
        }
        int replaced = 0;
        for (int i = 0; i < history.size(); i++) {
            Message message = history.get(i);
            List<ContentBlock> blocks = new ArrayList<>(message.getContent().size());
            int before = replaced;
            for (ContentBlock block : message.getContent()) {
                if (block instanceof ImageBlock image && image.sizeBytes() > thresholdBytes) {
                    blocks.add(new TextBlock(image.placeholderText()));
                    replaced++;
                } else if (block instanceof ToolResultBlock result && hasLargeImage(result)) {
                    List<ContentBlock> resultContent = new ArrayList<>();
                    for (ContentBlock inner : result.content()) {
                        if (inner instanceof ImageBlock image && image.sizeBytes() > thresholdBytes) {
                            resultContent.add(new TextBlock(image.placeholderText()));
                            replaced++;
                        } else {
                            resultContent.add(inner);
                        }
                    }
                    blocks.add(new ToolResultBlock(result.toolUseId(), resultContent, result.isError()));
                } else {
                    blocks.add(block);
                }
            }
            if (replaced > before) {
                history.set(i, message.toBuilder().clearContent().content(blocks).build());
            }
        }
        return replaced;
    }

    private boolean hasLargeImage(ToolResultBlock result) {
        for (ContentBlock inner : result.content()) {
            if (inner instanceof ImageBlock image && image.sizeBytes() > thresholdBytes) {
                return true;
            }
        }
        return false;
    }
}
