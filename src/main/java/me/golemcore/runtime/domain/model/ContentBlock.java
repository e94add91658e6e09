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

/**
 * One ordered unit of message content.
 *
 * <p>
 * Implementations are {@link TextBlock}, {@link ToolUseBlock},
 * {@link ToolResultBlock}, {@link ImageBlock} and {@link DocumentBlock}. Code
 * that consumes blocks switches on {@link #type()} and casts, so adding a kind
 * means adding a {@link BlockType} constant and letting the compiler point at
 * every switch.
 */
public interface ContentBlock {

    BlockType type();
}
