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
 * How the compaction pipeline shrinks history.
 */
public enum RetentionStrategy {
    /** Keep the last K messages, drop the rest. */
    PRESERVE_RECENT,
    /** Keep the last five plus earlier user turns and problem reports. */
    PRESERVE_IMPORTANT,
    /** Keep a recent slice verbatim and summarize the rest in one message. */
    SMART_COMPRESSION,
    /** Replace all history with a merged eight-section summary. */
    AUTO_COMPACT
}
