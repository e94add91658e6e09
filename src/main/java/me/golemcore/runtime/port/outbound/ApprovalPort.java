package me.golemcore.runtime.port.outbound;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Interactive approval for tool calls whose permission check answered
 * {@code ASK}. Implemented by whatever front end hosts the runtime.
 */
public interface ApprovalPort {

    /**
     * @return future completing with {@code true} when the user approves
     */
    CompletableFuture<Boolean> requestApproval(String toolName, Map<String, Object> input);

    /**
     * Whether someone is there to answer. When not, {@code ASK} is treated as
     * {@code DENY}.
     */
    boolean isAvailable();
}
