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

import me.golemcore.runtime.domain.model.HookDecision;
import me.golemcore.runtime.domain.model.ToolResultBlock;

import java.util.Map;

/**
 * Pre/post execution hooks around each tool call.
 *
 * <p>
 * A hook that throws is logged and ignored, unless it throws
 * {@link me.golemcore.runtime.domain.tool.HookHaltException}, which stops the
 * whole turn.
 */
public interface ToolHookPort {

    default HookDecision preToolUse(String toolName, Map<String, Object> input) {
        return HookDecision.proceed();
    }

    /**
     * Observes the final result. The result cannot be changed here.
     */
    default void postToolUse(String toolName, Map<String, Object> input, ToolResultBlock result) {
    }
}
