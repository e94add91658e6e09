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

/**
 * Answer of a pre-tool-use hook: run as requested, run with rewritten input,
 * or refuse with a reason that is returned to the model as an error result.
 */
public record HookDecision(Action action, Map<String, Object> rewrittenInput, String reason) {

    public enum Action {
        PROCEED,
        REWRITE,
        REFUSE
    }

    private static final HookDecision PROCEED = new HookDecision(Action.PROCEED, null, null);

    public static HookDecision proceed() {
        return PROCEED;
    }

    public static HookDecision rewrite(Map<String, Object> input) {
        return new HookDecision(Action.REWRITE,
                Collections.unmodifiableMap(new LinkedHashMap<>(input)), null);
    }

    public static HookDecision refuse(String reason) {
        return new HookDecision(Action.REFUSE, null, reason);
    }
}
