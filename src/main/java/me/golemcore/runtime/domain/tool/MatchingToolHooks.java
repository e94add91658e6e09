package me.golemcore.runtime.domain.tool;

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
import me.golemcore.runtime.port.outbound.ToolHookPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hook chain that runs each registered hook whose {@link HookMatcher} accepts
 * the tool name, in registration order.
 *
 * <p>
 * Rewrites compose: every pre-hook sees the input produced by the previous
 * one. The first refusal ends the chain. A failing hook is skipped with a
 * warning; {@link HookHaltException} is passed through.
 */
@Slf4j
public class MatchingToolHooks implements ToolHookPort {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public MatchingToolHooks register(String pattern, ToolHookPort hook) {
        registrations.add(new Registration(HookMatcher.of(pattern), hook));
        return this;
    }

    public int size() {
        return registrations.size();
    }

    @Override
    public HookDecision preToolUse(String toolName, Map<String, Object> input) {
        Map<String, Object> current = input;
        boolean rewritten = false;
        for (Registration registration : registrations) {
            if (!registration.matcher().matches(toolName)) {
                continue;
            }
            HookDecision decision;
            try {
                decision = registration.hook().preToolUse(toolName, current);
            } catch (HookHaltException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Hooks] Pre-hook {} failed for '{}': {}", registration.matcher(), toolName, e.getMessage());
                continue;
            }
            if (decision == null) {
                continue;
            }
            switch (decision.action()) {
            case REFUSE -> {
                return decision;
            }
            case REWRITE -> {
                current = decision.rewrittenInput();
                rewritten = true;
            }
            case PROCEED -> {
                // nothing to change
            }
            }
        }
        return rewritten ? HookDecision.rewrite(current) : HookDecision.proceed();
    }

    @Override
    public void postToolUse(String toolName, Map<String, Object> input, ToolResultBlock result) {
        for (Registration registration : registrations) {
            if (!registration.matcher().matches(toolName)) {
                continue;
            }
            try {
                registration.hook().postToolUse(toolName, input, result);
            } catch (HookHaltException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Hooks] Post-hook {} failed for '{}': {}", registration.matcher(), toolName,
                        e.getMessage());
            }
        }
    }

    private record Registration(HookMatcher matcher, ToolHookPort hook) {
    }
}
