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

/**
 * Terminal signal of {@link AgentLoop#stream} for runs that did not end in
 * {@link AgentOutcome#DONE}. The full result, outcome included, is attached.
 */
public class AgentRunException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient AgentRunResult result;

    public AgentRunException(AgentRunResult result) {
        super(describe(result), result.getError());
        this.result = result;
    }

    public AgentRunResult getResult() {
        return result;
    }

    public AgentOutcome getOutcome() {
        return result.getOutcome();
    }

    private static String describe(AgentRunResult result) {
        if (result.getOutcome() == AgentOutcome.CANCELLED) {
            return "Agent run cancelled";
        }
        return "Agent run failed: [" + result.getErrorCode() + "] " + result.getErrorMessage();
    }
}
