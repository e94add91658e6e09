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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Tool declaration sent to the model: name, description and a JSON-Schema-like
 * input schema ({@code type: object}, {@code properties}, {@code required}),
 * plus the capabilities the runtime uses for gating.
 */
@Value
@Builder
public class ToolDescriptor {

    String name;
    String description;
    Map<String, Object> inputSchema;
    @Singular
    Set<ToolCapability> capabilities;

    public boolean hasCapability(ToolCapability capability) {
        return capabilities.contains(capability);
    }

    public boolean isReadOnly() {
        return hasCapability(ToolCapability.READ_ONLY) && !hasCapability(ToolCapability.MUTATING);
    }
}
