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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.ToolCapability;
import me.golemcore.runtime.domain.model.ToolDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Source of the tools visible to one agent loop.
 */
public interface ToolRegistry {

    List<ToolDescriptor> listTools();

    Optional<ToolComponent> findTool(String name);

    /**
     * View of this registry without tools carrying {@code capability}. Nested
     * loops receive {@code excluding(ToolCapability.AGENT)} so a sub-agent can
     * never reach another sub-agent.
     */
    default ToolRegistry excluding(ToolCapability capability) {
        ToolRegistry delegate = this;
        return new ToolRegistry() {
            @Override
            public List<ToolDescriptor> listTools() {
                return delegate.listTools().stream()
                        .filter(descriptor -> !descriptor.hasCapability(capability))
                        .toList();
            }

            @Override
            public Optional<ToolComponent> findTool(String name) {
                return delegate.findTool(name)
                        .filter(tool -> !tool.getDescriptor().hasCapability(capability));
            }
        };
    }
}
