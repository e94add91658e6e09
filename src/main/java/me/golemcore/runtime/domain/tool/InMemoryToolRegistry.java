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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.port.outbound.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry backed by tool components known at composition time. Tools can be
 * added and removed later; listing order is registration order.
 */
@Slf4j
public class InMemoryToolRegistry implements ToolRegistry {

    private final Map<String, ToolComponent> toolsByName = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    public InMemoryToolRegistry(Collection<? extends ToolComponent> tools) {
        if (tools != null) {
            tools.forEach(this::registerTool);
        }
    }

    public final void registerTool(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            log.warn("[Tools] Skipping tool without a name: {}", tool.getClass().getSimpleName());
            return;
        }
        if (toolsByName.put(name, tool) == null) {
            order.add(name);
        }
    }

    public void unregisterTools(Collection<String> names) {
        if (names == null) {
            return;
        }
        for (String name : names) {
            toolsByName.remove(name);
            order.remove(name);
        }
        log.debug("[Tools] Unregistered tools: {}", names);
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return order.stream()
                .map(toolsByName::get)
                .filter(tool -> tool != null)
                .map(ToolComponent::getDescriptor)
                .toList();
    }

    @Override
    public Optional<ToolComponent> findTool(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(toolsByName.get(name));
    }
}
