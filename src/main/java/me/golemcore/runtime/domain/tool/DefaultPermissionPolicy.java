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

import me.golemcore.runtime.domain.model.PermissionDecision;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.port.outbound.PermissionPort;
import me.golemcore.runtime.port.outbound.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Permission gate driven by configuration.
 *
 * <p>
 * Disabled tools are always denied. Otherwise, with permissions skipped
 * everything is allowed; read-only tools and explicitly auto-approved tools
 * are allowed; any other tool needs approval ({@code ASK}).
 */
@Slf4j
public class DefaultPermissionPolicy implements PermissionPort {

    private final ToolRegistry toolRegistry;
    private final Set<String> disabledTools;
    private final Set<String> autoApprovedTools;
    private final boolean skipPermissions;

    public DefaultPermissionPolicy(ToolRegistry toolRegistry, Set<String> disabledTools,
            Set<String> autoApprovedTools, boolean skipPermissions) {
        this.toolRegistry = toolRegistry;
        this.disabledTools = disabledTools != null ? Set.copyOf(disabledTools) : Set.of();
        this.autoApprovedTools = autoApprovedTools != null ? Set.copyOf(autoApprovedTools) : Set.of();
        this.skipPermissions = skipPermissions;
    }

    @Override
    public PermissionDecision checkPermission(String toolName, Map<String, Object> input) {
        if (disabledTools.contains(toolName)) {
            log.debug("[Permissions] '{}' is disabled", toolName);
            return PermissionDecision.DENY;
        }
        if (skipPermissions || autoApprovedTools.contains(toolName)) {
            return PermissionDecision.ALLOW;
        }
        Optional<ToolDescriptor> descriptor = toolRegistry.listTools().stream()
                .filter(tool -> tool.getName().equals(toolName))
                .findFirst();
        if (descriptor.isPresent() && descriptor.get().isReadOnly()) {
            return PermissionDecision.ALLOW;
        }
        return PermissionDecision.ASK;
    }

    public boolean isToolEnabled(String toolName) {
        return !disabledTools.contains(toolName);
    }
}
