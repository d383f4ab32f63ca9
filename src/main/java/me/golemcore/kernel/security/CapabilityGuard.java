package me.golemcore.kernel.security;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.exception.CapabilityDeniedException;
import me.golemcore.kernel.domain.model.AgentManifest;
import me.golemcore.kernel.domain.model.MemoryAccess;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Authorizes agent actions against the capabilities declared in the agent's
 * manifest and against the system-wide tool policy.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>Tools - permitted iff listed, or the tool set contains {@code *}. An
 * empty tool set denies every tool.</li>
 * <li>Memory - permitted iff the key matches one glob of the relevant set
 * ({@link MemoryKeyGlob}).</li>
 * <li>Skills and MCP servers - an empty allowlist permits all.</li>
 * </ul>
 *
 * <p>
 * Holds no mutable state; safe to call concurrently without locking.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapabilityGuard {

    private final KernelProperties properties;

    public void checkTool(AgentManifest manifest, String tool) {
        AgentManifest.Capabilities caps = manifest.getCapabilities();
        if (tool != null && caps != null
                && (caps.allowsAllTools() || caps.getTools().contains(tool))) {
            log.trace("[Capability] Tool allowed: agent={}, tool={}", manifest.getName(), tool);
            return;
        }
        log.warn("[Capability] Tool denied: agent={}, tool={}", manifest.getName(), tool);
        throw new CapabilityDeniedException(manifest.getName(), "tool:" + tool,
                "Tool '" + tool + "' is not granted to agent '" + manifest.getName() + "'");
    }

    public void checkMemory(AgentManifest manifest, MemoryAccess access, String key) {
        AgentManifest.Capabilities caps = manifest.getCapabilities();
        List<String> globs = caps == null ? List.of()
                : access == MemoryAccess.READ ? caps.getMemoryRead() : caps.getMemoryWrite();
        if (MemoryKeyGlob.matchesAny(globs, key)) {
            log.trace("[Capability] Memory {} allowed: agent={}", access, manifest.getName());
            return;
        }
        String kind = access.name().toLowerCase(Locale.ROOT);
        log.warn("[Capability] Memory {} denied: agent={}", kind, manifest.getName());
        throw new CapabilityDeniedException(manifest.getName(), "memory_" + kind,
                "Memory " + kind + " is not granted to agent '" + manifest.getName() + "' for this key");
    }

    public void checkSkill(AgentManifest manifest, String skill) {
        List<String> allowed = manifest.getSkills();
        if (allowed.isEmpty() || allowed.contains(skill)) {
            return;
        }
        log.warn("[Capability] Skill denied: agent={}, skill={}", manifest.getName(), skill);
        throw new CapabilityDeniedException(manifest.getName(), "skill:" + skill,
                "Skill '" + skill + "' is not granted to agent '" + manifest.getName() + "'");
    }

    public void checkMcpServer(AgentManifest manifest, String server) {
        List<String> allowed = manifest.getMcpServers();
        if (allowed.isEmpty() || allowed.contains(server)) {
            return;
        }
        log.warn("[Capability] MCP server denied: agent={}, server={}", manifest.getName(), server);
        throw new CapabilityDeniedException(manifest.getName(), "mcp:" + server,
                "MCP server '" + server + "' is not granted to agent '" + manifest.getName() + "'");
    }

    /**
     * Validates the capabilities a manifest declares against system policy
     * ({@code kernel.capabilities.*}).
     */
    public void checkPolicy(AgentManifest manifest) {
        KernelProperties.CapabilityPolicyProperties policy = properties.getCapabilities();
        Set<String> declared = manifest.getCapabilities() != null ? manifest.getCapabilities().getTools() : Set.of();

        for (String tool : declared) {
            if (AgentManifest.Capabilities.WILDCARD.equals(tool)) {
                if (!policy.isAllowWildcardTools()) {
                    throw policyViolation(manifest, tool, "Wildcard tool grants are disabled by policy");
                }
                continue;
            }
            if (policy.getDeniedTools().contains(tool)) {
                throw policyViolation(manifest, tool, "Tool '" + tool + "' is denied by policy");
            }
            if (!policy.getAllowedTools().isEmpty() && !policy.getAllowedTools().contains(tool)) {
                throw policyViolation(manifest, tool, "Tool '" + tool + "' is not in the allowed tool list");
            }
        }
    }

    private CapabilityDeniedException policyViolation(AgentManifest manifest, String tool, String message) {
        log.warn("[Capability] Policy violation: agent={}, tool={}", manifest.getName(), tool);
        return new CapabilityDeniedException(manifest.getName(), "tool:" + tool, message);
    }
}
