package me.golemcore.kernel.domain.model;

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

import java.util.List;
import java.util.Set;

/**
 * Declarative definition of an agent: identity, model selection, resource
 * limits and capabilities. Produced only by the manifest verifier, so every
 * instance has passed syntactic validation.
 *
 * <p>
 * {@code skills} and {@code mcpServers} are allowlists where an empty list
 * means every installed entry is permitted. {@code sourceText} holds the exact
 * TOML the manifest was parsed from.
 */
@Value
@Builder(toBuilder = true)
public class AgentManifest {

    String name;
    String version;
    String description;
    String author;
    String module;

    @Singular
    List<String> tags;

    @Singular
    List<String> skills;

    @Singular
    List<String> mcpServers;

    ModelConfig model;
    ResourceLimits resources;
    Capabilities capabilities;

    String sourceText;

    /**
     * Model selection block ({@code [model]}).
     */
    @Value
    @Builder
    public static class ModelConfig {
        String provider;
        String model;
        long maxTokens;
        double temperature;
        String systemPrompt;
    }

    /**
     * Resource limits block ({@code [resources]}).
     */
    @Value
    @Builder
    public static class ResourceLimits {
        long maxLlmTokensPerHour;
        int maxConcurrentTools;
    }

    /**
     * Capability block ({@code [capabilities]}).
     */
    @Value
    @Builder
    public static class Capabilities {

        public static final String WILDCARD = "*";

        @Singular
        Set<String> tools;

        @Singular("memoryReadPattern")
        List<String> memoryRead;

        @Singular("memoryWritePattern")
        List<String> memoryWrite;

        public boolean allowsAllTools() {
            return tools.contains(WILDCARD);
        }
    }
}
