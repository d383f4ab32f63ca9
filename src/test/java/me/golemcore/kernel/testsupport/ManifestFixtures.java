package me.golemcore.kernel.testsupport;

import me.golemcore.kernel.domain.model.AgentManifest;

import java.util.List;

/**
 * Manifest texts and objects shared by tests.
 */
public final class ManifestFixtures {

    public static final String CODER_TOML = """
            name = "coder"
            version = "1.2.0"
            description = "Writes code"
            module = "builtin:chat"
            tags = ["dev"]

            [model]
            provider = "anthropic"
            model = "claude"
            max_tokens = 2048
            temperature = 0.2

            [resources]
            max_llm_tokens_per_hour = 1000
            max_concurrent_tools = 2

            [capabilities]
            tools = ["file_read", "web_fetch"]
            memory_read = ["*"]
            memory_write = ["self.*"]
            """;

    public static final String MINIMAL_TOML = """
            name = "minimal"
            """;

    private ManifestFixtures() {
    }

    public static String named(String name) {
        return "name = \"" + name + "\"\n\n[capabilities]\ntools = [\"*\"]\nmemory_read = [\"*\"]\nmemory_write = [\"*\"]\n";
    }

    public static AgentManifest manifest(String name, List<String> tools, long tokensPerHour, int concurrentTools) {
        return AgentManifest.builder()
                .name(name)
                .version("0.1.0")
                .module("builtin:chat")
                .model(AgentManifest.ModelConfig.builder()
                        .provider("test")
                        .model("test-model")
                        .maxTokens(4096)
                        .temperature(0.7)
                        .build())
                .resources(AgentManifest.ResourceLimits.builder()
                        .maxLlmTokensPerHour(tokensPerHour)
                        .maxConcurrentTools(concurrentTools)
                        .build())
                .capabilities(AgentManifest.Capabilities.builder()
                        .tools(tools)
                        .memoryReadPattern("*")
                        .memoryWritePattern("self.*")
                        .build())
                .build();
    }

    public static AgentManifest manifest(String name) {
        return manifest(name, List.of("*"), 10_000, 4);
    }
}
