package me.golemcore.kernel.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.kernel.domain.model.AgentEntry;
import me.golemcore.kernel.domain.model.AgentId;
import me.golemcore.kernel.domain.model.AgentManifest;
import me.golemcore.kernel.domain.model.QuotaSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Agent view returned by the agents API. The manifest source text is not
 * included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDto {
    private String id;
    private String name;
    private String state;
    private String parentId;
    private List<String> children;
    private String version;
    private String module;
    private String description;
    private Set<String> tools;
    private List<String> memoryRead;
    private List<String> memoryWrite;
    private long maxLlmTokensPerHour;
    private int maxConcurrentTools;
    private Instant createdAt;
    private Instant lastActiveAt;
    private QuotaSnapshot quota;

    public static AgentDto from(AgentEntry entry, QuotaSnapshot quota) {
        AgentManifest manifest = entry.getManifest();
        AgentDtoBuilder builder = AgentDto.builder()
                .id(entry.getId().value())
                .name(entry.getName())
                .state(entry.getState().name())
                .parentId(entry.getParentId().map(AgentId::value).orElse(null))
                .children(entry.getChildren().stream().map(AgentId::value).toList())
                .createdAt(entry.getCreatedAt())
                .lastActiveAt(entry.getLastActiveAt())
                .quota(quota);
        if (manifest != null) {
            builder.version(manifest.getVersion())
                    .module(manifest.getModule())
                    .description(manifest.getDescription());
            if (manifest.getCapabilities() != null) {
                builder.tools(manifest.getCapabilities().getTools())
                        .memoryRead(manifest.getCapabilities().getMemoryRead())
                        .memoryWrite(manifest.getCapabilities().getMemoryWrite());
            }
            if (manifest.getResources() != null) {
                builder.maxLlmTokensPerHour(manifest.getResources().getMaxLlmTokensPerHour())
                        .maxConcurrentTools(manifest.getResources().getMaxConcurrentTools());
            }
        }
        return builder.build();
    }
}
