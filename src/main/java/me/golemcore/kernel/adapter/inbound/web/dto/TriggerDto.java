package me.golemcore.kernel.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.kernel.domain.model.TriggerDefinition;
import me.golemcore.kernel.domain.model.TriggerPattern;

import java.time.Instant;

/**
 * Trigger view. Webhook tokens are never echoed back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerDto {

    private static final String MASK = "********";

    private String id;
    private String agentId;
    private String type;
    private String param;
    private String promptTemplate;
    private long maxFires;
    private long fireCount;
    private boolean enabled;
    private boolean exhausted;
    private Instant createdAt;
    private Instant lastFiredAt;
    private Instant nextFireAt;

    public static TriggerDto from(TriggerDefinition definition) {
        TriggerPattern pattern = definition.getPattern();
        TriggerPattern.Kind kind = pattern != null ? pattern.getKind() : null;
        String param = pattern != null ? pattern.getParam() : null;
        return TriggerDto.builder()
                .id(definition.getId())
                .agentId(definition.getAgentId())
                .type(kind != null ? kind.name() : null)
                .param(kind == TriggerPattern.Kind.WEBHOOK && param != null ? MASK : param)
                .promptTemplate(definition.getPromptTemplate())
                .maxFires(definition.getMaxFires())
                .fireCount(definition.getFireCount())
                .enabled(definition.isEnabled())
                .exhausted(definition.isExhausted())
                .createdAt(definition.getCreatedAt())
                .lastFiredAt(definition.getLastFiredAt())
                .nextFireAt(definition.getNextFireAt())
                .build();
    }
}
