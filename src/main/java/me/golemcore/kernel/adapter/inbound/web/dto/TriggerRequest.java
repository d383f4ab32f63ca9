package me.golemcore.kernel.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerRequest {
    private String agentId;
    /** Pattern kind, e.g. {@code ContentMatch} or {@code CONTENT_MATCH}. */
    private String type;
    private String param;
    private String promptTemplate;
    private long maxFires;
}
