package me.golemcore.kernel.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpawnAgentRequest {
    private String manifestToml;
    /** JSON signed-manifest envelope, as a string. */
    private String signedManifest;
    private String parentId;
}
