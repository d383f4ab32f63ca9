package me.golemcore.kernel.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kernel configuration bound from {@code application.properties} under the
 * {@code kernel.*} prefix.
 *
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link QuotaProperties} - token window</li>
 * <li>{@link CapabilityPolicyProperties} - system-wide tool policy</li>
 * <li>{@link SigningProperties} - trusted manifest signers</li>
 * <li>{@link TriggerProperties} - trigger ticks and content limits</li>
 * <li>{@link AuditProperties} - ledger file location</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "kernel")
@Data
public class KernelProperties {

    private StorageProperties storage = new StorageProperties();
    private QuotaProperties quota = new QuotaProperties();
    private CapabilityPolicyProperties capabilities = new CapabilityPolicyProperties();
    private SigningProperties signing = new SigningProperties();
    private TriggerProperties triggers = new TriggerProperties();
    private AuditProperties audit = new AuditProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/kernel";
    }

    @Data
    public static class QuotaProperties {
        private Duration tokenWindow = Duration.ofHours(1);
    }

    @Data
    public static class CapabilityPolicyProperties {
        /** Empty means any syntactically valid tool name may be declared. */
        private List<String> allowedTools = new ArrayList<>();
        private List<String> deniedTools = new ArrayList<>();
        private boolean allowWildcardTools = true;
    }

    @Data
    public static class SigningProperties {
        private boolean requireSignature = false;

        /** Signer key id to Base64 raw Ed25519 public key. */
        private Map<String, String> trustedKeys = new LinkedHashMap<>();
    }

    @Data
    public static class TriggerProperties {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(1);
        private int maxContentLength = 4000;
        private String directory = "triggers";
        private String file = "triggers.json";
    }

    @Data
    public static class AuditProperties {
        private String directory = "audit";
        private String file = "ledger.jsonl";
    }

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
    }
}
