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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Operator-facing summary of the kernel.
 */
@Value
@Builder
public class KernelStatus {

    @JsonProperty("halted")
    boolean halted;

    @JsonProperty("halt_reason")
    String haltReason;

    @JsonProperty("halted_at")
    Instant haltedAt;

    @JsonProperty("agents")
    int agents;

    @JsonProperty("triggers")
    int triggers;

    @JsonProperty("audit_entries")
    long auditEntries;

    @JsonProperty("audit_tip_hash")
    String auditTipHash;
}
