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
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One link of the audit hash chain. Created once by the ledger and never
 * mutated.
 *
 * <p>
 * {@code tipHash} is SHA-256 over the previous entry's tip hash followed by
 * the canonical serialization of this entry without its hash.
 */
@Value
@Builder
@Jacksonized
public class AuditEntry {

    /** Agent column value for entries not tied to a specific agent. */
    public static final String SYSTEM_AGENT = "system";

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("action")
    AuditAction action;

    @JsonProperty("agent")
    String agent;

    @JsonProperty("detail")
    String detail;

    @JsonProperty("tip_hash")
    String tipHash;
}
