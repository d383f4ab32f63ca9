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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A standing rule that converts a matched event into an action for its owning
 * agent. Persisted in {@code triggers/triggers.json}.
 *
 * <p>
 * {@code fireCount} is the only field mutated after creation by the event
 * path, and only by the trigger scheduler while holding the trigger's lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TriggerDefinition {

    private String id;
    private String agentId;
    private TriggerPattern pattern;
    private String promptTemplate;

    /** 0 means unlimited. */
    private long maxFires;

    private long fireCount;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;
    private Instant lastFiredAt;

    /** Next cron boundary, only for SCHEDULE patterns. */
    private Instant nextFireAt;

    @JsonIgnore
    public boolean isExhausted() {
        return maxFires > 0 && fireCount >= maxFires;
    }
}
