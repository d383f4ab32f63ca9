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
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a live agent as seen by registry readers.
 *
 * <p>
 * Parent and children are ids only; a child may outlive its parent, in which
 * case its parent is cleared, and a parent id may resolve to nothing.
 */
@Value
@Builder(toBuilder = true)
public class AgentEntry {

    AgentId id;
    String name;
    AgentManifest manifest;
    AgentState state;
    AgentId parent;
    List<AgentId> children;
    Instant createdAt;
    Instant lastActiveAt;

    public Optional<AgentId> getParentId() {
        return Optional.ofNullable(parent);
    }

    public boolean isRunning() {
        return state == AgentState.RUNNING;
    }
}
