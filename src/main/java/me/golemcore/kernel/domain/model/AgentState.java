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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of an agent.
 *
 * <p>
 * Allowed transitions:
 * <ul>
 * <li>SPAWNING → RUNNING</li>
 * <li>RUNNING → PAUSED, ERRORED, KILLED</li>
 * <li>PAUSED → RUNNING, KILLED</li>
 * <li>ERRORED → RUNNING (recovery), KILLED</li>
 * </ul>
 * KILLED is terminal.
 */
public enum AgentState {

    SPAWNING, RUNNING, PAUSED, KILLED, ERRORED;

    private Set<AgentState> successors() {
        return switch (this) {
        case SPAWNING -> EnumSet.of(RUNNING);
        case RUNNING -> EnumSet.of(PAUSED, ERRORED, KILLED);
        case PAUSED -> EnumSet.of(RUNNING, KILLED);
        case ERRORED -> EnumSet.of(RUNNING, KILLED);
        case KILLED -> EnumSet.noneOf(AgentState.class);
        };
    }

    public boolean canTransitionTo(AgentState target) {
        return target != null && successors().contains(target);
    }
}
