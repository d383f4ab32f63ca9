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

import java.time.Instant;

/**
 * An action emitted by a fired trigger: deliver {@code prompt} to the owning
 * agent. Executing it goes through the same authorization and quota checks as
 * any other agent action.
 */
public record FiredAction(
        String triggerId,
        AgentId agentId,
        String prompt,
        long fireNumber,
        KernelEvent.Type eventType,
        Instant firedAt) {
}
