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

/**
 * Point-in-time view of an agent's quota usage.
 */
public record QuotaSnapshot(
        @JsonProperty("tokens_used_in_window") long tokensUsedInWindow,
        @JsonProperty("max_tokens_per_window") long maxTokensPerWindow,
        @JsonProperty("tools_in_flight") int toolsInFlight,
        @JsonProperty("max_concurrent_tools") int maxConcurrentTools,
        @JsonProperty("active") boolean active) {
}
