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
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Filter for {@code AuditLedger.query}. Unset fields do not restrict.
 */
@Value
@Builder
public class AuditQuery {

    String agent;

    @Singular
    Set<AuditAction> actions;

    @Builder.Default
    AuditCategory category = AuditCategory.ALL;

    @Builder.Default
    long fromSequence = 0;

    @Builder.Default
    int limit = 0;

    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }

    public boolean matches(AuditEntry entry) {
        if (entry.getSequence() < fromSequence) {
            return false;
        }
        if (agent != null && !agent.equals(entry.getAgent())) {
            return false;
        }
        if (!actions.isEmpty() && !actions.contains(entry.getAction())) {
            return false;
        }
        return category == null || category.matches(entry);
    }
}
