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

import java.util.Locale;

/**
 * Coarse audit filter used by viewers. Tool-related categories look at the
 * tool named in the entry detail.
 */
public enum AuditCategory {

    ALL, SPAWN, KILL, TOOL, NETWORK, SHELL, DENIED;

    public boolean matches(AuditEntry entry) {
        AuditAction action = entry.getAction();
        String detail = entry.getDetail() != null ? entry.getDetail().toLowerCase(Locale.ROOT) : "";
        return switch (this) {
        case ALL -> true;
        case SPAWN -> action == AuditAction.AGENT_SPAWN;
        case KILL -> action == AuditAction.AGENT_KILL;
        case TOOL -> action == AuditAction.TOOL_INVOKE;
        case NETWORK -> isToolAction(action)
                && (detail.contains("web_") || detail.contains("fetch") || detail.contains("http"));
        case SHELL -> isToolAction(action)
                && (detail.contains("shell") || detail.contains("exec") || detail.contains("process"));
        case DENIED -> action == AuditAction.CAPABILITY_DENIED || action == AuditAction.QUOTA_EXCEEDED;
        };
    }

    private static boolean isToolAction(AuditAction action) {
        return action == AuditAction.TOOL_INVOKE || action == AuditAction.CAPABILITY_DENIED;
    }

    public static AuditCategory parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported audit category: " + value, e);
        }
    }
}
