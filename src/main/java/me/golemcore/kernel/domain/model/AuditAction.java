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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Security-relevant action kinds recorded in the audit ledger, with the label
 * shown by audit viewers.
 */
public enum AuditAction {

    AGENT_SPAWN("AgentSpawn"),
    AGENT_KILL("AgentKill"),
    AGENT_STATE_CHANGE("AgentStateChange"),
    TOOL_INVOKE("ToolInvoke"),
    CAPABILITY_DENIED("CapabilityDenied"),
    QUOTA_EXCEEDED("QuotaExceeded"),
    CONFIG_CHANGE("ConfigChange"),
    TRIGGER_REGISTERED("TriggerRegistered"),
    TRIGGER_REMOVED("TriggerRemoved"),
    TRIGGER_FIRED("TriggerFired"),
    LEDGER_HEALTH_CONFIRMED("LedgerHealthConfirmed");

    private final String wireName;

    AuditAction(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Stable name used in the canonical entry serialization and on the wire.
     * Renaming a constant must not change it, or every stored hash breaks.
     */
    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AuditAction fromWireName(String wireName) {
        for (AuditAction action : values()) {
            if (action.wireName.equals(wireName) || action.name().equals(wireName)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + wireName);
    }
}
