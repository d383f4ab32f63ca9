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
import java.util.Locale;

/**
 * Normalized event observed by the trigger scheduler.
 */
@Value
@Builder
public class KernelEvent {

    Type type;
    Instant timestamp;
    AgentId agentId;
    String agentName;
    AgentState lifecycleState;
    String content;
    String channelType;
    String webhookToken;
    ChannelMessage channelMessage;

    /**
     * Event kinds.
     */
    public enum Type {
        LIFECYCLE, AGENT_SPAWNED, MESSAGE, SCHEDULE_TICK, WEBHOOK, CHANNEL_MESSAGE
    }

    public static KernelEvent lifecycle(AgentId agentId, String agentName, AgentState state, Instant at) {
        return KernelEvent.builder()
                .type(Type.LIFECYCLE)
                .agentId(agentId)
                .agentName(agentName)
                .lifecycleState(state)
                .timestamp(at)
                .build();
    }

    public static KernelEvent agentSpawned(AgentId agentId, String agentName, Instant at) {
        return KernelEvent.builder()
                .type(Type.AGENT_SPAWNED)
                .agentId(agentId)
                .agentName(agentName)
                .lifecycleState(AgentState.RUNNING)
                .timestamp(at)
                .build();
    }

    public static KernelEvent message(AgentId agentId, String content, Instant at) {
        return KernelEvent.builder()
                .type(Type.MESSAGE)
                .agentId(agentId)
                .content(content)
                .timestamp(at)
                .build();
    }

    public static KernelEvent scheduleTick(Instant at) {
        return KernelEvent.builder()
                .type(Type.SCHEDULE_TICK)
                .timestamp(at)
                .build();
    }

    public static KernelEvent webhook(String token, String body, Instant at) {
        return KernelEvent.builder()
                .type(Type.WEBHOOK)
                .webhookToken(token)
                .content(body)
                .timestamp(at)
                .build();
    }

    public static KernelEvent channelMessage(ChannelMessage message, Instant at) {
        return KernelEvent.builder()
                .type(Type.CHANNEL_MESSAGE)
                .channelType(message.getChannelType())
                .content(message.getContent() != null ? message.getContent().textOrNull() : null)
                .agentId(message.getTargetAgent())
                .channelMessage(message)
                .timestamp(at)
                .build();
    }

    /**
     * Whether this event carries message text that content patterns apply to.
     */
    public boolean hasText() {
        return content != null && (type == Type.MESSAGE || type == Type.CHANNEL_MESSAGE || type == Type.WEBHOOK);
    }

    /**
     * Short, payload-free description used in prompts and audit details.
     */
    public String describe() {
        return switch (type) {
        case LIFECYCLE -> "lifecycle:" + (lifecycleState != null ? lifecycleState.name().toLowerCase(Locale.ROOT) : "?")
                + (agentName != null ? " agent=" + agentName : "");
        case AGENT_SPAWNED -> "agent_spawned" + (agentName != null ? " agent=" + agentName : "");
        case MESSAGE -> "message";
        case SCHEDULE_TICK -> "schedule";
        case WEBHOOK -> "webhook";
        case CHANNEL_MESSAGE -> "channel_message:" + channelType;
        };
    }
}
