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

import java.time.Instant;
import java.util.Map;

/**
 * Platform-neutral inbound message produced by a channel adapter.
 *
 * <p>
 * {@code targetAgent} is optional: adapters that route a conversation to a
 * specific agent set it, others leave routing to triggers.
 */
@Value
@Builder(toBuilder = true)
public class ChannelMessage {

    String id;
    String channelType;
    String chatId;
    ChannelUser sender;
    ChannelContent content;
    boolean group;
    String threadId;
    String replyToId;
    AgentId targetAgent;
    Instant timestamp;

    @Singular("metadataEntry")
    Map<String, String> metadata;
}
