package me.golemcore.kernel.adapter.inbound.channel;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.model.ChannelMessage;
import me.golemcore.kernel.domain.model.FiredAction;
import me.golemcore.kernel.domain.service.KernelService;
import me.golemcore.kernel.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Connects channel adapters to the kernel: every inbound message becomes a
 * {@code ChannelMessage} event for the trigger layer.
 */
@Component
@Slf4j
public class ChannelEventBridge {

    private final KernelService kernelService;
    private final Map<String, ChannelPort> channels = new LinkedHashMap<>();

    public ChannelEventBridge(KernelService kernelService, List<ChannelPort> channelPorts) {
        this.kernelService = kernelService;
        for (ChannelPort port : channelPorts) {
            ChannelPort previous = channels.putIfAbsent(port.getChannelType(), port);
            if (previous != null) {
                log.warn("[Channel] Duplicate channel type '{}', keeping {}", port.getChannelType(),
                        previous.getClass().getSimpleName());
            }
        }
    }

    @PostConstruct
    public void init() {
        channels.values().forEach(port -> port.onMessage(this::handle));
        log.info("[Channel] Bridge subscribed to {} channel(s): {}", channels.size(), channels.keySet());
    }

    void handle(ChannelMessage message) {
        try {
            List<FiredAction> fired = kernelService.publishChannelMessage(message);
            if (!fired.isEmpty()) {
                log.debug("[Channel] {} message {} fired {} trigger(s)", message.getChannelType(),
                        message.getId(), fired.size());
            }
        } catch (RuntimeException e) {
            log.error("[Channel] Failed to publish {} message {}: {}", message.getChannelType(),
                    message.getId(), e.getMessage(), e);
        }
    }

    /**
     * Send text to a chat, split into chunks the channel accepts. Chunks are
     * sent in order; the first failure stops the rest.
     */
    public CompletableFuture<Void> send(String channelType, String chatId, String text) {
        ChannelPort port = channels.get(channelType);
        if (port == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Unknown channel type: " + channelType));
        }
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String chunk : ChannelMessages.split(text, port.maxMessageLength())) {
            chain = chain.thenCompose(ignored -> port.send(chatId, chunk));
        }
        return chain;
    }

    public Optional<ChannelPort> channel(String channelType) {
        return Optional.ofNullable(channels.get(channelType));
    }

    public Map<String, ChannelPort> channels() {
        return Map.copyOf(channels);
    }
}
