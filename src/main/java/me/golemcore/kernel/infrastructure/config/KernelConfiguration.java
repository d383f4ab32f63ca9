package me.golemcore.kernel.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.adapter.inbound.channel.ChannelEventBridge;
import me.golemcore.kernel.domain.model.KernelStatus;
import me.golemcore.kernel.domain.service.KernelService;
import me.golemcore.kernel.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class KernelConfiguration {

    private final KernelProperties properties;
    private final KernelService kernelService;
    private final ChannelEventBridge channelEventBridge;

    private final List<ChannelPort> startedChannels = new ArrayList<>();

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        KernelStatus status = kernelService.status();
        log.info("GolemCore Kernel starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Signature required: {}, trusted signers: {}", properties.getSigning().isRequireSignature(),
                properties.getSigning().getTrustedKeys().keySet());
        log.info("Audit ledger: {} entries, halted={}", status.getAuditEntries(), status.isHalted());

        // Channels are subscribed by the bridge before any is started
        channelEventBridge.channels().forEach((channelType, channel) -> {
            if (isChannelEnabled(channelType)) {
                log.info("Starting channel: {}", channelType);
                channel.start();
                startedChannels.add(channel);
            }
        });

        log.info("GolemCore Kernel started");
    }

    @PreDestroy
    public void shutdown() {
        for (ChannelPort channel : startedChannels) {
            try {
                channel.stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop channel {}: {}", channel.getChannelType(), e.getMessage());
            }
        }
        startedChannels.clear();
    }

    private boolean isChannelEnabled(String channelType) {
        KernelProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }
}
