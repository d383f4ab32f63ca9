package me.golemcore.kernel.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KernelEventTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldUseCommandTextForChannelMessages() {
        ChannelMessage message = ChannelMessage.builder()
                .channelType("telegram")
                .content(ChannelContent.command("deploy", List.of("prod", "--force")))
                .targetAgent(AgentId.of("agent-1"))
                .build();

        KernelEvent event = KernelEvent.channelMessage(message, NOW);

        assertEquals("/deploy prod --force", event.getContent());
        assertEquals(AgentId.of("agent-1"), event.getAgentId());
        assertEquals("channel_message:telegram", event.describe());
        assertTrue(event.hasText());
    }

    @Test
    void shouldHaveNoTextForLocation() {
        ChannelMessage message = ChannelMessage.builder()
                .channelType("telegram")
                .content(ChannelContent.location(52.5, 13.4))
                .build();

        KernelEvent event = KernelEvent.channelMessage(message, NOW);

        assertNull(event.getContent());
        assertFalse(event.hasText());
    }

    @Test
    void shouldDescribeLifecycleWithoutPayload() {
        KernelEvent event = KernelEvent.lifecycle(AgentId.of("agent-1"), "coder", AgentState.PAUSED, NOW);

        assertEquals("lifecycle:paused agent=coder", event.describe());
        assertFalse(event.hasText());
    }

    @Test
    void shouldNotDescribeWebhookBody() {
        KernelEvent event = KernelEvent.webhook("token", "{\"secret\":\"value\"}", NOW);

        assertEquals("webhook", event.describe());
        assertTrue(event.hasText());
    }
}
