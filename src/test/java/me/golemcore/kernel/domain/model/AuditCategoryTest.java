package me.golemcore.kernel.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditCategoryTest {

    @Test
    void shouldClassifyToolEntriesByDetail() {
        AuditEntry fetch = entry(AuditAction.TOOL_INVOKE, "tool=web_fetch outcome=success duration_ms=12");
        AuditEntry shell = entry(AuditAction.CAPABILITY_DENIED, "tool=shell_exec");

        assertTrue(AuditCategory.NETWORK.matches(fetch));
        assertFalse(AuditCategory.SHELL.matches(fetch));
        assertTrue(AuditCategory.SHELL.matches(shell));
        assertTrue(AuditCategory.DENIED.matches(shell));
        assertFalse(AuditCategory.TOOL.matches(shell));
    }

    @Test
    void shouldNotTreatSpawnAsNetworkEvenWhenDetailMentionsHttp() {
        AuditEntry spawn = entry(AuditAction.AGENT_SPAWN, "name=http-poller");

        assertFalse(AuditCategory.NETWORK.matches(spawn));
        assertTrue(AuditCategory.SPAWN.matches(spawn));
    }

    @Test
    void shouldParseCaseInsensitivelyAndDefaultToAll() {
        assertEquals(AuditCategory.KILL, AuditCategory.parse("Kill"));
        assertEquals(AuditCategory.ALL, AuditCategory.parse(""));
        assertThrows(IllegalArgumentException.class, () -> AuditCategory.parse("finance"));
    }

    private static AuditEntry entry(AuditAction action, String detail) {
        return AuditEntry.builder().sequence(0).action(action).agent("agent-1").detail(detail).build();
    }
}
