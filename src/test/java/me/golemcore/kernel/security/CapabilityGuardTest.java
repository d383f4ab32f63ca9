package me.golemcore.kernel.security;

import me.golemcore.kernel.domain.exception.CapabilityDeniedException;
import me.golemcore.kernel.domain.model.AgentManifest;
import me.golemcore.kernel.domain.model.MemoryAccess;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import me.golemcore.kernel.testsupport.ManifestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CapabilityGuardTest {

    private KernelProperties properties;
    private CapabilityGuard guard;

    @BeforeEach
    void setUp() {
        properties = new KernelProperties();
        guard = new CapabilityGuard(properties);
    }

    @Test
    void shouldAllowListedTool() {
        AgentManifest manifest = ManifestFixtures.manifest("coder", List.of("file_read"), 100, 1);

        assertDoesNotThrow(() -> guard.checkTool(manifest, "file_read"));
    }

    @Test
    void shouldDenyUnlistedTool() {
        AgentManifest manifest = ManifestFixtures.manifest("coder", List.of("file_read"), 100, 1);

        CapabilityDeniedException ex = assertThrows(CapabilityDeniedException.class,
                () -> guard.checkTool(manifest, "shell_exec"));
        assertEquals("coder", ex.getAgent());
        assertEquals("tool:shell_exec", ex.getCapability());
    }

    @Test
    void shouldDenyEveryToolWhenToolSetIsEmpty() {
        AgentManifest manifest = ManifestFixtures.manifest("quiet", List.of(), 100, 1);

        assertThrows(CapabilityDeniedException.class, () -> guard.checkTool(manifest, "file_read"));
    }

    @Test
    void shouldAllowAnyToolWithWildcard() {
        AgentManifest manifest = ManifestFixtures.manifest("admin", List.of("*"), 100, 1);

        assertDoesNotThrow(() -> guard.checkTool(manifest, "anything_at_all"));
    }

    @Test
    void shouldCheckMemoryAgainstReadAndWriteGlobsSeparately() {
        AgentManifest manifest = ManifestFixtures.manifest("coder");

        assertDoesNotThrow(() -> guard.checkMemory(manifest, MemoryAccess.READ, "other.notes"));
        assertDoesNotThrow(() -> guard.checkMemory(manifest, MemoryAccess.WRITE, "self.notes"));
        CapabilityDeniedException ex = assertThrows(CapabilityDeniedException.class,
                () -> guard.checkMemory(manifest, MemoryAccess.WRITE, "other.notes"));
        assertEquals("memory_write", ex.getCapability());
    }

    @Test
    void shouldAllowAllSkillsWhenAllowlistIsEmpty() {
        AgentManifest open = ManifestFixtures.manifest("open");
        AgentManifest restricted = open.toBuilder().skill("summarize").build();

        assertDoesNotThrow(() -> guard.checkSkill(open, "translate"));
        assertDoesNotThrow(() -> guard.checkSkill(restricted, "summarize"));
        assertThrows(CapabilityDeniedException.class, () -> guard.checkSkill(restricted, "translate"));
    }

    @Test
    void shouldRestrictMcpServersWhenListed() {
        AgentManifest manifest = ManifestFixtures.manifest("coder").toBuilder().mcpServer("github").build();

        assertDoesNotThrow(() -> guard.checkMcpServer(manifest, "github"));
        assertThrows(CapabilityDeniedException.class, () -> guard.checkMcpServer(manifest, "slack"));
    }

    @Test
    void shouldRejectWildcardWhenPolicyDisablesIt() {
        properties.getCapabilities().setAllowWildcardTools(false);
        AgentManifest manifest = ManifestFixtures.manifest("admin", List.of("*"), 100, 1);

        assertThrows(CapabilityDeniedException.class, () -> guard.checkPolicy(manifest));
    }

    @Test
    void shouldRejectDeniedAndUnlistedToolsByPolicy() {
        properties.getCapabilities().setDeniedTools(List.of("shell_exec"));
        properties.getCapabilities().setAllowedTools(List.of("file_read", "web_fetch"));

        assertDoesNotThrow(() -> guard.checkPolicy(
                ManifestFixtures.manifest("a", List.of("file_read"), 100, 1)));
        assertThrows(CapabilityDeniedException.class, () -> guard.checkPolicy(
                ManifestFixtures.manifest("b", List.of("shell_exec"), 100, 1)));
        assertThrows(CapabilityDeniedException.class, () -> guard.checkPolicy(
                ManifestFixtures.manifest("c", List.of("file_write"), 100, 1)));
    }
}
