package me.golemcore.kernel.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.kernel.domain.exception.AgentNotFoundException;
import me.golemcore.kernel.domain.exception.CapabilityDeniedException;
import me.golemcore.kernel.domain.exception.ChainBrokenException;
import me.golemcore.kernel.domain.exception.KernelHaltedException;
import me.golemcore.kernel.domain.exception.ManifestException;
import me.golemcore.kernel.domain.exception.QuotaExceededException;
import me.golemcore.kernel.domain.exception.SpawnException;
import me.golemcore.kernel.domain.model.AgentEntry;
import me.golemcore.kernel.domain.model.AgentId;
import me.golemcore.kernel.domain.model.AgentState;
import me.golemcore.kernel.domain.model.AuditAction;
import me.golemcore.kernel.domain.model.AuditEntry;
import me.golemcore.kernel.domain.model.AuditQuery;
import me.golemcore.kernel.domain.model.ChainVerification;
import me.golemcore.kernel.domain.model.FiredAction;
import me.golemcore.kernel.domain.model.KernelEvent;
import me.golemcore.kernel.domain.model.MemoryAccess;
import me.golemcore.kernel.domain.model.ToolInvocationContext;
import me.golemcore.kernel.domain.model.ToolInvocationResult;
import me.golemcore.kernel.domain.model.ToolOutcome;
import me.golemcore.kernel.domain.model.TriggerDefinition;
import me.golemcore.kernel.domain.model.TriggerPattern;
import me.golemcore.kernel.infrastructure.config.KernelConfiguration;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import me.golemcore.kernel.port.outbound.AgentDriverPort;
import me.golemcore.kernel.port.outbound.ToolInvoker;
import me.golemcore.kernel.ratelimit.ResourceQuotaMeter;
import me.golemcore.kernel.security.AuditDetailSanitizer;
import me.golemcore.kernel.security.CapabilityGuard;
import me.golemcore.kernel.security.ManifestSigner;
import me.golemcore.kernel.security.ManifestVerifier;
import me.golemcore.kernel.testsupport.InMemoryStoragePort;
import me.golemcore.kernel.testsupport.ManifestFixtures;
import me.golemcore.kernel.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class KernelServiceTest {

    private static final String GUARDED_TOML = """
            name = "guarded"

            [resources]
            max_llm_tokens_per_hour = 100
            max_concurrent_tools = 1

            [capabilities]
            tools = ["file_read"]
            memory_read = ["shared.*"]
            memory_write = ["self.*"]
            """;

    private InMemoryStoragePort storage;
    private ObjectMapper objectMapper;
    private KernelProperties properties;
    private MutableClock clock;
    private AuditLedger ledger;
    private TriggerScheduler triggerScheduler;
    private KernelHaltGuard haltGuard;
    private AgentDriverPort driver;
    private KernelService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        objectMapper = KernelConfiguration.objectMapper();
        properties = new KernelProperties();
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        driver = mock(AgentDriverPort.class);
        service = newService();
    }

    // ==================== SPAWN / KILL ====================

    @Test
    void shouldSpawnAndAuditAgent() {
        AgentEntry entry = service.spawnAgent(ManifestFixtures.CODER_TOML, null, null);

        assertEquals("coder", entry.getName());
        assertEquals(AgentState.RUNNING, entry.getState());
        AuditEntry audit = ledger.tail(1).get(0);
        assertEquals(AuditAction.AGENT_SPAWN, audit.getAction());
        assertEquals(entry.getId().value(), audit.getAgent());
        assertTrue(audit.getDetail().contains("name=coder"));
        assertNotNull(service.quotaSnapshot(entry.getId()));
    }

    @Test
    void shouldSpawnSignedManifestAndRecordSigner() {
        var envelope = ManifestSigner.sign(ManifestFixtures.CODER_TOML, ManifestSigner.generateKeyPair(), "ops");

        AgentEntry entry = service.spawnAgent(null, envelope, null);

        assertEquals("coder", entry.getName());
        assertTrue(ledger.tail(1).get(0).getDetail().contains("signer=ops"));
    }

    @Test
    void shouldRejectInvalidManifestWithoutSideEffects() {
        assertThrows(ManifestException.class, () -> service.spawnAgent("name = ", null, null));

        assertTrue(service.listAgents().isEmpty());
        assertEquals(0, ledger.size());
    }

    @Test
    void shouldRecordPolicyDenialAtSpawn() {
        properties.getCapabilities().setAllowWildcardTools(false);

        SpawnException ex = assertThrows(SpawnException.class,
                () -> service.spawnAgent(ManifestFixtures.named("wild"), null, null));

        assertEquals(SpawnException.Kind.INVALID_MANIFEST, ex.getKind());
        assertTrue(service.listAgents().isEmpty());
        AuditEntry denial = ledger.tail(1).get(0);
        assertEquals(AuditAction.CAPABILITY_DENIED, denial.getAction());
        assertEquals(AuditEntry.SYSTEM_AGENT, denial.getAgent());
    }

    @Test
    void shouldRejectSpawnUnderUnknownParent() {
        SpawnException ex = assertThrows(SpawnException.class,
                () -> service.spawnAgent(ManifestFixtures.CODER_TOML, null, AgentId.of("nobody")));

        assertEquals(SpawnException.Kind.PARENT_NOT_FOUND, ex.getKind());
    }

    @Test
    void shouldKillAgentRemoveTriggersAndRejectSecondKill() {
        AgentEntry parent = service.spawnAgent(ManifestFixtures.named("parent"), null, null);
        AgentEntry child = service.spawnAgent(ManifestFixtures.named("child"), null, parent.getId());
        service.registerTrigger(contentTrigger(parent.getId(), "ping"));
        assertEquals(List.of(child.getId()),
                service.childrenOf(parent.getId()).stream().map(AgentEntry::getId).toList());

        AgentEntry killed = service.killAgent(parent.getId());

        assertEquals(AgentState.KILLED, killed.getState());
        assertTrue(service.getAgent(child.getId()).getParentId().isEmpty());
        assertTrue(service.listTriggers(parent.getId().value()).isEmpty());
        assertEquals(AuditAction.AGENT_KILL, ledger.tail(1).get(0).getAction());
        assertThrows(AgentNotFoundException.class, () -> service.killAgent(parent.getId()));
        assertThrows(AgentNotFoundException.class, () -> service.recordTokenUsage(parent.getId(), 1));
    }

    @Test
    void shouldAuditStateChangesAndRejectIllegalOnes() {
        AgentEntry entry = service.spawnAgent(ManifestFixtures.CODER_TOML, null, null);

        assertEquals(AgentState.PAUSED, service.pauseAgent(entry.getId()).getState());
        assertEquals(AuditAction.AGENT_STATE_CHANGE, ledger.tail(1).get(0).getAction());
        assertThrows(IllegalStateException.class, () -> service.recoverAgent(entry.getId()));
        assertEquals(AgentState.RUNNING, service.resumeAgent(entry.getId()).getState());
        assertEquals(AgentState.ERRORED, service.markErrored(entry.getId(), "driver crashed").getState());
        assertEquals(AgentState.RUNNING, service.recoverAgent(entry.getId()).getState());
    }

    @Test
    void shouldUpdateManifestButKeepName() {
        AgentEntry entry = service.spawnAgent(ManifestFixtures.CODER_TOML, null, null);

        ManifestException rename = assertThrows(ManifestException.class,
                () -> service.updateManifest(entry.getId(), ManifestFixtures.named("renamed"), null));
        assertEquals(ManifestException.Kind.VALIDATION, rename.getKind());

        AgentEntry updated = service.updateManifest(entry.getId(), ManifestFixtures.named("coder"), null);
        assertTrue(updated.getManifest().getCapabilities().allowsAllTools());
        assertEquals(AuditAction.CONFIG_CHANGE, ledger.tail(1).get(0).getAction());
    }

    // ==================== TOOLS / TOKENS / MEMORY ====================

    @Test
    void shouldRunGrantedToolAndAuditOutcome() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);

        ToolInvocationResult result = service.invokeTool(context(entry.getId(), "file_read"),
                ctx -> ToolInvocationResult.success("contents"));

        assertTrue(result.isSuccess());
        AuditEntry audit = ledger.tail(1).get(0);
        assertEquals(audit.getSequence(), result.auditSequence());
        assertEquals(AuditAction.TOOL_INVOKE, audit.getAction());
        assertTrue(audit.getDetail().startsWith("tool=file_read outcome=success"));
        assertFalse(audit.getDetail().contains("contents"));
    }

    @Test
    void shouldDenyAndRecordUngrantedTool() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);
        long before = ledger.size();

        CapabilityDeniedException ex = assertThrows(CapabilityDeniedException.class,
                () -> service.invokeTool(context(entry.getId(), "shell_exec"),
                        ctx -> ToolInvocationResult.success("should not run")));

        assertEquals("tool:shell_exec", ex.getCapability());
        assertEquals(before + 1, ledger.size());
        AuditEntry denial = ledger.tail(1).get(0);
        assertEquals(AuditAction.CAPABILITY_DENIED, denial.getAction());
        assertEquals("tool=shell_exec", denial.getDetail());
    }

    @Test
    void shouldRefuseToolBeyondConcurrencyLimitAndRecordIt() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);
        AtomicReference<QuotaExceededException> nested = new AtomicReference<>();

        service.invokeTool(context(entry.getId(), "file_read"), ctx -> {
            nested.set(assertThrows(QuotaExceededException.class, () -> service.invokeTool(
                    context(entry.getId(), "file_read"), inner -> ToolInvocationResult.success("inner"))));
            return ToolInvocationResult.success("outer");
        });

        assertEquals(QuotaExceededException.Kind.TOOL_SLOTS, nested.get().getKind());
        assertEquals(1, ledger.query(AuditQuery.builder().action(AuditAction.QUOTA_EXCEEDED).build()).count());
        assertEquals(0, service.quotaSnapshot(entry.getId()).toolsInFlight());
    }

    @Test
    void shouldAuditFailureWhenToolThrows() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);

        assertThrows(IllegalArgumentException.class, () -> service.invokeTool(context(entry.getId(), "file_read"),
                ctx -> {
                    throw new IllegalArgumentException("bad path");
                }));

        assertTrue(ledger.tail(1).get(0).getDetail().contains("outcome=failure"));
        assertEquals(0, service.quotaSnapshot(entry.getId()).toolsInFlight());
    }

    @Test
    void shouldRecordTimeoutReportedByExecutor() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);

        ToolInvocationResult result = service.invokeTool(context(entry.getId(), "file_read"),
                ctx -> ToolInvocationResult.timeout());

        assertEquals(ToolOutcome.TIMEOUT, result.outcome());
        assertTrue(ledger.tail(1).get(0).getDetail().contains("outcome=timeout"));
    }

    @Test
    void shouldRefuseToolsForPausedAgent() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);
        service.pauseAgent(entry.getId());

        assertThrows(IllegalStateException.class, () -> service.invokeTool(context(entry.getId(), "file_read"),
                ctx -> ToolInvocationResult.success("x")));
    }

    @Test
    void shouldMeterTokensAndRecordExhaustion() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);

        service.recordTokenUsage(entry.getId(), 80);
        QuotaExceededException ex = assertThrows(QuotaExceededException.class,
                () -> service.recordTokenUsage(entry.getId(), 30));

        assertEquals(QuotaExceededException.Kind.TOKENS, ex.getKind());
        assertNotNull(ex.getRetryAfter());
        assertEquals(AuditAction.QUOTA_EXCEEDED, ledger.tail(1).get(0).getAction());
    }

    @Test
    void shouldAuthorizeMemoryByGlob() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);

        assertDoesNotThrow(() -> service.authorizeMemory(entry.getId(), MemoryAccess.READ, "shared.docs"));
        assertDoesNotThrow(() -> service.authorizeMemory(entry.getId(), MemoryAccess.WRITE, "self.notes"));
        assertThrows(CapabilityDeniedException.class,
                () -> service.authorizeMemory(entry.getId(), MemoryAccess.WRITE, "shared.docs"));
        assertEquals(AuditAction.CAPABILITY_DENIED, ledger.tail(1).get(0).getAction());
    }

    // ==================== TRIGGERS / DISPATCH ====================

    @Test
    void shouldDispatchFiredActionToDriverWithMediatedTools() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);
        service.registerTrigger(contentTrigger(entry.getId(), "deploy"));
        AtomicReference<ToolInvocationResult> toolResult = new AtomicReference<>();
        doAnswer(invocation -> {
            ToolInvoker tools = invocation.getArgument(2);
            toolResult.set(tools.invoke("file_read", "{}", ctx -> ToolInvocationResult.success("ok")));
            return null;
        }).when(driver).deliver(any(), anyString(), any());

        List<FiredAction> fired = service.publishEvent(KernelEvent.message(null, "deploy now", clock.instant()));

        assertEquals(1, fired.size());
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(driver).deliver(any(AgentEntry.class), prompt.capture(), any(ToolInvoker.class));
        assertEquals("Trigger fired: message", prompt.getValue());
        assertTrue(toolResult.get().isSuccess());
        assertTrue(service.quotaSnapshot(entry.getId()).tokensUsedInWindow() > 0);
    }

    @Test
    void shouldNotDeliverToPausedOwner() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);
        service.registerTrigger(contentTrigger(entry.getId(), "deploy"));
        service.pauseAgent(entry.getId());

        List<FiredAction> fired = service.publishEvent(KernelEvent.message(null, "deploy", clock.instant()));

        assertEquals(1, fired.size());
        verify(driver, never()).deliver(any(), anyString(), any());
    }

    @Test
    void shouldFireLifecycleTriggerOnPause() {
        AgentEntry watcher = service.spawnAgent(ManifestFixtures.named("watcher"), null, null);
        AgentEntry worker = service.spawnAgent(ManifestFixtures.named("worker"), null, null);
        service.registerTrigger(TriggerDefinition.builder()
                .agentId(watcher.getId().value())
                .pattern(TriggerPattern.of(TriggerPattern.Kind.LIFECYCLE, "paused"))
                .promptTemplate("{{agent}} paused")
                .build());

        service.pauseAgent(worker.getId());

        verify(driver).deliver(any(AgentEntry.class), eq("worker paused"), any(ToolInvoker.class));
    }

    @Test
    void shouldCompleteSpawnWhenFiredActionThrows() {
        AgentEntry watcher = service.spawnAgent(ManifestFixtures.named("watcher"), null, null);
        AgentEntry auditor = service.spawnAgent(ManifestFixtures.named("auditor"), null, null);
        for (AgentEntry owner : List.of(watcher, auditor)) {
            service.registerTrigger(TriggerDefinition.builder()
                    .agentId(owner.getId().value())
                    .pattern(TriggerPattern.of(TriggerPattern.Kind.AGENT_SPAWNED, "*"))
                    .build());
        }
        doThrow(new RuntimeException("driver down")).when(driver).deliver(any(), anyString(), any());

        AgentEntry worker = assertDoesNotThrow(() -> service.spawnAgent(ManifestFixtures.named("worker"), null, null));

        assertEquals("worker", worker.getName());
        assertEquals(3, service.listAgents().size());
        verify(driver, times(2)).deliver(any(AgentEntry.class), anyString(), any(ToolInvoker.class));
        long spawns = ledger.tail(20).stream()
                .filter(audit -> audit.getAction() == AuditAction.AGENT_SPAWN)
                .count();
        assertEquals(3, spawns);
        assertFalse(service.status().isHalted());
    }

    @Test
    void shouldRejectTriggerForUnknownAgent() {
        assertThrows(AgentNotFoundException.class,
                () -> service.registerTrigger(contentTrigger(AgentId.of("ghost"), "x")));
    }

    @Test
    void shouldRollBackTriggerWhenRegistrationCannotBeAudited() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);
        storage.failAppends(true);

        assertThrows(RuntimeException.class, () -> service.registerTrigger(contentTrigger(entry.getId(), "x")));

        assertTrue(service.listTriggers(null).isEmpty());
        assertFalse(haltGuard.isHalted());
    }

    // ==================== HALT / LEDGER HEALTH ====================

    @Test
    void shouldHaltWhenMutationCannotBeAuditedAndResumeAfterConfirmation() {
        AgentEntry entry = service.spawnAgent(GUARDED_TOML, null, null);
        storage.failAppends(true);

        assertThrows(KernelHaltedException.class, () -> service.pauseAgent(entry.getId()));
        assertTrue(service.status().isHalted());
        assertThrows(KernelHaltedException.class,
                () -> service.spawnAgent(ManifestFixtures.named("another"), null, null));
        assertTrue(service.publishEvent(KernelEvent.message(null, "x", clock.instant())).isEmpty());

        storage.failAppends(false);
        ChainVerification verification = service.confirmLedgerHealth();

        assertTrue(verification.valid());
        assertFalse(service.status().isHalted());
        assertEquals(AuditAction.LEDGER_HEALTH_CONFIRMED, ledger.tail(1).get(0).getAction());
        assertDoesNotThrow(() -> service.spawnAgent(ManifestFixtures.named("another"), null, null));
    }

    @Test
    void shouldStartHaltedOnBrokenChainAndStayHaltedUntilRepaired() {
        service.spawnAgent(ManifestFixtures.CODER_TOML, null, null);
        service.spawnAgent(ManifestFixtures.named("second"), null, null);
        String stored = storage.read("audit", "ledger.jsonl");
        storage.write("audit", "ledger.jsonl", stored.replace("name=second", "name=forged"));

        KernelService restarted = newService();

        assertTrue(restarted.status().isHalted());
        assertThrows(ChainBrokenException.class, restarted::confirmLedgerHealth);
        assertTrue(restarted.status().isHalted());
        assertThrows(KernelHaltedException.class,
                () -> restarted.spawnAgent(ManifestFixtures.named("third"), null, null));
    }

    @Test
    void shouldReportStatus() {
        service.spawnAgent(ManifestFixtures.CODER_TOML, null, null);

        var status = service.status();

        assertFalse(status.isHalted());
        assertEquals(1, status.getAgents());
        assertEquals(1, status.getAuditEntries());
        assertEquals(ledger.tipHash(), status.getAuditTipHash());
    }

    @Test
    void shouldEstimateTokensFromPromptLength() {
        assertEquals(0, KernelService.estimateTokens(""));
        assertEquals(1, KernelService.estimateTokens("abc"));
        assertEquals(2, KernelService.estimateTokens("abcde"));
    }

    private KernelService newService() {
        ledger = new AuditLedger(storage, objectMapper, properties, clock);
        ledger.init();
        AuditDetailSanitizer sanitizer = new AuditDetailSanitizer();
        triggerScheduler = new TriggerScheduler(storage, objectMapper, properties, ledger, sanitizer, clock);
        triggerScheduler.init();
        haltGuard = new KernelHaltGuard(clock);
        KernelService created = new KernelService(
                new ManifestVerifier(properties, objectMapper),
                new CapabilityGuard(properties),
                new ResourceQuotaMeter(properties, clock),
                new AgentRegistry(clock),
                ledger,
                triggerScheduler,
                haltGuard,
                sanitizer,
                driver,
                clock);
        created.init();
        return created;
    }

    private ToolInvocationContext context(AgentId agentId, String tool) {
        return ToolInvocationContext.builder()
                .agentId(agentId)
                .toolName(tool)
                .input("{}")
                .timestamp(clock.instant())
                .build();
    }

    private static TriggerDefinition contentTrigger(AgentId owner, String regex) {
        return TriggerDefinition.builder()
                .agentId(owner.value())
                .pattern(TriggerPattern.of(TriggerPattern.Kind.CONTENT_MATCH, regex))
                .build();
    }
}
