package me.golemcore.kernel.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.exception.AgentNotFoundException;
import me.golemcore.kernel.domain.exception.AuditAppendException;
import me.golemcore.kernel.domain.exception.CapabilityDeniedException;
import me.golemcore.kernel.domain.exception.ChainBrokenException;
import me.golemcore.kernel.domain.exception.KernelException;
import me.golemcore.kernel.domain.exception.KernelHaltedException;
import me.golemcore.kernel.domain.exception.ManifestException;
import me.golemcore.kernel.domain.exception.QuotaExceededException;
import me.golemcore.kernel.domain.exception.SpawnException;
import me.golemcore.kernel.domain.exception.TriggerNotFoundException;
import me.golemcore.kernel.domain.model.AgentEntry;
import me.golemcore.kernel.domain.model.AgentId;
import me.golemcore.kernel.domain.model.AgentManifest;
import me.golemcore.kernel.domain.model.AgentState;
import me.golemcore.kernel.domain.model.AuditAction;
import me.golemcore.kernel.domain.model.AuditEntry;
import me.golemcore.kernel.domain.model.AuditQuery;
import me.golemcore.kernel.domain.model.ChainVerification;
import me.golemcore.kernel.domain.model.ChannelMessage;
import me.golemcore.kernel.domain.model.FiredAction;
import me.golemcore.kernel.domain.model.KernelEvent;
import me.golemcore.kernel.domain.model.KernelStatus;
import me.golemcore.kernel.domain.model.MemoryAccess;
import me.golemcore.kernel.domain.model.QuotaSnapshot;
import me.golemcore.kernel.domain.model.SignedManifestEnvelope;
import me.golemcore.kernel.domain.model.ToolInvocationContext;
import me.golemcore.kernel.domain.model.ToolInvocationResult;
import me.golemcore.kernel.domain.model.ToolOutcome;
import me.golemcore.kernel.domain.model.TriggerDefinition;
import me.golemcore.kernel.port.outbound.AgentDriverPort;
import me.golemcore.kernel.port.outbound.ToolExecutor;
import me.golemcore.kernel.port.outbound.ToolInvoker;
import me.golemcore.kernel.ratelimit.ResourceQuotaMeter;
import me.golemcore.kernel.ratelimit.ToolSlot;
import me.golemcore.kernel.security.AuditDetailSanitizer;
import me.golemcore.kernel.security.CapabilityGuard;
import me.golemcore.kernel.security.ManifestVerifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Composes the kernel components into the agent pipelines.
 *
 * <p>
 * Pipelines:
 * <ul>
 * <li>spawn - verify manifest, check system policy, create registry entry,
 * register quota, audit {@code AgentSpawn}, notify triggers</li>
 * <li>kill - remove registry entry, retire quota, drop the agent's triggers,
 * audit {@code AgentKill}, notify triggers</li>
 * <li>tool call - require RUNNING, capability check, concurrency slot, run,
 * audit the outcome</li>
 * <li>fired trigger - require RUNNING, meter prompt tokens, deliver to the
 * driver with kernel-mediated tool access</li>
 * </ul>
 *
 * <p>
 * Capability and quota denials are recorded in the ledger and rethrown to the
 * caller. A registry change that cannot be audited halts the kernel: further
 * mutations are refused until {@link #confirmLedgerHealth()} succeeds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KernelService {

    private static final int CHARS_PER_TOKEN = 4;

    private final ManifestVerifier manifestVerifier;
    private final CapabilityGuard capabilityGuard;
    private final ResourceQuotaMeter quotaMeter;
    private final AgentRegistry registry;
    private final AuditLedger auditLedger;
    private final TriggerScheduler triggerScheduler;
    private final KernelHaltGuard haltGuard;
    private final AuditDetailSanitizer sanitizer;
    private final AgentDriverPort agentDriver;
    private final Clock clock;

    @PostConstruct
    public void init() {
        ChainVerification verification = auditLedger.checkChain();
        if (!verification.valid()) {
            haltGuard.halt("audit chain broken at sequence " + verification.brokenAtSequence());
            return;
        }
        log.info("[Kernel] Audit chain verified: {} entries", verification.entriesChecked());
    }

    // ==================== AGENT LIFECYCLE ====================

    /**
     * Spawn an agent from a manifest, optionally signed.
     *
     * @throws ManifestException
     *             if the manifest does not parse, validate or verify
     * @throws SpawnException
     *             if system policy rejects the manifest or the parent is not
     *             live
     * @throws KernelHaltedException
     *             if the kernel is halted, or the spawn could not be audited
     */
    public AgentEntry spawnAgent(String manifestToml, SignedManifestEnvelope envelope, AgentId parent) {
        haltGuard.ensureRunning();
        AgentManifest manifest = manifestVerifier.verify(manifestToml, envelope);
        try {
            capabilityGuard.checkPolicy(manifest);
        } catch (CapabilityDeniedException e) {
            recordDenial(AuditAction.CAPABILITY_DENIED, AuditEntry.SYSTEM_AGENT,
                    "spawn name=" + manifest.getName() + " capability=" + e.getCapability(), e);
            throw new SpawnException(SpawnException.Kind.INVALID_MANIFEST, e.getMessage(), e);
        }

        AgentId id = registry.spawn(manifest, parent);
        quotaMeter.register(id, manifest.getResources());
        auditMutation(AuditAction.AGENT_SPAWN, id.value(), "name=" + manifest.getName()
                + " version=" + manifest.getVersion()
                + " module=" + manifest.getModule()
                + (parent != null ? " parent=" + parent : "")
                + (envelope != null ? " signer=" + envelope.getSignerId() : ""));

        AgentEntry entry = requireAgent(id);
        log.info("[Kernel] Agent spawned: {} ({})", entry.getName(), id);
        publishEvent(KernelEvent.agentSpawned(id, entry.getName(), clock.instant()));
        return entry;
    }

    /**
     * Kill a live agent. Children are orphaned. In-flight tool calls finish;
     * new ones are refused.
     *
     * @throws AgentNotFoundException
     *             if the agent is not live, including a second kill
     */
    public AgentEntry killAgent(AgentId id) {
        haltGuard.ensureRunning();
        List<AgentId> children = requireAgent(id).getChildren();
        AgentEntry killed = registry.kill(id);
        quotaMeter.retire(id);
        List<String> removedTriggers = triggerScheduler.removeForAgent(id.value());
        auditMutation(AuditAction.AGENT_KILL, id.value(), "name=" + killed.getName()
                + " orphaned=" + children.size()
                + " triggers_removed=" + removedTriggers.size());

        log.info("[Kernel] Agent killed: {} ({})", killed.getName(), id);
        publishEvent(KernelEvent.lifecycle(id, killed.getName(), AgentState.KILLED, clock.instant()));
        return killed;
    }

    public AgentEntry pauseAgent(AgentId id) {
        haltGuard.ensureRunning();
        return recordStateChange(registry.pause(id));
    }

    public AgentEntry resumeAgent(AgentId id) {
        haltGuard.ensureRunning();
        return recordStateChange(registry.resume(id));
    }

    public AgentEntry markErrored(AgentId id, String reason) {
        haltGuard.ensureRunning();
        AgentEntry entry = registry.markErrored(id);
        log.warn("[Kernel] Agent {} ({}) errored: {}", entry.getName(), id, reason);
        return recordStateChange(entry);
    }

    public AgentEntry recoverAgent(AgentId id) {
        haltGuard.ensureRunning();
        return recordStateChange(registry.recover(id));
    }

    private AgentEntry recordStateChange(AgentEntry entry) {
        auditMutation(AuditAction.AGENT_STATE_CHANGE, entry.getId().value(),
                "name=" + entry.getName() + " state=" + entry.getState());
        publishEvent(KernelEvent.lifecycle(entry.getId(), entry.getName(), entry.getState(), clock.instant()));
        return entry;
    }

    /**
     * Replace an agent's manifest. The new manifest goes through the same
     * verification and policy checks as a spawn and must keep the agent's name.
     */
    public AgentEntry updateManifest(AgentId id, String manifestToml, SignedManifestEnvelope envelope) {
        haltGuard.ensureRunning();
        AgentEntry current = requireAgent(id);
        AgentManifest manifest = manifestVerifier.verify(manifestToml, envelope);
        if (!current.getName().equals(manifest.getName())) {
            throw new ManifestException(ManifestException.Kind.VALIDATION,
                    "Manifest name cannot change from '" + current.getName() + "'");
        }
        try {
            capabilityGuard.checkPolicy(manifest);
        } catch (CapabilityDeniedException e) {
            recordDenial(AuditAction.CAPABILITY_DENIED, id.value(),
                    "update_manifest capability=" + e.getCapability(), e);
            throw e;
        }

        AgentEntry updated = registry.replaceManifest(id, manifest);
        quotaMeter.updateLimits(id, manifest.getResources());
        AgentManifest.Capabilities caps = manifest.getCapabilities();
        auditMutation(AuditAction.CONFIG_CHANGE, id.value(), "manifest name=" + manifest.getName()
                + " version=" + manifest.getVersion()
                + " tools=" + caps.getTools().size()
                + " memory_read=" + caps.getMemoryRead().size()
                + " memory_write=" + caps.getMemoryWrite().size());
        log.info("[Kernel] Manifest updated: {} ({})", updated.getName(), id);
        return updated;
    }

    public AgentEntry getAgent(AgentId id) {
        return requireAgent(id);
    }

    public List<AgentEntry> listAgents() {
        return registry.list();
    }

    public List<AgentEntry> childrenOf(AgentId id) {
        return registry.children(id);
    }

    public QuotaSnapshot quotaSnapshot(AgentId id) {
        return quotaMeter.snapshot(id).orElseThrow(() -> new AgentNotFoundException(String.valueOf(id)));
    }

    // ==================== TOOLS, TOKENS, MEMORY ====================

    /**
     * Run a tool call on behalf of an agent.
     *
     * @throws CapabilityDeniedException
     *             if the manifest does not grant the tool (recorded)
     * @throws QuotaExceededException
     *             if the agent has no free tool slot (recorded)
     * @throws IllegalStateException
     *             if the agent is not RUNNING
     */
    public ToolInvocationResult invokeTool(ToolInvocationContext context, ToolExecutor executor) {
        haltGuard.ensureRunning();
        AgentId agentId = context.getAgentId();
        AgentEntry entry = requireRunning(agentId);
        String tool = context.getToolName();

        try {
            capabilityGuard.checkTool(entry.getManifest(), tool);
        } catch (CapabilityDeniedException e) {
            recordDenial(AuditAction.CAPABILITY_DENIED, agentId.value(), "tool=" + tool, e);
            throw e;
        }

        try (ToolSlot slot = acquireToolSlot(agentId, tool)) {
            Instant started = clock.instant();
            ToolInvocationResult result;
            try {
                result = executor.execute(context);
            } catch (RuntimeException e) {
                recordToolOutcome(agentId, tool, ToolOutcome.FAILURE, started);
                throw e;
            }
            if (result == null) {
                result = ToolInvocationResult.failure(null);
            }
            AuditEntry audit = recordToolOutcome(agentId, tool, result.outcome(), started);
            registry.touch(agentId);
            return result.withAuditSequence(audit.getSequence());
        }
    }

    private ToolSlot acquireToolSlot(AgentId agentId, String tool) {
        try {
            return quotaMeter.tryAcquireToolSlot(agentId);
        } catch (QuotaExceededException e) {
            recordDenial(AuditAction.QUOTA_EXCEEDED, agentId.value(),
                    "tool=" + tool + " limit=" + e.getKind().name().toLowerCase(Locale.ROOT), e);
            throw e;
        }
    }

    private AuditEntry recordToolOutcome(AgentId agentId, String tool, ToolOutcome outcome, Instant started) {
        long durationMs = Math.max(0, Duration.between(started, clock.instant()).toMillis());
        log.debug("[Kernel] Tool {} for agent {}: {} in {}ms", tool, agentId, outcome.label(), durationMs);
        return auditLedger.append(AuditAction.TOOL_INVOKE, agentId.value(),
                sanitizer.sanitize("tool=" + tool + " outcome=" + outcome.label() + " duration_ms=" + durationMs));
    }

    /**
     * Meter LLM tokens used by an agent.
     *
     * @throws QuotaExceededException
     *             if the rolling budget is exhausted (recorded)
     */
    public void recordTokenUsage(AgentId agentId, long tokens) {
        requireAgent(agentId);
        try {
            quotaMeter.tryConsumeTokens(agentId, tokens);
        } catch (QuotaExceededException e) {
            recordDenial(AuditAction.QUOTA_EXCEEDED, agentId.value(),
                    "tokens=" + tokens + " limit=" + e.getKind().name().toLowerCase(Locale.ROOT), e);
            throw e;
        }
    }

    /**
     * @throws CapabilityDeniedException
     *             if no glob of the relevant set matches {@code key} (recorded)
     */
    public void authorizeMemory(AgentId agentId, MemoryAccess access, String key) {
        AgentEntry entry = requireAgent(agentId);
        try {
            capabilityGuard.checkMemory(entry.getManifest(), access, key);
        } catch (CapabilityDeniedException e) {
            recordDenial(AuditAction.CAPABILITY_DENIED, agentId.value(),
                    "memory_" + access.name().toLowerCase(Locale.ROOT) + " key=" + key, e);
            throw e;
        }
    }

    // ==================== EVENTS & TRIGGERS ====================

    /**
     * Feed an event to the trigger layer and dispatch every resulting action.
     * Failures of individual actions are logged and do not affect the others.
     *
     * @return the actions that fired
     */
    public List<FiredAction> publishEvent(KernelEvent event) {
        if (haltGuard.isHalted()) {
            log.debug("[Kernel] Halted, ignoring {} event", event.getType());
            return List.of();
        }
        List<FiredAction> fired = triggerScheduler.onEvent(event);
        for (FiredAction action : fired) {
            try {
                dispatch(action);
            } catch (KernelException | IllegalStateException e) {
                log.warn("[Kernel] Fired action of trigger {} not delivered to agent {}: {}",
                        action.triggerId(), action.agentId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("[Kernel] Fired action of trigger {} failed in agent {}",
                        action.triggerId(), action.agentId(), e);
            }
        }
        return fired;
    }

    public List<FiredAction> publishChannelMessage(ChannelMessage message) {
        return publishEvent(KernelEvent.channelMessage(message, clock.instant()));
    }

    /**
     * Execute a fired action: the owning agent must be RUNNING and have token
     * budget for the prompt. Tool calls made by the driver while handling the
     * prompt go through {@link #invokeTool}.
     */
    public void dispatch(FiredAction action) {
        haltGuard.ensureRunning();
        AgentEntry entry = requireRunning(action.agentId());
        recordTokenUsage(action.agentId(), estimateTokens(action.prompt()));

        ToolInvoker tools = (toolName, input, executor) -> invokeTool(ToolInvocationContext.builder()
                .agentId(action.agentId())
                .toolName(toolName)
                .input(input)
                .timestamp(clock.instant())
                .build(), executor);
        agentDriver.deliver(entry, action.prompt(), tools);
        registry.touch(action.agentId());
        log.debug("[Kernel] Delivered action of trigger {} to agent {}", action.triggerId(), action.agentId());
    }

    public TriggerDefinition registerTrigger(TriggerDefinition definition) {
        haltGuard.ensureRunning();
        if (definition.getAgentId() != null && !definition.getAgentId().isBlank()) {
            requireAgent(AgentId.of(definition.getAgentId()));
        }
        String id = triggerScheduler.register(definition);
        try {
            auditLedger.append(AuditAction.TRIGGER_REGISTERED, definition.getAgentId(),
                    sanitizer.sanitize("trigger=" + id + " pattern=" + definition.getPattern().getKind()
                            + " max_fires=" + definition.getMaxFires()));
        } catch (AuditAppendException e) {
            triggerScheduler.unregister(id);
            throw e;
        }
        return triggerScheduler.get(id).orElseThrow();
    }

    public TriggerDefinition getTrigger(String triggerId) {
        return triggerScheduler.get(triggerId).orElseThrow(() -> new TriggerNotFoundException(triggerId));
    }

    public List<TriggerDefinition> listTriggers(String agentId) {
        return agentId != null && !agentId.isBlank()
                ? triggerScheduler.listForAgent(agentId)
                : triggerScheduler.list();
    }

    public TriggerDefinition removeTrigger(String triggerId) {
        haltGuard.ensureRunning();
        TriggerDefinition removed = triggerScheduler.unregister(triggerId);
        auditMutation(AuditAction.TRIGGER_REMOVED, removed.getAgentId(), "trigger=" + triggerId);
        return removed;
    }

    public TriggerDefinition setTriggerEnabled(String triggerId, boolean enabled) {
        haltGuard.ensureRunning();
        TriggerDefinition updated = triggerScheduler.setEnabled(triggerId, enabled);
        auditMutation(AuditAction.CONFIG_CHANGE, updated.getAgentId(),
                "trigger=" + triggerId + " enabled=" + enabled);
        return updated;
    }

    // ==================== LEDGER HEALTH ====================

    /**
     * Re-verify the audit chain and, if intact, lift a halt.
     *
     * @throws ChainBrokenException
     *             if the chain still does not verify; the kernel stays halted
     */
    public ChainVerification confirmLedgerHealth() {
        ChainVerification verification = auditLedger.checkChain();
        if (!verification.valid()) {
            haltGuard.halt("audit chain broken at sequence " + verification.brokenAtSequence());
            throw new ChainBrokenException(verification.brokenAtSequence(),
                    "Audit chain broken at sequence " + verification.brokenAtSequence());
        }
        boolean wasHalted = haltGuard.isHalted();
        haltGuard.resume();
        auditMutation(AuditAction.LEDGER_HEALTH_CONFIRMED, AuditEntry.SYSTEM_AGENT,
                "entries=" + verification.entriesChecked() + " resumed=" + wasHalted);
        log.info("[Kernel] Ledger health confirmed: {} entries", verification.entriesChecked());
        return verification;
    }

    // ==================== AUDIT QUERIES ====================

    public List<AuditEntry> queryAudit(AuditQuery query) {
        return auditLedger.query(query).toList();
    }

    public ChainVerification verifyAudit() {
        return auditLedger.checkChain();
    }

    public KernelStatus status() {
        return KernelStatus.builder()
                .halted(haltGuard.isHalted())
                .haltReason(haltGuard.currentHalt().map(KernelHaltGuard.Halt::reason).orElse(null))
                .haltedAt(haltGuard.currentHalt().map(KernelHaltGuard.Halt::since).orElse(null))
                .agents(registry.count())
                .triggers(triggerScheduler.count())
                .auditEntries(auditLedger.size())
                .auditTipHash(auditLedger.tipHash())
                .build();
    }

    // ==================== HELPERS ====================

    static long estimateTokens(String prompt) {
        if (prompt == null || prompt.isEmpty()) {
            return 0;
        }
        return (prompt.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    private AgentEntry requireAgent(AgentId id) {
        return registry.get(id).orElseThrow(() -> new AgentNotFoundException(String.valueOf(id)));
    }

    private AgentEntry requireRunning(AgentId id) {
        AgentEntry entry = requireAgent(id);
        if (!entry.isRunning()) {
            throw new IllegalStateException("Agent " + id + " is " + entry.getState() + ", not RUNNING");
        }
        return entry;
    }

    /**
     * Audit a state change that has already happened. If the entry cannot be
     * written the change is unaudited, so the kernel halts.
     */
    private AuditEntry auditMutation(AuditAction action, String agent, String detail) {
        try {
            return auditLedger.append(action, agent, sanitizer.sanitize(detail));
        } catch (AuditAppendException e) {
            String reason = action.getWireName() + " for " + agent + " could not be audited";
            haltGuard.halt(reason);
            throw new KernelHaltedException(reason, e);
        }
    }

    /**
     * Record a denial. A ledger failure here is attached to the denial rather
     * than replacing it, so the caller still sees why it was refused.
     */
    private void recordDenial(AuditAction action, String agent, String detail, KernelException denial) {
        try {
            auditLedger.append(action, agent, sanitizer.sanitize(detail));
        } catch (AuditAppendException e) {
            log.error("[Kernel] Failed to record {} for {}: {}", action.getWireName(), agent, e.getMessage());
            denial.addSuppressed(e);
        }
    }
}
