package me.golemcore.kernel.ratelimit;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.exception.QuotaExceededException;
import me.golemcore.kernel.domain.model.AgentId;
import me.golemcore.kernel.domain.model.AgentManifest;
import me.golemcore.kernel.domain.model.QuotaSnapshot;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-agent resource quotas: a rolling token budget and a bound on concurrent
 * tool calls.
 *
 * <p>
 * Each agent has its own lock; no operation touches more than one agent's
 * state, so agents never contend with each other and no budget is shared.
 *
 * <p>
 * Retiring an agent (on kill) refuses further consumption and acquisition with
 * {@link QuotaExceededException.Kind#AGENT_INACTIVE}. Slots already held stay
 * valid and release normally.
 */
@Component
@Slf4j
public class ResourceQuotaMeter {

    private final Clock clock;
    private final Duration window;
    private final Map<AgentId, AgentQuota> quotas = new ConcurrentHashMap<>();

    public ResourceQuotaMeter(KernelProperties properties, Clock clock) {
        this.clock = clock;
        this.window = properties.getQuota().getTokenWindow();
        log.info("[Quota] Token window: {}", window);
    }

    public void register(AgentId agentId, AgentManifest.ResourceLimits limits) {
        quotas.put(agentId, new AgentQuota(limits, new SlidingWindowTokenCounter(window)));
        log.debug("[Quota] Registered agent {}: tokens/window={}, concurrentTools={}",
                agentId, limits.getMaxLlmTokensPerHour(), limits.getMaxConcurrentTools());
    }

    /**
     * Apply new limits. Usage already recorded in the window is kept.
     */
    public void updateLimits(AgentId agentId, AgentManifest.ResourceLimits limits) {
        AgentQuota quota = require(agentId);
        quota.lock.lock();
        try {
            quota.limits = limits;
        } finally {
            quota.lock.unlock();
        }
        log.debug("[Quota] Updated limits for agent {}", agentId);
    }

    public void retire(AgentId agentId) {
        AgentQuota quota = quotas.remove(agentId);
        if (quota == null) {
            return;
        }
        quota.lock.lock();
        try {
            quota.active = false;
        } finally {
            quota.lock.unlock();
        }
        log.debug("[Quota] Retired agent {}", agentId);
    }

    /**
     * Record {@code tokens} against the agent's rolling budget.
     *
     * @throws QuotaExceededException
     *             if the window sum would exceed the budget
     */
    public void tryConsumeTokens(AgentId agentId, long tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("Token count must not be negative");
        }
        AgentQuota quota = require(agentId);
        quota.lock.lock();
        try {
            ensureActive(agentId, quota);
            Instant now = clock.instant();
            long limit = quota.limits.getMaxLlmTokensPerHour();
            if (!quota.tokens.tryAdd(now, tokens, limit)) {
                Duration retryAfter = quota.tokens.retryAfter(now, tokens, limit).orElse(null);
                log.warn("[Quota] Token budget exceeded: agent={}, requested={}, used={}, limit={}",
                        agentId, tokens, quota.tokens.used(now), limit);
                throw new QuotaExceededException(QuotaExceededException.Kind.TOKENS,
                        "Token budget exceeded: requested " + tokens + " with limit " + limit + " per window",
                        retryAfter);
            }
            log.trace("[Quota] Consumed {} tokens: agent={}", tokens, agentId);
        } finally {
            quota.lock.unlock();
        }
    }

    /**
     * Acquire one tool-concurrency slot. Never blocks.
     *
     * @throws QuotaExceededException
     *             if the agent already runs its maximum number of tools
     */
    public ToolSlot tryAcquireToolSlot(AgentId agentId) {
        AgentQuota quota = require(agentId);
        quota.lock.lock();
        try {
            ensureActive(agentId, quota);
            int max = quota.limits.getMaxConcurrentTools();
            if (quota.inFlight >= max) {
                log.warn("[Quota] Tool concurrency limit reached: agent={}, inFlight={}, max={}",
                        agentId, quota.inFlight, max);
                throw new QuotaExceededException(QuotaExceededException.Kind.TOOL_SLOTS,
                        "Concurrent tool limit reached (" + max + ")", null);
            }
            quota.inFlight++;
        } finally {
            quota.lock.unlock();
        }
        return new ToolSlot(agentId, () -> release(agentId, quota));
    }

    public Optional<QuotaSnapshot> snapshot(AgentId agentId) {
        AgentQuota quota = quotas.get(agentId);
        if (quota == null) {
            return Optional.empty();
        }
        quota.lock.lock();
        try {
            return Optional.of(new QuotaSnapshot(
                    quota.tokens.used(clock.instant()),
                    quota.limits.getMaxLlmTokensPerHour(),
                    quota.inFlight,
                    quota.limits.getMaxConcurrentTools(),
                    quota.active));
        } finally {
            quota.lock.unlock();
        }
    }

    private void release(AgentId agentId, AgentQuota quota) {
        quota.lock.lock();
        try {
            if (quota.inFlight > 0) {
                quota.inFlight--;
            }
        } finally {
            quota.lock.unlock();
        }
        log.trace("[Quota] Released tool slot: agent={}", agentId);
    }

    private AgentQuota require(AgentId agentId) {
        AgentQuota quota = quotas.get(agentId);
        if (quota == null) {
            throw new QuotaExceededException(QuotaExceededException.Kind.AGENT_INACTIVE,
                    "Agent " + agentId + " has no active quota", null);
        }
        return quota;
    }

    private static void ensureActive(AgentId agentId, AgentQuota quota) {
        if (!quota.active) {
            throw new QuotaExceededException(QuotaExceededException.Kind.AGENT_INACTIVE,
                    "Agent " + agentId + " is no longer active", null);
        }
    }

    private static final class AgentQuota {
        private final ReentrantLock lock = new ReentrantLock();
        private final SlidingWindowTokenCounter tokens;
        private AgentManifest.ResourceLimits limits;
        private int inFlight;
        private boolean active = true;

        private AgentQuota(AgentManifest.ResourceLimits limits, SlidingWindowTokenCounter tokens) {
            this.limits = limits;
            this.tokens = tokens;
        }
    }
}
