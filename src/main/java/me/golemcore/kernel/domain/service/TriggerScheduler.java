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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.exception.AuditAppendException;
import me.golemcore.kernel.domain.exception.InvalidTriggerPatternException;
import me.golemcore.kernel.domain.exception.TriggerNotFoundException;
import me.golemcore.kernel.domain.model.AgentId;
import me.golemcore.kernel.domain.model.AgentState;
import me.golemcore.kernel.domain.model.AuditAction;
import me.golemcore.kernel.domain.model.FiredAction;
import me.golemcore.kernel.domain.model.KernelEvent;
import me.golemcore.kernel.domain.model.TriggerDefinition;
import me.golemcore.kernel.domain.model.TriggerPattern;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import me.golemcore.kernel.port.outbound.StoragePort;
import me.golemcore.kernel.security.AuditDetailSanitizer;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pattern-matched triggers: standing rules that turn kernel events into
 * prompts for their owning agent.
 *
 * <p>
 * Firing a trigger is one critical section under the trigger's own lock:
 * check {@code fireCount < maxFires}, append {@code TRIGGER_FIRED} to the audit
 * ledger, then increment. If the audit append fails the count stays unchanged
 * and no action is emitted, so concurrent events can never push a trigger past
 * its limit and every emitted action has an audit record.
 *
 * <p>
 * Schedule triggers fire when a tick's time is at or after their next cron
 * boundary; the next boundary is then computed from the tick time, so a
 * trigger that missed several boundaries during downtime fires once.
 *
 * <p>
 * Definitions are persisted to {@code triggers/triggers.json}.
 */
@Service
@Slf4j
public class TriggerScheduler {

    private static final String WILDCARD = "*";
    private static final String DEFAULT_TEMPLATE = "Trigger fired: {{event}}";
    private static final int CRON_FIELDS = 6;
    private static final int SHORT_CRON_FIELDS = 5;
    private static final TypeReference<List<TriggerDefinition>> DEFINITION_LIST = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final KernelProperties properties;
    private final AuditLedger auditLedger;
    private final AuditDetailSanitizer sanitizer;
    private final Clock clock;

    private final Map<String, TriggerState> triggers = new ConcurrentHashMap<>();
    private final Object persistLock = new Object();

    public TriggerScheduler(StoragePort storagePort, ObjectMapper objectMapper, KernelProperties properties,
            AuditLedger auditLedger, AuditDetailSanitizer sanitizer, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.auditLedger = auditLedger;
        this.sanitizer = sanitizer;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        String json;
        try {
            json = storagePort.getText(directory(), file()).join();
        } catch (CompletionException e) {
            log.warn("[Triggers] Failed to read trigger definitions: {}", e.getCause().getMessage());
            return;
        }
        if (json == null || json.isBlank()) {
            return;
        }
        List<TriggerDefinition> definitions;
        try {
            definitions = objectMapper.readValue(json, DEFINITION_LIST);
        } catch (JsonProcessingException e) {
            log.error("[Triggers] Trigger definitions file is malformed, starting with none: {}",
                    e.getOriginalMessage());
            return;
        }
        for (TriggerDefinition definition : definitions) {
            if (definition.getId() == null || definition.getAgentId() == null) {
                log.warn("[Triggers] Skipping stored trigger without id or owner");
                continue;
            }
            if (definition.getCreatedAt() == null) {
                definition.setCreatedAt(clock.instant());
            }
            definition.setPattern(copy(definition.getPattern()));
            try {
                TriggerState state = compile(definition);
                if (definition.getPattern().getKind() == TriggerPattern.Kind.SCHEDULE
                        && definition.getNextFireAt() == null) {
                    definition.setNextFireAt(nextBoundary(state.cron, clock.instant()));
                }
                triggers.put(definition.getId(), state);
            } catch (InvalidTriggerPatternException e) {
                log.warn("[Triggers] Skipping stored trigger {}: {}", definition.getId(), e.getMessage());
            }
        }
        log.info("[Triggers] Loaded {} trigger(s)", triggers.size());
    }

    /**
     * Validate, compile and store a trigger.
     *
     * @return the trigger id
     * @throws InvalidTriggerPatternException
     *             if the pattern or its parameter is invalid
     */
    public String register(TriggerDefinition request) {
        if (request == null || request.getAgentId() == null || request.getAgentId().isBlank()) {
            throw new InvalidTriggerPatternException("Trigger must name an owning agent");
        }
        if (request.getMaxFires() < 0) {
            throw new InvalidTriggerPatternException("maxFires must not be negative");
        }
        Instant now = clock.instant();
        TriggerDefinition definition = request.toBuilder()
                .id(request.getId() != null && !request.getId().isBlank() ? request.getId()
                        : UUID.randomUUID().toString())
                .pattern(copy(request.getPattern()))
                .fireCount(0)
                .createdAt(now)
                .lastFiredAt(null)
                .nextFireAt(null)
                .build();
        TriggerState state = compile(definition);
        if (state.cron != null) {
            definition.setNextFireAt(nextBoundary(state.cron, now));
        }
        if (triggers.putIfAbsent(definition.getId(), state) != null) {
            throw new InvalidTriggerPatternException("Trigger id already exists: " + definition.getId());
        }
        persist();
        log.info("[Triggers] Registered trigger {} ({}) for agent {}", definition.getId(),
                describePattern(definition.getPattern()), definition.getAgentId());
        return definition.getId();
    }

    /**
     * @throws TriggerNotFoundException
     *             if no trigger has this id
     */
    public TriggerDefinition unregister(String id) {
        TriggerState state = id != null ? triggers.remove(id) : null;
        if (state == null) {
            throw new TriggerNotFoundException(id);
        }
        state.lock.lock();
        try {
            state.removed = true;
        } finally {
            state.lock.unlock();
        }
        persist();
        log.info("[Triggers] Removed trigger {}", id);
        return snapshot(state);
    }

    /**
     * Remove every trigger owned by {@code agentId}.
     *
     * @return ids of removed triggers
     */
    public List<String> removeForAgent(String agentId) {
        List<String> removed = new ArrayList<>();
        for (TriggerState state : triggers.values()) {
            if (agentId.equals(state.definition.getAgentId()) && triggers.remove(state.definition.getId(), state)) {
                state.lock.lock();
                try {
                    state.removed = true;
                } finally {
                    state.lock.unlock();
                }
                removed.add(state.definition.getId());
            }
        }
        if (!removed.isEmpty()) {
            persist();
            log.info("[Triggers] Removed {} trigger(s) of agent {}", removed.size(), agentId);
        }
        return removed;
    }

    public TriggerDefinition setEnabled(String id, boolean enabled) {
        TriggerState state = require(id);
        state.lock.lock();
        try {
            state.definition.setEnabled(enabled);
            if (enabled && state.cron != null) {
                state.definition.setNextFireAt(nextBoundary(state.cron, clock.instant()));
            }
        } finally {
            state.lock.unlock();
        }
        persist();
        log.info("[Triggers] Trigger {} {}", id, enabled ? "enabled" : "disabled");
        return snapshot(state);
    }

    public Optional<TriggerDefinition> get(String id) {
        TriggerState state = id != null ? triggers.get(id) : null;
        return state != null ? Optional.of(snapshot(state)) : Optional.empty();
    }

    public List<TriggerDefinition> list() {
        return triggers.values().stream()
                .map(this::snapshot)
                .sorted(Comparator.comparing(TriggerDefinition::getCreatedAt)
                        .thenComparing(TriggerDefinition::getId))
                .toList();
    }

    public List<TriggerDefinition> listForAgent(String agentId) {
        return list().stream()
                .filter(definition -> definition.getAgentId().equals(agentId))
                .toList();
    }

    public int count() {
        return triggers.size();
    }

    /**
     * Evaluate every trigger against {@code event} and fire those that match.
     *
     * @return fired actions, in trigger creation order
     */
    public List<FiredAction> onEvent(KernelEvent event) {
        if (!properties.getTriggers().isEnabled() || event == null) {
            return List.of();
        }
        List<TriggerState> candidates = triggers.values().stream()
                .sorted(Comparator.comparing((TriggerState state) -> state.definition.getCreatedAt())
                        .thenComparing(state -> state.definition.getId()))
                .toList();

        List<FiredAction> fired = new ArrayList<>();
        for (TriggerState state : candidates) {
            tryFire(state, event).ifPresent(fired::add);
        }
        if (!fired.isEmpty()) {
            persist();
        }
        return fired;
    }

    private Optional<FiredAction> tryFire(TriggerState state, KernelEvent event) {
        state.lock.lock();
        try {
            TriggerDefinition definition = state.definition;
            if (state.removed || !definition.isEnabled() || definition.isExhausted() || !matches(state, event)) {
                return Optional.empty();
            }
            long fireNumber = definition.getFireCount() + 1;
            try {
                auditLedger.append(AuditAction.TRIGGER_FIRED, definition.getAgentId(),
                        sanitizer.sanitize("trigger=" + definition.getId()
                                + " pattern=" + definition.getPattern().getKind()
                                + " event=" + event.describe()
                                + " fire=" + fireNumber));
            } catch (AuditAppendException e) {
                log.error("[Triggers] Trigger {} not fired, audit append failed: {}", definition.getId(),
                        e.getMessage());
                return Optional.empty();
            }

            Instant firedAt = event.getTimestamp() != null ? event.getTimestamp() : clock.instant();
            definition.setFireCount(fireNumber);
            definition.setLastFiredAt(firedAt);
            if (state.cron != null) {
                definition.setNextFireAt(nextBoundary(state.cron, firedAt));
            }
            log.debug("[Triggers] Trigger {} fired (#{}) on {}", definition.getId(), fireNumber, event.getType());
            return Optional.of(new FiredAction(definition.getId(),
                    AgentId.of(definition.getAgentId()),
                    render(definition, event), fireNumber, event.getType(), firedAt));
        } finally {
            state.lock.unlock();
        }
    }

    private boolean matches(TriggerState state, KernelEvent event) {
        TriggerPattern pattern = state.definition.getPattern();
        String param = pattern.getParam();
        return switch (pattern.getKind()) {
        case LIFECYCLE -> event.getType() == KernelEvent.Type.LIFECYCLE
                && event.getLifecycleState() != null
                && (WILDCARD.equals(param) || param.equalsIgnoreCase(event.getLifecycleState().name()));
        case AGENT_SPAWNED -> event.getType() == KernelEvent.Type.AGENT_SPAWNED
                && (WILDCARD.equals(param) || param.equals(event.getAgentName()));
        case CONTENT_MATCH -> event.hasText() && matchesContent(state, event.getContent());
        case SCHEDULE -> event.getType() == KernelEvent.Type.SCHEDULE_TICK
                && state.definition.getNextFireAt() != null
                && event.getTimestamp() != null
                && !event.getTimestamp().isBefore(state.definition.getNextFireAt());
        case WEBHOOK -> event.getType() == KernelEvent.Type.WEBHOOK
                && event.getWebhookToken() != null
                && MessageDigest.isEqual(param.getBytes(StandardCharsets.UTF_8),
                        event.getWebhookToken().getBytes(StandardCharsets.UTF_8));
        case CHANNEL_MESSAGE -> event.getType() == KernelEvent.Type.CHANNEL_MESSAGE
                && (WILDCARD.equals(param) || param.equalsIgnoreCase(event.getChannelType()));
        };
    }

    private boolean matchesContent(TriggerState state, String content) {
        String text = truncate(content, properties.getTriggers().getMaxContentLength());
        try {
            return state.regex.matcher(text).find();
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("[Triggers] Content match failed for trigger {}, treated as no match: {}",
                    state.definition.getId(), e.getClass().getSimpleName());
            return false;
        }
    }

    private String render(TriggerDefinition definition, KernelEvent event) {
        String template = definition.getPromptTemplate() != null && !definition.getPromptTemplate().isBlank()
                ? definition.getPromptTemplate()
                : DEFAULT_TEMPLATE;
        String agent = event.getAgentName() != null ? event.getAgentName()
                : event.getAgentId() != null ? event.getAgentId().value() : "";
        String content = event.getContent() != null
                ? truncate(event.getContent(), properties.getTriggers().getMaxContentLength())
                : "";
        return template
                .replace("{{event}}", event.describe())
                .replace("{{agent}}", agent)
                .replace("{{channel}}", event.getChannelType() != null ? event.getChannelType() : "")
                .replace("{{content}}", content);
    }

    private TriggerState compile(TriggerDefinition definition) {
        TriggerPattern pattern = definition.getPattern();
        if (pattern == null || pattern.getKind() == null) {
            throw new InvalidTriggerPatternException("Trigger pattern kind is required");
        }
        String param = pattern.getParam();
        if (param == null || param.isBlank()) {
            throw new InvalidTriggerPatternException(pattern.getKind() + " pattern requires a parameter");
        }
        Pattern regex = null;
        CronExpression cron = null;
        switch (pattern.getKind()) {
        case LIFECYCLE -> {
            if (!WILDCARD.equals(param)) {
                try {
                    AgentState.valueOf(param.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new InvalidTriggerPatternException("Unknown lifecycle state: " + param, e);
                }
            }
        }
        case CONTENT_MATCH -> {
            try {
                regex = Pattern.compile(param);
            } catch (PatternSyntaxException e) {
                throw new InvalidTriggerPatternException("Invalid content pattern: " + e.getDescription(), e);
            }
        }
        case SCHEDULE -> cron = parseCron(param);
        case AGENT_SPAWNED, WEBHOOK, CHANNEL_MESSAGE -> {
            // matched by plain comparison
        }
        }
        return new TriggerState(definition, regex, cron);
    }

    static CronExpression parseCron(String expression) {
        String trimmed = expression.trim();
        String normalized = trimmed;
        if (!trimmed.startsWith("@")) {
            int fields = trimmed.split("\\s+").length;
            if (fields == SHORT_CRON_FIELDS) {
                normalized = "0 " + trimmed;
            } else if (fields != CRON_FIELDS) {
                throw new InvalidTriggerPatternException(
                        "Cron expression must have 5 or 6 fields, got " + fields + ": " + expression);
            }
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidTriggerPatternException("Invalid cron expression: " + expression, e);
        }
    }

    private static Instant nextBoundary(CronExpression cron, Instant after) {
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, ZoneOffset.UTC));
        return next != null ? next.toInstant() : null;
    }

    private void persist() {
        synchronized (persistLock) {
            List<TriggerDefinition> definitions = list();
            try {
                String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(definitions);
                storagePort.putTextAtomic(directory(), file(), json, true).join();
            } catch (JsonProcessingException | CompletionException e) {
                log.warn("[Triggers] Failed to persist trigger definitions: {}", e.getMessage());
            }
        }
    }

    private TriggerState require(String id) {
        TriggerState state = id != null ? triggers.get(id) : null;
        if (state == null) {
            throw new TriggerNotFoundException(id);
        }
        return state;
    }

    private TriggerDefinition snapshot(TriggerState state) {
        state.lock.lock();
        try {
            return state.definition.toBuilder()
                    .pattern(copy(state.definition.getPattern()))
                    .build();
        } finally {
            state.lock.unlock();
        }
    }

    private static TriggerPattern copy(TriggerPattern pattern) {
        if (pattern == null) {
            return null;
        }
        String param = pattern.getParam();
        // regexes and tokens are kept verbatim, names and states are trimmed
        if (param != null && pattern.getKind() != null && pattern.getKind() != TriggerPattern.Kind.CONTENT_MATCH
                && pattern.getKind() != TriggerPattern.Kind.WEBHOOK) {
            param = param.trim();
        }
        return TriggerPattern.of(pattern.getKind(), param);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String describePattern(TriggerPattern pattern) {
        if (pattern.getKind() == TriggerPattern.Kind.WEBHOOK) {
            return "WEBHOOK";
        }
        String param = pattern.getParam();
        return pattern.getKind() + " '" + (param.length() <= 40 ? param : param.substring(0, 40) + "...") + "'";
    }

    private String directory() {
        return properties.getTriggers().getDirectory();
    }

    private String file() {
        return properties.getTriggers().getFile();
    }

    private static final class TriggerState {
        private final ReentrantLock lock = new ReentrantLock();
        private final TriggerDefinition definition;
        private final Pattern regex;
        private final CronExpression cron;
        private boolean removed;

        private TriggerState(TriggerDefinition definition, Pattern regex, CronExpression cron) {
            this.definition = definition;
            this.regex = regex;
            this.cron = cron;
        }
    }
}
