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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.exception.AuditAppendException;
import me.golemcore.kernel.domain.exception.ChainBrokenException;
import me.golemcore.kernel.domain.model.AuditAction;
import me.golemcore.kernel.domain.model.AuditEntry;
import me.golemcore.kernel.domain.model.AuditQuery;
import me.golemcore.kernel.domain.model.ChainVerification;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import me.golemcore.kernel.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Append-only, hash-chained audit log.
 *
 * <p>
 * {@link #append} is the single mutation point and is serialized by the write
 * lock, so sequence numbers are dense and every entry links to its immediate
 * predecessor. An entry is written to storage ({@code audit/ledger.jsonl}, one
 * JSON object per line) before it becomes visible to readers; if the write
 * fails the chain is unchanged.
 *
 * <p>
 * The ledger stores detail text as given. Callers pass it through
 * {@code AuditDetailSanitizer} first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLedger {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final KernelProperties properties;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<AuditEntry> entries = new ArrayList<>();
    private Long unreadableAtSequence;

    @PostConstruct
    public void init() {
        String text;
        try {
            text = storagePort.getText(directory(), file()).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read audit ledger", e.getCause());
        }
        lock.writeLock().lock();
        try {
            entries.clear();
            unreadableAtSequence = null;
            if (text != null) {
                load(text);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Audit] Ledger loaded: {} entries, tip={}", size(), abbreviate(tipHash()));
    }

    private void load(String text) {
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, AuditEntry.class));
            } catch (JsonProcessingException e) {
                unreadableAtSequence = (long) entries.size();
                log.error("[Audit] Unreadable ledger line at sequence {}, loading stopped", unreadableAtSequence);
                return;
            }
        }
    }

    /**
     * Append one entry to the chain.
     *
     * @return the persisted entry
     * @throws AuditAppendException
     *             if the entry could not be persisted; the chain is unchanged
     */
    public AuditEntry append(AuditAction action, String agent, String detail) {
        Objects.requireNonNull(action, "action");
        String agentColumn = agent != null ? agent : AuditEntry.SYSTEM_AGENT;
        String detailColumn = detail != null ? detail : "";

        lock.writeLock().lock();
        try {
            long sequence = entries.size();
            String previousHash = tipHashUnlocked();
            Instant timestamp = clock.instant();
            AuditEntry entry = AuditEntry.builder()
                    .sequence(sequence)
                    .timestamp(timestamp)
                    .action(action)
                    .agent(agentColumn)
                    .detail(detailColumn)
                    .tipHash(AuditEntryHasher.hash(previousHash, sequence, timestamp, action, agentColumn,
                            detailColumn))
                    .build();

            persist(entry);
            entries.add(entry);
            log.debug("[Audit] #{} {} agent={}", sequence, action.getWireName(), agentColumn);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void persist(AuditEntry entry) {
        String line;
        try {
            line = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new AuditAppendException("Failed to serialize audit entry " + entry.getSequence(), e);
        }
        try {
            storagePort.appendLine(directory(), file(), line).join();
        } catch (CompletionException | IllegalArgumentException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("[Audit] Failed to persist entry #{}: {}", entry.getSequence(), cause.getMessage());
            throw new AuditAppendException("Failed to persist audit entry " + entry.getSequence(), cause);
        }
    }

    /**
     * Recompute the chain from sequence 0.
     *
     * @throws ChainBrokenException
     *             at the first position whose sequence, linkage or hash does
     *             not match
     */
    public void verifyChain() {
        ChainVerification result = checkChain();
        if (!result.valid()) {
            throw new ChainBrokenException(result.brokenAtSequence(),
                    "Audit chain broken at sequence " + result.brokenAtSequence());
        }
    }

    /**
     * Non-throwing form of {@link #verifyChain()} for status views.
     */
    public ChainVerification checkChain() {
        List<AuditEntry> snapshot;
        Long unreadable;
        lock.readLock().lock();
        try {
            snapshot = List.copyOf(entries);
            unreadable = unreadableAtSequence;
        } finally {
            lock.readLock().unlock();
        }

        String previousHash = AuditEntryHasher.GENESIS_HASH;
        for (int i = 0; i < snapshot.size(); i++) {
            AuditEntry entry = snapshot.get(i);
            if (entry.getSequence() != i
                    || entry.getTipHash() == null
                    || !AuditEntryHasher.hash(previousHash, entry).equals(entry.getTipHash())) {
                log.error("[Audit] Chain broken at sequence {}", i);
                return ChainVerification.broken(i, i, previousHash);
            }
            previousHash = entry.getTipHash();
        }
        if (unreadable != null) {
            log.error("[Audit] Chain broken at sequence {} (unreadable entry)", unreadable);
            return ChainVerification.broken(unreadable, snapshot.size(), previousHash);
        }
        return ChainVerification.ok(snapshot.size(), previousHash);
    }

    /**
     * Entries matching {@code query}, ascending by sequence. The stream is over
     * a snapshot; call again for a fresh view.
     */
    public Stream<AuditEntry> query(AuditQuery query) {
        AuditQuery effective = query != null ? query : AuditQuery.all();
        Stream<AuditEntry> stream = snapshot().stream().filter(effective::matches);
        return effective.getLimit() > 0 ? stream.limit(effective.getLimit()) : stream;
    }

    /**
     * The last {@code n} entries, ascending.
     */
    public List<AuditEntry> tail(int n) {
        List<AuditEntry> snapshot = snapshot();
        int from = Math.max(0, snapshot.size() - Math.max(0, n));
        return snapshot.subList(from, snapshot.size());
    }

    public long size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String tipHash() {
        lock.readLock().lock();
        try {
            return tipHashUnlocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<AuditEntry> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    private String tipHashUnlocked() {
        return entries.isEmpty() ? AuditEntryHasher.GENESIS_HASH : entries.get(entries.size() - 1).getTipHash();
    }

    private String directory() {
        return properties.getAudit().getDirectory();
    }

    private String file() {
        return properties.getAudit().getFile();
    }

    private static String abbreviate(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
