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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.exception.AgentNotFoundException;
import me.golemcore.kernel.domain.exception.SpawnException;
import me.golemcore.kernel.domain.model.AgentEntry;
import me.golemcore.kernel.domain.model.AgentId;
import me.golemcore.kernel.domain.model.AgentManifest;
import me.golemcore.kernel.domain.model.AgentState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Authoritative table of live agents.
 *
 * <p>
 * All mutations go through a single write lock; readers take the read lock and
 * always receive immutable {@link AgentEntry} snapshots, so a reader never
 * observes a half-built entry or a dangling parent/child link. Ids of killed
 * agents are remembered and never handed out again.
 */
@Service
@Slf4j
public class AgentRegistry {

    private final Clock clock;
    private final Supplier<AgentId> idGenerator;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<AgentId, AgentEntry> live = new HashMap<>();
    private final Set<AgentId> retiredIds = new HashSet<>();

    @Autowired
    public AgentRegistry(Clock clock) {
        this(clock, AgentId::random);
    }

    AgentRegistry(Clock clock, Supplier<AgentId> idGenerator) {
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    /**
     * Create a live agent in RUNNING state, linked under {@code parent} when
     * given.
     *
     * @throws SpawnException
     *             INVALID_MANIFEST when no manifest is given, PARENT_NOT_FOUND
     *             when the parent is not live
     */
    public AgentId spawn(AgentManifest manifest, AgentId parent) {
        if (manifest == null || manifest.getName() == null || manifest.getName().isBlank()) {
            throw new SpawnException(SpawnException.Kind.INVALID_MANIFEST, "A named manifest is required");
        }
        lock.writeLock().lock();
        try {
            AgentEntry parentEntry = null;
            if (parent != null) {
                parentEntry = live.get(parent);
                if (parentEntry == null) {
                    throw new SpawnException(SpawnException.Kind.PARENT_NOT_FOUND, "Parent agent not found: " + parent);
                }
            }

            AgentId id = nextId();
            Instant now = clock.instant();
            AgentEntry entry = AgentEntry.builder()
                    .id(id)
                    .name(manifest.getName())
                    .manifest(manifest)
                    .state(AgentState.SPAWNING)
                    .parent(parent)
                    .children(List.of())
                    .createdAt(now)
                    .lastActiveAt(now)
                    .build();
            live.put(id, entry.toBuilder().state(AgentState.RUNNING).build());

            if (parentEntry != null) {
                List<AgentId> children = new ArrayList<>(parentEntry.getChildren());
                children.add(id);
                live.put(parent, parentEntry.toBuilder().children(List.copyOf(children)).build());
            }
            log.info("[Registry] Spawned agent {} ({}){}", manifest.getName(), id,
                    parent != null ? " under " + parent : "");
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a live agent. Its children are orphaned, not killed.
     *
     * @return the final snapshot of the agent, in KILLED state
     * @throws AgentNotFoundException
     *             if the agent is not live (including a second kill)
     */
    public AgentEntry kill(AgentId id) {
        lock.writeLock().lock();
        try {
            AgentEntry entry = live.remove(id);
            if (entry == null) {
                throw new AgentNotFoundException(String.valueOf(id));
            }
            retiredIds.add(id);

            entry.getParentId().ifPresent(parentId -> {
                AgentEntry parentEntry = live.get(parentId);
                if (parentEntry != null) {
                    List<AgentId> children = new ArrayList<>(parentEntry.getChildren());
                    children.remove(id);
                    live.put(parentId, parentEntry.toBuilder().children(List.copyOf(children)).build());
                }
            });
            for (AgentId childId : entry.getChildren()) {
                AgentEntry child = live.get(childId);
                if (child != null) {
                    live.put(childId, child.toBuilder().parent(null).build());
                }
            }

            AgentEntry killed = entry.toBuilder()
                    .state(AgentState.KILLED)
                    .children(List.of())
                    .lastActiveAt(clock.instant())
                    .build();
            log.info("[Registry] Killed agent {} ({}), orphaned {} children", entry.getName(), id,
                    entry.getChildren().size());
            return killed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Move a live agent to {@code target}. KILLED is reached only through
     * {@link #kill(AgentId)}.
     *
     * @throws IllegalStateException
     *             if the transition is not allowed from the current state
     */
    public AgentEntry transition(AgentId id, AgentState target) {
        if (target == AgentState.KILLED) {
            return kill(id);
        }
        lock.writeLock().lock();
        try {
            AgentEntry entry = requireLive(id);
            if (!entry.getState().canTransitionTo(target)) {
                throw new IllegalStateException(
                        "Illegal transition for agent " + id + ": " + entry.getState() + " -> " + target);
            }
            AgentEntry updated = entry.toBuilder()
                    .state(target)
                    .lastActiveAt(clock.instant())
                    .build();
            live.put(id, updated);
            log.info("[Registry] Agent {} ({}): {} -> {}", entry.getName(), id, entry.getState(), target);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public AgentEntry pause(AgentId id) {
        return transition(id, AgentState.PAUSED);
    }

    public AgentEntry resume(AgentId id) {
        return transitionFrom(id, AgentState.PAUSED, AgentState.RUNNING);
    }

    public AgentEntry markErrored(AgentId id) {
        return transition(id, AgentState.ERRORED);
    }

    public AgentEntry recover(AgentId id) {
        return transitionFrom(id, AgentState.ERRORED, AgentState.RUNNING);
    }

    private AgentEntry transitionFrom(AgentId id, AgentState expected, AgentState target) {
        lock.writeLock().lock();
        try {
            AgentState current = requireLive(id).getState();
            if (current != expected) {
                throw new IllegalStateException("Agent " + id + " is not " + expected + ": " + current);
            }
            return transition(id, target);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Swap in a new manifest. The agent's name is its identity for operators and
     * cannot change.
     */
    public AgentEntry replaceManifest(AgentId id, AgentManifest manifest) {
        lock.writeLock().lock();
        try {
            AgentEntry entry = requireLive(id);
            if (!entry.getName().equals(manifest.getName())) {
                throw new IllegalArgumentException("Manifest name cannot change from '" + entry.getName() + "'");
            }
            AgentEntry updated = entry.toBuilder()
                    .manifest(manifest)
                    .lastActiveAt(clock.instant())
                    .build();
            live.put(id, updated);
            log.info("[Registry] Replaced manifest of agent {} ({})", entry.getName(), id);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void touch(AgentId id) {
        lock.writeLock().lock();
        try {
            AgentEntry entry = live.get(id);
            if (entry != null) {
                live.put(id, entry.toBuilder().lastActiveAt(clock.instant()).build());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<AgentEntry> get(AgentId id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(live.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AgentEntry> list() {
        lock.readLock().lock();
        try {
            return live.values().stream()
                    .sorted(Comparator.comparing(AgentEntry::getCreatedAt)
                            .thenComparing(entry -> entry.getId().value()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AgentEntry> findByName(String name) {
        return list().stream()
                .filter(entry -> entry.getName().equals(name))
                .findFirst();
    }

    public List<AgentEntry> children(AgentId id) {
        lock.readLock().lock();
        try {
            AgentEntry entry = requireLive(id);
            return entry.getChildren().stream()
                    .map(live::get)
                    .filter(Objects::nonNull)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return live.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean wasKilled(AgentId id) {
        lock.readLock().lock();
        try {
            return retiredIds.contains(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    private AgentEntry requireLive(AgentId id) {
        AgentEntry entry = live.get(id);
        if (entry == null) {
            throw new AgentNotFoundException(String.valueOf(id));
        }
        return entry;
    }

    private AgentId nextId() {
        AgentId id = idGenerator.get();
        while (live.containsKey(id) || retiredIds.contains(id)) {
            log.debug("[Registry] Generated id {} already used, regenerating", id);
            id = idGenerator.get();
        }
        return id;
    }
}
