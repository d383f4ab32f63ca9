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
import me.golemcore.kernel.domain.exception.KernelHaltedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Kernel-wide mutation gate. Once halted (a registry change could not be
 * audited, or the ledger failed verification) every mutating operation is
 * refused until an operator confirms ledger health.
 */
@Component
@Slf4j
public class KernelHaltGuard {

    private final Clock clock;
    private final AtomicReference<Halt> halt = new AtomicReference<>();

    public KernelHaltGuard(Clock clock) {
        this.clock = clock;
    }

    /**
     * Halt the kernel. The first reason is kept when already halted.
     */
    public void halt(String reason) {
        if (halt.compareAndSet(null, new Halt(reason, clock.instant()))) {
            log.error("[Kernel] HALTED: {}. Mutations refused until ledger health is confirmed", reason);
        }
    }

    /**
     * @throws KernelHaltedException
     *             if the kernel is halted
     */
    public void ensureRunning() {
        Halt current = halt.get();
        if (current != null) {
            throw new KernelHaltedException(current.reason());
        }
    }

    public boolean isHalted() {
        return halt.get() != null;
    }

    public Optional<Halt> currentHalt() {
        return Optional.ofNullable(halt.get());
    }

    void resume() {
        Halt previous = halt.getAndSet(null);
        if (previous != null) {
            log.warn("[Kernel] Resumed after halt: {}", previous.reason());
        }
    }

    public record Halt(String reason, Instant since) {
    }
}
