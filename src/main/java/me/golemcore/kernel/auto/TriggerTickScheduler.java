package me.golemcore.kernel.auto;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.model.FiredAction;
import me.golemcore.kernel.domain.model.KernelEvent;
import me.golemcore.kernel.domain.service.KernelService;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background clock for schedule triggers.
 *
 * <p>
 * Publishes a {@code ScheduleTick} event to the kernel at the configured
 * interval ({@code kernel.triggers.tick-interval}). Whether a schedule trigger
 * is due is decided by the trigger scheduler from the tick time, so a late or
 * skipped tick fires each overdue trigger once, not once per missed slot.
 *
 * <p>
 * Ticks never overlap: while one is being processed, later ticks are skipped.
 */
@Component
@Slf4j
public class TriggerTickScheduler {

    private final KernelService kernelService;
    private final KernelProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public TriggerTickScheduler(KernelService kernelService, KernelProperties properties, Clock clock) {
        this.kernelService = kernelService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getTriggers().isEnabled()) {
            log.info("[TriggerTick] Triggers disabled, schedule ticks not started");
            return;
        }
        Duration interval = properties.getTriggers().getTickInterval();
        long intervalMillis = interval != null && !interval.isNegative() && !interval.isZero()
                ? interval.toMillis()
                : 1000L;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kernel-trigger-tick");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[TriggerTick] Started with interval {} ms", intervalMillis);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[TriggerTick] Stopped");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[TriggerTick] Tick skipped: previous tick still in progress");
            return;
        }
        try {
            List<FiredAction> fired = kernelService.publishEvent(KernelEvent.scheduleTick(clock.instant()));
            if (!fired.isEmpty()) {
                log.debug("[TriggerTick] {} schedule trigger(s) fired", fired.size());
            }
        } catch (Exception e) {
            log.error("[TriggerTick] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    boolean isRunning() {
        return tickTask != null && !tickTask.isCancelled();
    }
}
