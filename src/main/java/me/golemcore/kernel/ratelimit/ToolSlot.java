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

import me.golemcore.kernel.domain.model.AgentId;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held tool-concurrency slot. Closing it releases the slot exactly once, no
 * matter how many times {@link #close()} is called; use it with
 * try-with-resources so every exit path releases.
 */
public final class ToolSlot implements AutoCloseable {

    private final AgentId agentId;
    private final Runnable release;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ToolSlot(AgentId agentId, Runnable release) {
        this.agentId = agentId;
        this.release = release;
    }

    public AgentId getAgentId() {
        return agentId;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            release.run();
        }
    }
}
