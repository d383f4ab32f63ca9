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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Rolling-window ledger of token consumption.
 *
 * <p>
 * Entries whose age is greater than or equal to the window are pruned before
 * every admission decision, so the window sum only counts consumption inside
 * {@code (now - window, now]}. Not thread-safe: the owning meter serializes
 * access per agent.
 */
public class SlidingWindowTokenCounter {

    private final Duration window;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private long windowSum;

    public SlidingWindowTokenCounter(Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.window = window;
    }

    /**
     * Admit {@code tokens} if the window sum stays within {@code limit}.
     *
     * @return true if recorded
     */
    public boolean tryAdd(Instant now, long tokens, long limit) {
        prune(now);
        if (tokens > limit - windowSum) {
            return false;
        }
        if (tokens > 0) {
            entries.addLast(new Entry(now, tokens));
            windowSum += tokens;
        }
        return true;
    }

    /**
     * Time until {@code tokens} could be admitted, or empty if they never fit
     * under {@code limit}.
     */
    public Optional<Duration> retryAfter(Instant now, long tokens, long limit) {
        if (tokens > limit) {
            return Optional.empty();
        }
        prune(now);
        long remaining = windowSum;
        for (Entry entry : entries) {
            if (tokens <= limit - remaining) {
                break;
            }
            remaining -= entry.tokens();
            Instant expiresAt = entry.at().plus(window);
            if (tokens <= limit - remaining) {
                Duration wait = Duration.between(now, expiresAt);
                return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
            }
        }
        return Optional.of(Duration.ZERO);
    }

    public long used(Instant now) {
        prune(now);
        return windowSum;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!entries.isEmpty() && !entries.peekFirst().at().isAfter(cutoff)) {
            windowSum -= entries.removeFirst().tokens();
        }
    }

    private record Entry(Instant at, long tokens) {
    }
}
