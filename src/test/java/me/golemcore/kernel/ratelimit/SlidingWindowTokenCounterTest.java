package me.golemcore.kernel.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowTokenCounterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldAdmitUpToLimitAndRejectBeyond() {
        SlidingWindowTokenCounter counter = new SlidingWindowTokenCounter(Duration.ofHours(1));

        assertTrue(counter.tryAdd(T0, 600, 1000));
        assertTrue(counter.tryAdd(T0.plusSeconds(10), 400, 1000));
        assertFalse(counter.tryAdd(T0.plusSeconds(20), 1, 1000));
        assertEquals(1000, counter.used(T0.plusSeconds(20)));
    }

    @Test
    void shouldNotRecordRejectedRequest() {
        SlidingWindowTokenCounter counter = new SlidingWindowTokenCounter(Duration.ofHours(1));
        counter.tryAdd(T0, 900, 1000);

        assertFalse(counter.tryAdd(T0, 200, 1000));
        assertEquals(900, counter.used(T0));
    }

    @Test
    void shouldForgetUsageOnceItLeavesTheWindow() {
        SlidingWindowTokenCounter counter = new SlidingWindowTokenCounter(Duration.ofHours(1));
        counter.tryAdd(T0, 1000, 1000);

        assertFalse(counter.tryAdd(T0.plus(Duration.ofMinutes(59)), 1, 1000));
        assertTrue(counter.tryAdd(T0.plus(Duration.ofHours(1)), 1000, 1000));
    }

    @Test
    void shouldReportWaitUntilOldestEntryExpires() {
        SlidingWindowTokenCounter counter = new SlidingWindowTokenCounter(Duration.ofHours(1));
        counter.tryAdd(T0, 500, 1000);
        counter.tryAdd(T0.plus(Duration.ofMinutes(30)), 500, 1000);

        Instant now = T0.plus(Duration.ofMinutes(40));
        assertEquals(Duration.ofMinutes(20), counter.retryAfter(now, 300, 1000).orElseThrow());
        assertEquals(Duration.ofMinutes(50), counter.retryAfter(now, 800, 1000).orElseThrow());
    }

    @Test
    void shouldReportNoRetryWhenRequestCanNeverFit() {
        SlidingWindowTokenCounter counter = new SlidingWindowTokenCounter(Duration.ofHours(1));

        assertTrue(counter.retryAfter(T0, 2000, 1000).isEmpty());
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowTokenCounter(Duration.ZERO));
    }
}
