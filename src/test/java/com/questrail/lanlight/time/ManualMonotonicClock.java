package com.questrail.lanlight.time;

import com.questrail.lanlight.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ManualMonotonicClock
 * =============================================================================
 * Test clock that starts at zero and moves only when told to.
 *
 * Device ages, eviction cut-offs and the retry schedule are all expressed as
 * {@link Duration}s, so tests usually step it with {@link #advance(Duration)}
 * and read it back with {@link #nowMillis()} when recording when a datagram
 * went out. {@link DeterministicScheduler} advances it while running due tasks.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong(0);

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    public long nowMillis() {
        return nowNanos.get() / 1_000_000L;
    }

    public void advance(Duration delta) {
        Objects.requireNonNull(delta, "delta");
        advanceNanos(delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }

    void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards: " + deltaNanos + "ns");
        }
        nowNanos.addAndGet(deltaNanos);
    }
}
