package com.questrail.lanlight.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the supplied {@link MonotonicClock}; callers must compute deadlines with
 * the same clock.</p>
 *
 * <h2>Serialization</h2>
 * <p>The cooperative model requires a single-threaded executor
 * (e.g. {@link java.util.concurrent.Executors#newSingleThreadScheduledExecutor()}).
 * Its delay queue breaks ties in submission order.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> manage the executor's lifecycle.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
