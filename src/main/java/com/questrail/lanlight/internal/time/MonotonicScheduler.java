package com.questrail.lanlight.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * The single cooperative scheduler of the control plane.
 *
 * <h2>Binding invariant</h2>
 * Implementations run tasks one at a time, in deadline order, with tasks that
 * share a deadline running in submission order. Registry mutation, timer
 * callbacks, datagram handling and command sequencing all execute as tasks on
 * this scheduler and therefore never preempt each other.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task         runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a duration, measured on the provided clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }

    /**
     * Queue a task behind everything already due.
     */
    default Cancellable scheduleNow(MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(clock, "clock");
        return scheduleAtNanos(clock.nowNanos(), Objects.requireNonNull(task, "task"));
    }
}
