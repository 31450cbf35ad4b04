package com.questrail.lanlight.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled tasks, pending waits, and races.
 *
 * <p>
 * Kept deliberately tiny so it can be implemented by a deterministic test
 * scheduler, a {@code ScheduledExecutorService}-backed scheduler, or a
 * composite such as {@link Race}.
 * </p>
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * A handle for work that has nothing left to cancel.
     */
    Cancellable NONE = () -> false;

    /**
     * Attempt to cancel the pending work.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the work
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
