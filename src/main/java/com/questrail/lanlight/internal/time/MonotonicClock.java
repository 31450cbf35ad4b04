package com.questrail.lanlight.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision in the control plane: command
 * backoff, discovery and polling cadence, and device eviction age.
 *
 * <p>
 * Wall-clock time may jump (NTP, DST, manual changes) and is never used for
 * these decisions.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
