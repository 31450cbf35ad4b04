package com.questrail.lanlight.internal.exec;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * RetryPolicy
 * -----------------------------------------------------------------------------
 * Timing of the command retry/verification sequence.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>postSendStatusDelay</b> - delay between the first send of a command
 *       and the status request that follows it, giving the light time to apply
 *       the change before it is asked about it. Resends are followed by their
 *       status request at once.</li>
 *   <li><b>backoff</b> - ascending waits between resends, the first counted
 *       from the post-send status request. While waiting, a confirming status
 *       response ends the sequence early.</li>
 *   <li><b>retryBudget</b> - maximum number of resends. The effective number of
 *       waits is the smaller of the budget and the schedule length.</li>
 * </ul>
 */
public record RetryPolicy(
        Duration postSendStatusDelay,
        List<Duration> backoff,
        int retryBudget
) {
    public RetryPolicy {
        Objects.requireNonNull(postSendStatusDelay, "postSendStatusDelay");
        Objects.requireNonNull(backoff, "backoff");

        if (postSendStatusDelay.isNegative()) {
            throw new IllegalArgumentException("postSendStatusDelay must be non-negative");
        }
        for (Duration d : backoff) {
            if (Objects.requireNonNull(d, "backoff delay").isNegative()) {
                throw new IllegalArgumentException("backoff delays must be non-negative");
            }
        }
        if (retryBudget < 0) {
            throw new IllegalArgumentException("retryBudget must be non-negative");
        }
        backoff = List.copyOf(backoff);
    }

    /**
     * Default values:
     * <ul>
     *   <li>postSendStatusDelay: 100ms</li>
     *   <li>backoff: 0.2, 0.3, 0.5, 1, 1.5, 2, 3, 4, 5, 6, 7 seconds</li>
     *   <li>retryBudget: 10</li>
     * </ul>
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(
                Duration.ofMillis(100),
                List.of(
                        Duration.ofMillis(200),
                        Duration.ofMillis(300),
                        Duration.ofMillis(500),
                        Duration.ofSeconds(1),
                        Duration.ofMillis(1500),
                        Duration.ofSeconds(2),
                        Duration.ofSeconds(3),
                        Duration.ofSeconds(4),
                        Duration.ofSeconds(5),
                        Duration.ofSeconds(6),
                        Duration.ofSeconds(7)),
                10);
    }

    /**
     * Number of waits (and therefore resends) a sequence may perform.
     */
    public int attempts() {
        return Math.min(retryBudget, backoff.size());
    }
}
