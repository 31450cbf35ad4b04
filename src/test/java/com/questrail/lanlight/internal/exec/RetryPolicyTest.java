package com.questrail.lanlight.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultsMatchDocumentedSchedule() {
        RetryPolicy p = RetryPolicy.defaults();

        assertEquals(Duration.ofMillis(100), p.postSendStatusDelay());
        assertEquals(11, p.backoff().size());
        assertEquals(Duration.ofMillis(200), p.backoff().get(0));
        assertEquals(Duration.ofSeconds(7), p.backoff().get(10));
        assertEquals(10, p.retryBudget());
        assertEquals(10, p.attempts());
    }

    @Test
    void attemptsAreBoundedByScheduleLength() {
        RetryPolicy p = new RetryPolicy(Duration.ZERO, List.of(Duration.ofMillis(10), Duration.ofMillis(20)), 5);
        assertEquals(2, p.attempts());
    }

    @Test
    void rejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(Duration.ofMillis(-1), List.of(), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(Duration.ZERO, List.of(Duration.ofMillis(-5)), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(Duration.ZERO, List.of(), -1));
    }

    @Test
    void backoffIsCopied() {
        java.util.ArrayList<Duration> schedule = new java.util.ArrayList<>(List.of(Duration.ofMillis(10)));
        RetryPolicy p = new RetryPolicy(Duration.ZERO, schedule, 1);

        schedule.add(Duration.ofMillis(20));

        assertEquals(1, p.backoff().size());
        assertThrows(UnsupportedOperationException.class, () -> p.backoff().add(Duration.ZERO));
    }
}
