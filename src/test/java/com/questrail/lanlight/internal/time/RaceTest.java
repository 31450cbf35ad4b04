package com.questrail.lanlight.internal.time;

import com.questrail.lanlight.time.DeterministicScheduler;
import com.questrail.lanlight.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RaceTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final List<Integer> winners = new ArrayList<>();

    /** A contender completed by hand. */
    private static final class Manual implements Race.Contender {
        Runnable armed;
        boolean cancelled;

        @Override
        public Cancellable arm(Runnable onComplete) {
            armed = onComplete;
            return () -> {
                cancelled = true;
                return true;
            };
        }

        void complete() {
            armed.run();
        }
    }

    @Test
    void earlierDelayWins() {
        Race race = Race.firstOf(winners::add,
                Race.delay(scheduler, clock, Duration.ofMillis(300)),
                Race.delay(scheduler, clock, Duration.ofMillis(100)));

        scheduler.advanceMillis(1000);

        assertEquals(List.of(1), winners);
        assertTrue(race.isSettled());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void winnerCancelsOtherContenders() {
        Manual signal = new Manual();

        Race.firstOf(winners::add, signal, Race.delay(scheduler, clock, Duration.ofMillis(100)));
        assertEquals(1, scheduler.pendingCount());

        // WHEN
        signal.complete();

        // THEN
        assertEquals(List.of(0), winners);
        assertEquals(0, scheduler.pendingCount());
        assertFalse(signal.cancelled);
    }

    @Test
    void onlyFirstCompletionCounts() {
        Manual a = new Manual();
        Manual b = new Manual();
        Race.firstOf(winners::add, a, b);

        b.complete();
        a.complete();

        assertEquals(List.of(1), winners);
        assertTrue(a.cancelled);
    }

    @Test
    void cancellingRaceSuppressesWinner() {
        Manual signal = new Manual();
        Race race = Race.firstOf(winners::add, signal, Race.delay(scheduler, clock, Duration.ofMillis(100)));

        assertTrue(race.cancel());
        assertFalse(race.cancel());

        scheduler.advanceMillis(500);
        signal.complete();

        assertTrue(winners.isEmpty());
        assertTrue(signal.cancelled);
    }

    @Test
    void contenderCompletingWhileArmedSettlesImmediately() {
        Manual never = new Manual();
        Race race = Race.firstOf(winners::add, onComplete -> {
            onComplete.run();
            return Cancellable.NONE;
        }, never);

        assertTrue(race.isSettled());
        assertEquals(List.of(0), winners);
        assertNull(never.armed, "later contenders are never armed");
    }

    @Test
    void requiresAtLeastOneContender() {
        assertThrows(IllegalArgumentException.class, () -> Race.firstOf(winners::add));
    }
}
