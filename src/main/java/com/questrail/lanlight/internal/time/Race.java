package com.questrail.lanlight.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Race
 * =============================================================================
 * "Wait on the first of several, cancel the rest."
 *
 * <p>
 * Each {@link Contender} is armed with a completion callback. The first
 * contender to complete wins: every other armed contender is cancelled and the
 * winner's index (its position in the argument list) is handed to the
 * {@code onWinner} callback exactly once. Cancelling the race itself cancels
 * every contender and suppresses {@code onWinner}.
 * </p>
 *
 * <p>
 * A contender that completes while it is being armed settles the race before
 * {@link #firstOf} returns; contenders after it in the list are never armed.
 * </p>
 */
public final class Race implements Cancellable
{
    /**
     * Something that can be waited on.
     */
    @FunctionalInterface
    public interface Contender
    {
        /**
         * Begin waiting; {@code onComplete} runs at most once when the wait ends.
         *
         * @return handle that abandons the wait
         */
        Cancellable arm(Runnable onComplete);
    }

    /**
     * A contender that completes once {@code delay} has elapsed on {@code clock}.
     */
    public static Contender delay(MonotonicScheduler scheduler, MonotonicClock clock, Duration delay)
    {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(delay, "delay");
        return onComplete -> scheduler.scheduleAfter(delay, clock, onComplete);
    }

    private final Cancellable[] armed;
    private final IntConsumer onWinner;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private Race(int size, IntConsumer onWinner)
    {
        this.armed = new Cancellable[size];
        this.onWinner = onWinner;
    }

    public static Race firstOf(IntConsumer onWinner, Contender... contenders)
    {
        Objects.requireNonNull(onWinner, "onWinner");
        Objects.requireNonNull(contenders, "contenders");
        if (contenders.length == 0) {
            throw new IllegalArgumentException("at least one contender required");
        }

        Race race = new Race(contenders.length, onWinner);
        for (int i = 0; i < contenders.length && !race.settled.get(); i++) {
            final int index = i;
            race.armed[i] = Objects.requireNonNull(contenders[i], "contender").arm(() -> race.complete(index));
        }
        return race;
    }

    /**
     * @return {@code true} once a winner was chosen or the race was cancelled
     */
    public boolean isSettled()
    {
        return settled.get();
    }

    @Override
    public boolean cancel()
    {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        cancelAllExcept(-1);
        return true;
    }

    private void complete(int index)
    {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        cancelAllExcept(index);
        onWinner.accept(index);
    }

    private void cancelAllExcept(int winner)
    {
        for (int i = 0; i < armed.length; i++) {
            Cancellable c = armed[i];
            if (i != winner && c != null) {
                c.cancel();
            }
        }
    }
}
