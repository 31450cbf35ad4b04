package com.questrail.lanlight.internal.exec;

import com.questrail.lanlight.internal.time.Cancellable;
import com.questrail.lanlight.internal.time.Race;

/**
 * One-waiter wake-up signal, confined to the scheduler thread.
 *
 * <p>
 * {@link #fire()} runs the armed waiter, or latches if nobody is waiting. A
 * latched signal completes the next {@link #arm} immediately, or is cleared by
 * {@link #consume()}.
 * </p>
 */
final class WakeSignal implements Race.Contender
{
    private Runnable waiter;
    private boolean latched;

    @Override
    public Cancellable arm(Runnable onComplete)
    {
        if (latched) {
            latched = false;
            onComplete.run();
            return Cancellable.NONE;
        }
        waiter = onComplete;
        return () -> {
            if (waiter != onComplete) {
                return false;
            }
            waiter = null;
            return true;
        };
    }

    void fire()
    {
        Runnable w = waiter;
        if (w == null) {
            latched = true;
            return;
        }
        waiter = null;
        w.run();
    }

    /**
     * Clear the latch.
     *
     * @return whether the signal had fired since it was last armed or consumed
     */
    boolean consume()
    {
        boolean was = latched;
        latched = false;
        return was;
    }
}
