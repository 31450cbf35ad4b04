package com.questrail.lanlight.internal.exec;

import com.questrail.lanlight.api.CommandOutcome;
import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.codec.LanRequest;
import com.questrail.lanlight.codec.StatusRequest;
import com.questrail.lanlight.device.DeviceMessageSender;
import com.questrail.lanlight.device.LightDevice;
import com.questrail.lanlight.internal.time.Cancellable;
import com.questrail.lanlight.internal.time.MonotonicClock;
import com.questrail.lanlight.internal.time.MonotonicScheduler;
import com.questrail.lanlight.internal.time.Race;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * CommandSequence
 * =============================================================================
 * One retry/verification run for a single (device, command kind) key.
 *
 * <pre>
 *   start ──► Sent ──► Settling ──► Awaiting(backoff[i]) ──► Verified
 *                                     ▲          │        ├──► Exhausted
 *                                     └─ resend ◄┘        └──► Superseded (cancel)
 * </pre>
 *
 * <h2>Sending</h2>
 * The first transmission sends the command and then settles for
 * {@link RetryPolicy#postSendStatusDelay()} before asking for status; the first
 * backoff wait starts only once that status request is out. A resend is
 * followed by its status request straight away. With the default policy the
 * command goes out at 0, 300, 600, 1100, 2100ms and so on, each time paired
 * with a status request, and the first one at 100ms.
 *
 * <h2>Awaiting</h2>
 * Without a predicate each wait is a plain delay followed by a resend. With a
 * predicate, each wait races the device's wake signal against the delay. A wake
 * whose predicate still holds on the freshest reported state ends the run as
 * {@link CommandOutcome#VERIFIED}; anything else resends.
 *
 * <h2>Teardown</h2>
 * Ending for any reason cancels the pending settle delay or wait, drops the
 * verification registration and completes {@link #outcome()}.
 *
 * <p>Scheduler-thread confined.</p>
 */
final class CommandSequence
{
    private static final int WAKE = 0;

    private final CommandKey key;
    private final LightDevice device;
    private final LanRequest request;
    private final Predicate<DeviceState> verify;
    private final RetryPolicy policy;
    private final DeviceMessageSender sender;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final VerificationRegistry verifications;
    private final BiConsumer<CommandSequence, CommandOutcome> onFinished;

    private final CompletableFuture<CommandOutcome> outcome = new CompletableFuture<>();
    private final WakeSignal wake = new WakeSignal();

    private VerificationRegistry.Registration registration;
    private Cancellable pendingWait = Cancellable.NONE;
    private int attempt;
    private int sends;
    private boolean finished;

    CommandSequence(CommandKey key,
                    LightDevice device,
                    LanRequest request,
                    Predicate<DeviceState> verify,
                    RetryPolicy policy,
                    DeviceMessageSender sender,
                    MonotonicScheduler scheduler,
                    MonotonicClock clock,
                    VerificationRegistry verifications,
                    BiConsumer<CommandSequence, CommandOutcome> onFinished)
    {
        this.key = Objects.requireNonNull(key, "key");
        this.device = Objects.requireNonNull(device, "device");
        this.request = Objects.requireNonNull(request, "request");
        this.verify = verify;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.verifications = Objects.requireNonNull(verifications, "verifications");
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished");
    }

    void start()
    {
        if (verify != null) {
            registration = verifications.register(device.fingerprint(), verify, wake);
        }
        sendCommand();
        pendingWait = scheduler.scheduleAfter(policy.postSendStatusDelay(), clock, this::settled);
    }

    /**
     * Supersede this run. Teardown completes before this method returns.
     */
    void cancel()
    {
        finish(CommandOutcome.SUPERSEDED);
    }

    CommandKey key()
    {
        return key;
    }

    int sends()
    {
        return sends;
    }

    boolean isFinished()
    {
        return finished;
    }

    CompletableFuture<CommandOutcome> outcome()
    {
        return outcome;
    }

    private void sendCommand()
    {
        sender.send(device, request);
        sends++;
    }

    private void requestStatus()
    {
        sender.send(device, StatusRequest.INSTANCE);
    }

    private void settled()
    {
        pendingWait = Cancellable.NONE;
        if (finished) {
            return;
        }
        requestStatus();
        awaitNext();
    }

    private void awaitNext()
    {
        if (finished) {
            return;
        }
        if (verify != null && wake.consume() && verify.test(device.state())) {
            finish(CommandOutcome.VERIFIED);
            return;
        }
        if (attempt >= policy.attempts()) {
            finish(CommandOutcome.EXHAUSTED);
            return;
        }

        Duration delay = policy.backoff().get(attempt++);

        if (verify == null) {
            pendingWait = scheduler.scheduleAfter(delay, clock, this::resend);
            return;
        }

        Race race = Race.firstOf(this::onRaceSettled, wake, Race.delay(scheduler, clock, delay));
        if (!race.isSettled()) {
            pendingWait = race;
        }
    }

    private void onRaceSettled(int winner)
    {
        pendingWait = Cancellable.NONE;
        if (winner == WAKE && verify.test(device.state())) {
            finish(CommandOutcome.VERIFIED);
            return;
        }
        resend();
    }

    private void resend()
    {
        if (finished) {
            return;
        }
        sendCommand();
        requestStatus();
        awaitNext();
    }

    private void finish(CommandOutcome result)
    {
        if (finished) {
            return;
        }
        finished = true;

        pendingWait.cancel();
        pendingWait = Cancellable.NONE;
        if (registration != null) {
            verifications.unregister(registration);
            registration = null;
        }

        onFinished.accept(this, result);
        outcome.complete(result);
    }
}
