package com.questrail.lanlight.internal.exec;

import com.questrail.lanlight.api.CommandKind;
import com.questrail.lanlight.api.CommandOutcome;
import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.codec.LanRequest;
import com.questrail.lanlight.device.DeviceMessageSender;
import com.questrail.lanlight.device.LightDevice;
import com.questrail.lanlight.internal.time.MonotonicClock;
import com.questrail.lanlight.internal.time.MonotonicScheduler;
import com.questrail.lanlight.observability.CommandFinishedEvent;
import com.questrail.lanlight.observability.LanObservabilitySink;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * CommandExecutor
 * =============================================================================
 * Turns single fire-and-forget datagrams into confirmable device commands.
 *
 * <h2>Ownership</h2>
 * At most one {@link CommandSequence} runs per (fingerprint, command kind).
 * {@link #execute} cancels the current owner of the key and lets it tear down
 * completely before the new sequence sends anything.
 *
 * <h2>Verification</h2>
 * {@link #onStatusUpdated(LightDevice)} must be called for every status response
 * applied to the registry; it is the only way a waiting sequence learns that its
 * predicate now holds.
 *
 * <h2>Threading</h2>
 * Every method must be called on the controller's scheduler. Returned futures
 * complete on that thread and always complete normally.
 */
public final class CommandExecutor
{
    private final DeviceMessageSender sender;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final RetryPolicy policy;
    private final LanObservabilitySink sink;

    private final VerificationRegistry verifications = new VerificationRegistry();
    private final Map<CommandKey, CommandSequence> inFlight = new HashMap<>();

    public CommandExecutor(DeviceMessageSender sender,
                           MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           RetryPolicy policy,
                           LanObservabilitySink sink)
    {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Send {@code request} and retry it until {@code verify} holds or the retry
     * budget is spent.
     *
     * @param verify predicate over the reported state; {@code null} runs the
     *               retry loop without early confirmation
     */
    public CompletableFuture<CommandOutcome> execute(LightDevice device,
                                                     CommandKind kind,
                                                     LanRequest request,
                                                     Predicate<DeviceState> verify)
    {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(request, "request");

        CommandKey key = new CommandKey(device.fingerprint(), kind);

        CommandSequence previous = inFlight.get(key);
        if (previous != null) {
            // Synchronous: the old sequence is fully torn down when this returns.
            previous.cancel();
        }

        CommandSequence sequence = new CommandSequence(
                key, device, request, verify, policy, sender, scheduler, clock,
                verifications, this::onSequenceFinished);
        inFlight.put(key, sequence);
        sequence.start();
        return sequence.outcome();
    }

    /**
     * Send {@code request} once, without retries or verification.
     */
    public CompletableFuture<CommandOutcome> sendOnce(LightDevice device, CommandKind kind, LanRequest request)
    {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(request, "request");

        sender.send(device, request);
        sink.onCommandFinished(new CommandFinishedEvent(device.fingerprint(), kind, CommandOutcome.SENT, 1));
        return CompletableFuture.completedFuture(CommandOutcome.SENT);
    }

    /**
     * Wake the device's waiting sequence if its predicate now holds.
     */
    public void onStatusUpdated(LightDevice device)
    {
        verifications.onStatus(Objects.requireNonNull(device, "device"));
    }

    /**
     * Supersede every in-flight sequence.
     */
    public void cancelAll()
    {
        List<CommandSequence> all = new ArrayList<>(inFlight.values());
        for (CommandSequence s : all) {
            s.cancel();
        }
        verifications.clear();
    }

    public int inFlightCount()
    {
        return inFlight.size();
    }

    boolean isVerificationRegistered(String fingerprint)
    {
        return verifications.isRegistered(fingerprint);
    }

    private void onSequenceFinished(CommandSequence sequence, CommandOutcome outcome)
    {
        inFlight.remove(sequence.key(), sequence);
        sink.onCommandFinished(new CommandFinishedEvent(
                sequence.key().fingerprint(),
                sequence.key().kind(),
                outcome,
                sequence.sends()));
    }
}
