package com.questrail.lanlight.poll;

import com.questrail.lanlight.codec.StatusRequest;
import com.questrail.lanlight.device.DeviceMessageSender;
import com.questrail.lanlight.device.DeviceRegistry;
import com.questrail.lanlight.device.LightDevice;
import com.questrail.lanlight.internal.time.Cancellable;
import com.questrail.lanlight.internal.time.MonotonicClock;
import com.questrail.lanlight.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * Periodically asks every registered device for its state.
 *
 * <p>Each run reschedules itself one interval later while polling is enabled.
 * Independent of discovery. Scheduler-thread confined.</p>
 */
public final class StatusPoller
{
    private final DeviceRegistry registry;
    private final DeviceMessageSender sender;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    private volatile boolean enabled;
    private volatile Duration interval;
    private boolean stopped;
    private Cancellable pending = Cancellable.NONE;

    public StatusPoller(DeviceRegistry registry,
                        DeviceMessageSender sender,
                        MonotonicScheduler scheduler,
                        MonotonicClock clock,
                        boolean enabled,
                        Duration interval)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.enabled = enabled;
        this.interval = requirePositive(interval);
    }

    public void pollAll()
    {
        if (stopped) {
            return;
        }

        for (LightDevice d : registry.devices()) {
            sender.send(d, StatusRequest.INSTANCE);
        }

        pending.cancel();
        pending = enabled
                ? scheduler.scheduleAfter(interval, clock, this::pollAll)
                : Cancellable.NONE;
    }

    /**
     * Enabling polls immediately; disabling cancels the pending poll.
     */
    public void setEnabled(boolean enabled)
    {
        if (this.enabled == enabled) {
            return;
        }
        this.enabled = enabled;
        if (enabled) {
            pollAll();
        }
        else {
            pending.cancel();
            pending = Cancellable.NONE;
        }
    }

    public boolean isEnabled()
    {
        return enabled;
    }

    public void setInterval(Duration interval)
    {
        this.interval = requirePositive(interval);
    }

    public Duration interval()
    {
        return interval;
    }

    public void stop()
    {
        stopped = true;
        enabled = false;
        pending.cancel();
        pending = Cancellable.NONE;
    }

    private static Duration requirePositive(Duration interval)
    {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        return interval;
    }
}
