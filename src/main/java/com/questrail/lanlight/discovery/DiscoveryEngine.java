package com.questrail.lanlight.discovery;

import com.questrail.lanlight.codec.LanMessageEncoder;
import com.questrail.lanlight.codec.ScanRequest;
import com.questrail.lanlight.device.DeviceRegistry;
import com.questrail.lanlight.device.LightDevice;
import com.questrail.lanlight.internal.time.Cancellable;
import com.questrail.lanlight.internal.time.MonotonicClock;
import com.questrail.lanlight.internal.time.MonotonicScheduler;
import com.questrail.lanlight.transport.TransportManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * DiscoveryEngine
 * =============================================================================
 * Sends scan requests and keeps itself scheduled while there is something to scan.
 *
 * <h2>One run</h2>
 * <ul>
 *   <li>broadcast a scan on every endpoint, if discovery is enabled;</li>
 *   <li>unicast a scan to every queued address;</li>
 *   <li>unicast a scan to every registered manual device.</li>
 * </ul>
 * If any scan went out, the next run is scheduled one interval later. There is
 * never more than one pending run.
 *
 * <p>Scheduler-thread confined.</p>
 */
public final class DiscoveryEngine
{
    private static final Logger log = LoggerFactory.getLogger(DiscoveryEngine.class);

    private final TransportManager transport;
    private final DeviceRegistry registry;
    private final LanMessageEncoder encoder;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final int scanPort;

    private volatile boolean enabled;
    private volatile Duration interval;
    private boolean stopped;
    private Cancellable pending = Cancellable.NONE;

    public DiscoveryEngine(TransportManager transport,
                           DeviceRegistry registry,
                           LanMessageEncoder encoder,
                           MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           int scanPort,
                           boolean enabled,
                           Duration interval)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scanPort = scanPort;
        this.enabled = enabled;
        this.interval = requirePositive(interval);
    }

    public void triggerDiscovery()
    {
        if (stopped) {
            return;
        }

        byte[] scan = encoder.encode(ScanRequest.INSTANCE);
        boolean sent = false;

        if (enabled) {
            transport.broadcast(scan);
            sent = true;
        }

        for (String ip : registry.queue()) {
            transport.sendTo(scan, ip, scanPort);
            sent = true;
        }

        for (LightDevice d : registry.manualDevices()) {
            transport.sendTo(scan, d.ip(), scanPort);
            sent = true;
        }

        pending.cancel();
        pending = Cancellable.NONE;
        if (sent) {
            pending = scheduler.scheduleAfter(interval, clock, this::triggerDiscovery);
        }
        else {
            log.debug("Nothing to scan; discovery idle");
        }
    }

    /**
     * Enabling runs discovery immediately; disabling cancels the pending run.
     */
    public void setEnabled(boolean enabled)
    {
        if (this.enabled == enabled) {
            return;
        }
        this.enabled = enabled;
        if (enabled) {
            triggerDiscovery();
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

    /**
     * Takes effect from the next scheduled run.
     */
    public void setInterval(Duration interval)
    {
        this.interval = requirePositive(interval);
    }

    public Duration interval()
    {
        return interval;
    }

    /**
     * A newly queued address is scanned right away unless periodic discovery
     * is already running.
     */
    public void onAddressQueued()
    {
        if (!enabled) {
            triggerDiscovery();
        }
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
