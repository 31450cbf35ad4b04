package com.questrail.lanlight.device;

import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.api.DiscoveryHandler;
import com.questrail.lanlight.api.EvictionHandler;
import com.questrail.lanlight.api.LightCapabilities;
import com.questrail.lanlight.capability.CapabilityTable;
import com.questrail.lanlight.internal.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * DeviceRegistry
 * =============================================================================
 * Authoritative map of known devices, keyed by fingerprint, plus the queue of
 * manually added addresses that have not answered a scan yet.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>A fingerprint is registered at most once; its {@link LightDevice} is
 *       mutated in place and never replaced.</li>
 *   <li>An address is queued only while no registered manual device has it.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Device mutation happens on the controller's scheduler only. The address queue
 * may be edited from any thread. The backing collections are concurrent so
 * lookups from other threads are safe.
 */
public final class DeviceRegistry
{
    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    static final String UNKNOWN_SKU = "UNKNOWN";

    private final MonotonicClock clock;
    private final DeviceCommands commands;

    private final Map<String, LightDevice> devices = new ConcurrentHashMap<>();
    private final Set<String> queue = ConcurrentHashMap.newKeySet();

    public DeviceRegistry(MonotonicClock clock, DeviceCommands commands)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.commands = Objects.requireNonNull(commands, "commands");
    }

    /**
     * Merge a scan response into the registry.
     *
     * <p>For a known fingerprint, refreshes last-seen and the address, then
     * notifies {@code handler} with {@code isNew = false}; its answer is ignored.
     * For an unknown fingerprint, builds a device with capabilities from
     * {@code table} (power-only if the SKU is unknown) and registers it only if
     * {@code handler} accepts it.</p>
     *
     * @param ip the device's address; {@code null} keeps the current one
     * @return the registered device, or empty if a new device was rejected
     * @throws IllegalArgumentException if a new device has no address
     */
    public Optional<LightDevice> upsertFromScan(
            String fingerprint,
            String ip,
            String sku,
            CapabilityTable table,
            DiscoveryHandler handler)
    {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(handler, "handler");

        long now = clock.nowNanos();

        LightDevice existing = devices.get(fingerprint);
        if (existing != null) {
            existing.touch(now);
            if (ip != null && !ip.equals(existing.ip())) {
                log.debug("Device {} moved from {} to {}", fingerprint, existing.ip(), ip);
                existing.moveTo(ip);
            }
            if (queue.remove(existing.ip())) {
                existing.markManual();
            }
            handler.onDiscovered(existing, false);
            log.debug("Device updated: {}", existing);
            return Optional.of(existing);
        }

        if (ip == null) {
            throw new IllegalArgumentException("new device " + fingerprint + " has no address");
        }

        String model = sku != null ? sku : UNKNOWN_SKU;
        LightCapabilities capabilities = table.lookup(model).orElseGet(() -> {
            log.warn("Device {} with model {} is not supported; only power control is available",
                    fingerprint, model);
            return LightCapabilities.ON_OFF;
        });

        LightDevice device = new LightDevice(
                fingerprint, ip, model, capabilities, queue.contains(ip), now, commands);

        if (!handler.onDiscovered(device, true)) {
            log.debug("Device ignored: {}", device);
            return Optional.empty();
        }

        devices.put(fingerprint, device);
        queue.remove(ip);
        log.debug("Device discovered: {}", device);
        return Optional.of(device);
    }

    /**
     * Remove every device whose last-seen age is at least {@code timeout},
     * notifying {@code handler} once per removed device.
     *
     * @return the evicted devices
     */
    public List<LightDevice> evict(Duration timeout, EvictionHandler handler)
    {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(handler, "handler");

        long now = clock.nowNanos();
        long limit = timeout.toNanos();

        List<LightDevice> evicted = new ArrayList<>();
        for (LightDevice d : List.copyOf(devices.values())) {
            if (now - d.lastSeenNanos() >= limit && devices.remove(d.fingerprint(), d)) {
                evicted.add(d);
            }
        }
        for (LightDevice d : evicted) {
            log.debug("Device evicted: {}", d);
            handler.onEvicted(d);
        }
        return evicted;
    }

    /**
     * Record a status snapshot for the device at {@code ip}.
     *
     * @return the updated device, or empty if no device has that address
     */
    public Optional<LightDevice> applyStatus(String ip, DeviceState state)
    {
        Objects.requireNonNull(state, "state");

        Optional<LightDevice> device = byIp(ip);
        device.ifPresent(d -> {
            d.replaceState(state);
            d.touch(clock.nowNanos());
            d.notifyUpdated();
        });
        return device;
    }

    /**
     * Set the state a command is expected to produce, ahead of confirmation.
     */
    public void applyOptimistic(LightDevice device, UnaryOperator<DeviceState> change)
    {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(change, "change");
        device.replaceState(change.apply(device.state()));
    }

    /**
     * @return {@code true} if the address was newly queued
     */
    public boolean addToQueue(String ip)
    {
        Objects.requireNonNull(ip, "ip");
        Optional<LightDevice> known = byIp(ip);
        if (known.isPresent() && known.get().isManual()) {
            return false;
        }
        return queue.add(ip);
    }

    public boolean removeFromQueue(String ip)
    {
        return queue.remove(Objects.requireNonNull(ip, "ip"));
    }

    public Set<String> queue()
    {
        return Set.copyOf(queue);
    }

    public boolean hasQueuedAddresses()
    {
        return !queue.isEmpty();
    }

    public Optional<LightDevice> remove(String fingerprint)
    {
        return Optional.ofNullable(devices.remove(Objects.requireNonNull(fingerprint, "fingerprint")));
    }

    public Optional<LightDevice> byIp(String ip)
    {
        if (ip == null) {
            return Optional.empty();
        }
        for (LightDevice d : devices.values()) {
            if (ip.equals(d.ip())) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    public Optional<LightDevice> bySku(String sku)
    {
        if (sku == null) {
            return Optional.empty();
        }
        for (LightDevice d : devices.values()) {
            if (sku.equals(d.sku())) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    public Optional<LightDevice> byFingerprint(String fingerprint)
    {
        return fingerprint == null ? Optional.empty() : Optional.ofNullable(devices.get(fingerprint));
    }

    public List<LightDevice> devices()
    {
        return List.copyOf(devices.values());
    }

    public List<LightDevice> manualDevices()
    {
        List<LightDevice> manual = new ArrayList<>();
        for (LightDevice d : devices.values()) {
            if (d.isManual()) {
                manual.add(d);
            }
        }
        return manual;
    }

    public int size()
    {
        return devices.size();
    }

    public void clear()
    {
        devices.clear();
        queue.clear();
    }
}
