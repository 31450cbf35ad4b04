package com.questrail.lanlight.device;

import com.questrail.lanlight.api.CommandOutcome;
import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.api.DeviceUpdateHandler;
import com.questrail.lanlight.api.LightCapabilities;
import com.questrail.lanlight.api.Rgb;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * LightDevice
 * =============================================================================
 * One physical light known to the controller.
 *
 * <h2>Identity</h2>
 * The fingerprint, SKU and capabilities are fixed when the device is first
 * discovered. Later scan responses only move {@link #ip()} and refresh
 * {@link #lastSeenNanos()}.
 *
 * <h2>Threading</h2>
 * Mutation happens on the controller's scheduler only (through
 * {@link DeviceRegistry}). Reads are safe from any thread and observe the latest
 * published value of each field independently.
 */
public final class LightDevice
{
    private final String fingerprint;
    private final String sku;
    private final LightCapabilities capabilities;
    private final DeviceCommands commands;

    private volatile String ip;
    private volatile long lastSeenNanos;
    private volatile DeviceState state = DeviceState.INITIAL;
    private volatile boolean manual;
    private volatile DeviceUpdateHandler updateHandler;

    public LightDevice(
            String fingerprint,
            String ip,
            String sku,
            LightCapabilities capabilities,
            boolean manual,
            long lastSeenNanos,
            DeviceCommands commands)
    {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.ip = Objects.requireNonNull(ip, "ip");
        this.sku = Objects.requireNonNull(sku, "sku");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.manual = manual;
        this.lastSeenNanos = lastSeenNanos;
    }

    public String fingerprint() {
        return fingerprint;
    }

    public String ip() {
        return ip;
    }

    public String sku() {
        return sku;
    }

    public LightCapabilities capabilities() {
        return capabilities;
    }

    /**
     * @return monotonic timestamp of the last scan or status response naming this device
     */
    public long lastSeenNanos() {
        return lastSeenNanos;
    }

    public DeviceState state() {
        return state;
    }

    public boolean isManual() {
        return manual;
    }

    /**
     * Replace the update handler; {@code null} clears it.
     *
     * @return the previous handler, or {@code null}
     */
    public DeviceUpdateHandler setUpdateHandler(DeviceUpdateHandler handler) {
        DeviceUpdateHandler old = this.updateHandler;
        this.updateHandler = handler;
        return old;
    }

    public CompletableFuture<CommandOutcome> turnOn() {
        return commands.turn(this, true);
    }

    public CompletableFuture<CommandOutcome> turnOff() {
        return commands.turn(this, false);
    }

    public CompletableFuture<CommandOutcome> setBrightness(int percent) {
        return commands.setBrightness(this, percent);
    }

    public CompletableFuture<CommandOutcome> setRgbColor(Rgb color) {
        return commands.setRgbColor(this, color);
    }

    public CompletableFuture<CommandOutcome> setTemperature(int kelvin) {
        return commands.setTemperature(this, kelvin);
    }

    /**
     * @param segment 1-based segment index
     */
    public CompletableFuture<CommandOutcome> setSegmentRgbColor(int segment, Rgb color) {
        return commands.setSegmentRgbColor(this, segment, color);
    }

    public CompletableFuture<CommandOutcome> turnSegmentOff(int segment) {
        return commands.setSegmentRgbColor(this, segment, Rgb.BLACK);
    }

    public CompletableFuture<CommandOutcome> setScene(String scene) {
        return commands.setScene(this, scene);
    }

    public CompletableFuture<CommandOutcome> sendRawCommand(String hex) {
        return commands.sendRawCommand(this, hex);
    }

    void moveTo(String ip) {
        this.ip = Objects.requireNonNull(ip, "ip");
    }

    void touch(long nowNanos) {
        this.lastSeenNanos = nowNanos;
    }

    void markManual() {
        this.manual = true;
    }

    void replaceState(DeviceState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    void notifyUpdated() {
        DeviceUpdateHandler h = updateHandler;
        if (h != null) {
            h.onUpdated(this);
        }
    }

    @Override
    public String toString() {
        return "LightDevice[" + fingerprint + ", sku=" + sku + ", ip=" + ip
                + (manual ? ", manual" : "") + ", state=" + state + "]";
    }
}
