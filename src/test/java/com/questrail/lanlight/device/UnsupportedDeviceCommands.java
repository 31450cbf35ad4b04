package com.questrail.lanlight.device;

import com.questrail.lanlight.api.CommandOutcome;
import com.questrail.lanlight.api.Rgb;

import java.util.concurrent.CompletableFuture;

/**
 * DeviceCommands for tests that never route commands through a device handle.
 */
public final class UnsupportedDeviceCommands implements DeviceCommands {

    public static final UnsupportedDeviceCommands INSTANCE = new UnsupportedDeviceCommands();

    private UnsupportedDeviceCommands() {
    }

    private static CompletableFuture<CommandOutcome> unsupported() {
        throw new UnsupportedOperationException("device commands are not wired in this test");
    }

    @Override
    public CompletableFuture<CommandOutcome> turn(LightDevice device, boolean on) {
        return unsupported();
    }

    @Override
    public CompletableFuture<CommandOutcome> setBrightness(LightDevice device, int percent) {
        return unsupported();
    }

    @Override
    public CompletableFuture<CommandOutcome> setRgbColor(LightDevice device, Rgb color) {
        return unsupported();
    }

    @Override
    public CompletableFuture<CommandOutcome> setTemperature(LightDevice device, int kelvin) {
        return unsupported();
    }

    @Override
    public CompletableFuture<CommandOutcome> setSegmentRgbColor(LightDevice device, int segment, Rgb color) {
        return unsupported();
    }

    @Override
    public CompletableFuture<CommandOutcome> setScene(LightDevice device, String scene) {
        return unsupported();
    }

    @Override
    public CompletableFuture<CommandOutcome> sendRawCommand(LightDevice device, String hex) {
        return unsupported();
    }
}
