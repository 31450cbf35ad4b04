package com.questrail.lanlight.device;

import com.questrail.lanlight.api.CommandOutcome;
import com.questrail.lanlight.api.Rgb;

import java.util.concurrent.CompletableFuture;

/**
 * Command surface a {@link LightDevice} delegates to.
 *
 * <p>
 * Devices hold this handle instead of a reference to the controller that owns
 * them. A device removed from the registry keeps a working handle; commands sent
 * through it still reach its last known address.
 * </p>
 */
public interface DeviceCommands
{
    CompletableFuture<CommandOutcome> turn(LightDevice device, boolean on);

    CompletableFuture<CommandOutcome> setBrightness(LightDevice device, int percent);

    CompletableFuture<CommandOutcome> setRgbColor(LightDevice device, Rgb color);

    CompletableFuture<CommandOutcome> setTemperature(LightDevice device, int kelvin);

    CompletableFuture<CommandOutcome> setSegmentRgbColor(LightDevice device, int segment, Rgb color);

    CompletableFuture<CommandOutcome> setScene(LightDevice device, String scene);

    CompletableFuture<CommandOutcome> sendRawCommand(LightDevice device, String hex);
}
