package com.questrail.lanlight.api;

import java.util.Objects;

/**
 * Snapshot of a light's reported state.
 *
 * <p>Replaced wholesale by every decoded status response, and optimistically
 * by the controller when a command is issued.</p>
 *
 * @param on                     power state
 * @param brightness             brightness percentage, 0-100
 * @param color                  RGB colour
 * @param colorTemperatureKelvin colour temperature in Kelvin; 0 when the light is in RGB mode
 */
public record DeviceState(boolean on, int brightness, Rgb color, int colorTemperatureKelvin) {

    public static final DeviceState INITIAL = new DeviceState(false, 0, Rgb.BLACK, 0);

    public DeviceState {
        Objects.requireNonNull(color, "color");
    }

    public DeviceState withOn(boolean on) {
        return new DeviceState(on, brightness, color, colorTemperatureKelvin);
    }

    public DeviceState withBrightness(int brightness) {
        return new DeviceState(on, brightness, color, colorTemperatureKelvin);
    }

    public DeviceState withColor(Rgb color) {
        return new DeviceState(on, brightness, color, colorTemperatureKelvin);
    }

    public DeviceState withColorTemperature(int kelvin) {
        return new DeviceState(on, brightness, color, kelvin);
    }
}
