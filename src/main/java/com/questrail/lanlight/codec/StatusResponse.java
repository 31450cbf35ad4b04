package com.questrail.lanlight.codec;

import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.api.Rgb;

import java.util.Objects;

/**
 * State snapshot reported by a light. Carries no fingerprint; it is matched to a
 * device by the sender's address.
 */
public record StatusResponse(boolean on, Rgb color, int brightness, int colorTemperatureKelvin)
        implements LanResponse
{
    public StatusResponse {
        Objects.requireNonNull(color, "color");
    }

    public DeviceState toState() {
        return new DeviceState(on, brightness, color, colorTemperatureKelvin);
    }

    @Override
    public String command() {
        return StatusRequest.COMMAND;
    }
}
