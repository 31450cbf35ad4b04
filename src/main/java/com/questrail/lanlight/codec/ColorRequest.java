package com.questrail.lanlight.codec;

import com.questrail.lanlight.api.Rgb;

import java.util.Objects;

/**
 * Colour change ({@code colorwc}).
 *
 * <p>
 * Exactly one of the two halves is meaningful per request: an RGB request
 * carries a Kelvin value of {@code 0}; a temperature request carries black.
 * Use the factories; they clamp RGB channels to {@code [0, 255]} and
 * temperatures to {@code [2000, 9000]} Kelvin.
 * </p>
 */
public record ColorRequest(Rgb color, int kelvin) implements LanRequest
{
    public static final int MIN_KELVIN = 2000;
    public static final int MAX_KELVIN = 9000;

    public ColorRequest {
        Objects.requireNonNull(color, "color");
    }

    public static ColorRequest rgb(Rgb color) {
        return new ColorRequest(color.clamped(), 0);
    }

    public static ColorRequest temperature(int kelvin) {
        return new ColorRequest(Rgb.BLACK, Math.max(MIN_KELVIN, Math.min(kelvin, MAX_KELVIN)));
    }

    public boolean isTemperature() {
        return kelvin != 0;
    }

    @Override
    public String command() {
        return "colorwc";
    }
}
