package com.questrail.lanlight.internal.exec;

import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.codec.ColorRequest;
import com.questrail.lanlight.api.Rgb;

import java.util.function.Predicate;

/**
 * Predicates deciding whether a reported state confirms a stateful command.
 *
 * <p>Each predicate compares against the value that was actually put on the
 * wire, i.e. after clamping.</p>
 */
public final class Verifications
{
    static final int RGB_TOLERANCE = 5;
    static final int KELVIN_TOLERANCE = 100;

    private Verifications()
    {
    }

    public static Predicate<DeviceState> power(boolean on)
    {
        return s -> s.on() == on;
    }

    public static Predicate<DeviceState> brightness(int percent)
    {
        return s -> s.brightness() == percent;
    }

    public static Predicate<DeviceState> color(ColorRequest request)
    {
        if (request.isTemperature()) {
            int kelvin = request.kelvin();
            return s -> Math.abs(s.colorTemperatureKelvin() - kelvin) <= KELVIN_TOLERANCE;
        }
        Rgb rgb = request.color();
        return s -> s.color().isWithin(rgb, RGB_TOLERANCE);
    }
}
