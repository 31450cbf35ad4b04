package com.questrail.lanlight.internal.exec;

import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.device.LightDevice;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * VerificationRegistry
 * -----------------------------------------------------------------------------
 * The bridge between inbound status responses and suspended command sequences.
 *
 * <p>
 * Holds at most one registration per device fingerprint. Registering replaces
 * any previous registration for that device; unregistering only removes the
 * registration if it is still the current one.
 * </p>
 *
 * <p>Scheduler-thread confined.</p>
 */
final class VerificationRegistry
{
    static final class Registration
    {
        private final String fingerprint;
        private final Predicate<DeviceState> predicate;
        private final WakeSignal wake;

        private Registration(String fingerprint, Predicate<DeviceState> predicate, WakeSignal wake)
        {
            this.fingerprint = fingerprint;
            this.predicate = predicate;
            this.wake = wake;
        }
    }

    private final Map<String, Registration> byFingerprint = new HashMap<>();

    Registration register(String fingerprint, Predicate<DeviceState> predicate, WakeSignal wake)
    {
        Registration r = new Registration(
                Objects.requireNonNull(fingerprint, "fingerprint"),
                Objects.requireNonNull(predicate, "predicate"),
                Objects.requireNonNull(wake, "wake"));
        byFingerprint.put(fingerprint, r);
        return r;
    }

    void unregister(Registration registration)
    {
        byFingerprint.remove(registration.fingerprint, registration);
    }

    /**
     * Fire the device's wake signal if its predicate holds for the current state.
     */
    void onStatus(LightDevice device)
    {
        Registration r = byFingerprint.get(device.fingerprint());
        if (r != null && r.predicate.test(device.state())) {
            r.wake.fire();
        }
    }

    boolean isRegistered(String fingerprint)
    {
        return byFingerprint.containsKey(fingerprint);
    }

    int size()
    {
        return byFingerprint.size();
    }

    void clear()
    {
        byFingerprint.clear();
    }
}
