package com.questrail.lanlight.api;

import com.questrail.lanlight.device.LightDevice;

/**
 * Invoked on the controller's scheduler whenever a scan response names a device.
 */
@FunctionalInterface
public interface DiscoveryHandler {

    /**
     * Accepts every device.
     */
    DiscoveryHandler ACCEPT_ALL = (device, isNew) -> true;

    /**
     * @param device the device named by the scan response
     * @param isNew  {@code true} if the fingerprint was not registered yet
     * @return for new devices, whether to register it; ignored for known devices
     */
    boolean onDiscovered(LightDevice device, boolean isNew);
}
