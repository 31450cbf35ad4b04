package com.questrail.lanlight.api;

import com.questrail.lanlight.device.LightDevice;

/**
 * Invoked on the controller's scheduler after every status refresh of a device.
 */
@FunctionalInterface
public interface DeviceUpdateHandler {

    void onUpdated(LightDevice device);
}
