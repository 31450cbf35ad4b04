package com.questrail.lanlight.api;

import com.questrail.lanlight.device.LightDevice;

/**
 * Invoked on the controller's scheduler once per evicted device.
 */
@FunctionalInterface
public interface EvictionHandler {

    EvictionHandler NONE = device -> { };

    void onEvicted(LightDevice device);
}
