package com.questrail.lanlight.device;

import com.questrail.lanlight.codec.LanRequest;

/**
 * Outbound path to a single device's command port.
 */
@FunctionalInterface
public interface DeviceMessageSender
{
    /**
     * Encode and send {@code request} to the device's current address. Fire-and-forget.
     */
    void send(LightDevice device, LanRequest request);
}
