package com.questrail.lanlight.codec;

/**
 * Inbound message decoded from a light's datagram.
 */
public sealed interface LanResponse permits ScanResponse, StatusResponse
{
    String command();
}
