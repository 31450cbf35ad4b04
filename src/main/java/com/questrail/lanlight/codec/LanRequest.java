package com.questrail.lanlight.codec;

/**
 * Outbound message sent by the controller to a light.
 *
 * <p>
 * Every request maps to one {@code {"msg":{"cmd":...,"data":{...}}}} datagram.
 * Value clamping happens when the request is constructed, so the encoded payload
 * and the verification predicate built from the same request always agree.
 * </p>
 */
public sealed interface LanRequest
        permits ScanRequest, StatusRequest, TurnRequest, BrightnessRequest, ColorRequest, PtRealRequest
{
    /**
     * @return the wire {@code cmd} value
     */
    String command();
}
