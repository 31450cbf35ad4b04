package com.questrail.lanlight.codec;

/**
 * Indicates that an inbound datagram could not be translated into a
 * {@link LanResponse}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Payload that is not JSON</li>
 *   <li>Missing {@code msg} envelope or {@code cmd} field</li>
 *   <li>Unsupported command</li>
 * </ul>
 */
public final class LanDecodeException extends RuntimeException
{
    public LanDecodeException(String message) {
        super(message);
    }

    public LanDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
