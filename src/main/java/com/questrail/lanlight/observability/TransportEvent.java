package com.questrail.lanlight.observability;

/**
 * Record describing a transport endpoint going up or down.
 *
 * @param cause failure cause, or {@code null} for an orderly transition
 */
public record TransportEvent(
    String localAddress,
    boolean up,
    Throwable cause
) {
}
