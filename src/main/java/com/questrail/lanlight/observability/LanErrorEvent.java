package com.questrail.lanlight.observability;

/**
 * Record representing an error escaping a task on the controller's scheduler.
 */
public record LanErrorEvent(
    String message,
    Throwable cause
) {
}
