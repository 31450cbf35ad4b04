package com.questrail.lanlight.api;

/**
 * How a command ended. Command futures always complete normally with one of these.
 */
public enum CommandOutcome {
    /** A status response confirmed the requested state. */
    VERIFIED,
    /** The retry budget was spent without confirmation. Best-effort, not an error. */
    EXHAUSTED,
    /** Cancelled by a newer command for the same device and kind, or by shutdown. */
    SUPERSEDED,
    /** Fire-and-forget command handed to the transport. */
    SENT,
    /** A precondition failed (missing capability, bad segment, unknown scene); nothing was sent. */
    REJECTED
}
