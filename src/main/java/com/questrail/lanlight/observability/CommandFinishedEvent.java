package com.questrail.lanlight.observability;

import com.questrail.lanlight.api.CommandKind;
import com.questrail.lanlight.api.CommandOutcome;

/**
 * Record describing how a device command ended.
 *
 * @param sends number of times the command itself was transmitted
 */
public record CommandFinishedEvent(
    String fingerprint,
    CommandKind kind,
    CommandOutcome outcome,
    int sends
) {
}
