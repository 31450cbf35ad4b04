package com.questrail.lanlight.internal.exec;

import com.questrail.lanlight.api.CommandKind;

import java.util.Objects;

/**
 * Ownership key of an in-flight command sequence.
 */
record CommandKey(String fingerprint, CommandKind kind) {
    CommandKey {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(kind, "kind");
    }
}
