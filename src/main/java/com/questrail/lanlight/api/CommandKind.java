package com.questrail.lanlight.api;

/**
 * Kind of device command.
 *
 * <p>Together with a device fingerprint, the kind keys in-flight command
 * sequences: a new command of the same kind for the same device supersedes the
 * previous one.</p>
 */
public enum CommandKind {
    POWER(true),
    BRIGHTNESS(true),
    COLOR(true),
    SEGMENT_COLOR(false),
    SCENE(false),
    RAW(false);

    private final boolean stateful;

    CommandKind(boolean stateful) {
        this.stateful = stateful;
    }

    /**
     * Stateful commands are retried until confirmed; the rest are sent once.
     */
    public boolean isStateful() {
        return stateful;
    }
}
