package com.streamfirst.feedrelay.application;

/**
 * Where the monitor loop stands in the configuration reload handshake.
 */
public enum HandshakeState {
    /** Waiting for the next poll or for a refresh */
    IDLE,
    /** A refresh was signalled and the loop is about to reload */
    RELOAD_PENDING,
    /** Reload target fixed, waiting for a health pass that covers it */
    WAITING_FOR_HEALTH,
    /** Processing mappings under an applied configuration */
    ACTIVE
}
