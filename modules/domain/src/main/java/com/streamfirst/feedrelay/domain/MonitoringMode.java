package com.streamfirst.feedrelay.domain;

/**
 * How a mapping observes its source.
 */
public enum MonitoringMode {
    /** Append-only message stream followed with a scalar cursor */
    STREAM,
    /** Set of pinned messages followed with a known-id set */
    PINNED,
    /** Set of forum threads followed with a known-thread set */
    FORUM
}
