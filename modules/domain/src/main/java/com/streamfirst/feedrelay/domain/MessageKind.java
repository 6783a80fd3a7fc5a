package com.streamfirst.feedrelay.domain;

/**
 * Tag passed to the renderer describing why a message is being forwarded.
 */
public enum MessageKind {
    MESSAGE,
    PINNED,
    FORUM_THREAD
}
