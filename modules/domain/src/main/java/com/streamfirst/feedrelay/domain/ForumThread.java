package com.streamfirst.feedrelay.domain;

import java.util.Objects;

/**
 * Thread opened inside a forum-style source channel.
 *
 * @param id the thread identifier, snowflake-ordered like message identifiers
 * @param title the thread title, forwarded as context with its opening message
 */
public record ForumThread(String id, String title) {
    public ForumThread {
        Objects.requireNonNull(id, "Thread id cannot be null");
        title = title == null ? "" : title;
    }
}
