package com.streamfirst.feedrelay.domain;

/**
 * Rich preview block carried by a source message.
 */
public record Embed(String title, String description) {
    public Embed {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
    }
}
