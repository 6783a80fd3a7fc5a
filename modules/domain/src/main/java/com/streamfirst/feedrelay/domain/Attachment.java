package com.streamfirst.feedrelay.domain;

/**
 * File attached to a source message.
 *
 * @param filename original file name, may be empty
 * @param url download location, may be empty
 * @param contentType MIME type reported by the source, may be empty
 */
public record Attachment(String filename, String url, String contentType) {
    public Attachment {
        filename = filename == null ? "" : filename;
        url = url == null ? "" : url;
        contentType = contentType == null ? "" : contentType;
    }
}
