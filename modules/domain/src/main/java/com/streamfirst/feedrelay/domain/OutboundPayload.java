package com.streamfirst.feedrelay.domain;

import java.util.List;

/**
 * Destination-native payload produced by the renderer.
 *
 * @param text the first message body
 * @param extraMessages continuation chunks when the body exceeds the destination limit
 * @param parseMode markup dialect understood by the destination, null for plain text
 * @param disablePreview whether link previews should be suppressed
 * @param imageUrls images to deliver alongside the text
 */
public record OutboundPayload(
        String text,
        List<String> extraMessages,
        String parseMode,
        boolean disablePreview,
        List<String> imageUrls
) {
    public OutboundPayload {
        text = text == null ? "" : text;
        extraMessages = extraMessages == null ? List.of() : List.copyOf(extraMessages);
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    public static OutboundPayload text(String text) {
        return new OutboundPayload(text, List.of(), null, true, List.of());
    }
}
