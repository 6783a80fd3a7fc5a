package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.Attachment;
import com.streamfirst.feedrelay.domain.Embed;
import com.streamfirst.feedrelay.domain.SourceMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds normalized content fingerprints so the same payload re-posted under a new id, or in
 * another channel, is recognized.
 */
public final class MessageSignatures {

    private MessageSignatures() {
    }

    /**
     * Returns the signature of a message, or null if it carries no text, attachment or embed.
     */
    public static String of(SourceMessage message) {
        String content = message.getContent() == null ? "" : message.getContent().strip();
        List<String> attachmentTokens = message.getAttachments().stream()
                .map(MessageSignatures::attachmentToken)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        List<String> embedTokens = message.getEmbeds().stream()
                .map(MessageSignatures::embedToken)
                .filter(Objects::nonNull)
                .sorted()
                .toList();

        if (content.isEmpty() && attachmentTokens.isEmpty() && embedTokens.isEmpty()) {
            return null;
        }

        List<String> parts = new ArrayList<>(3);
        if (!content.isEmpty()) {
            parts.add(content);
        }
        if (!attachmentTokens.isEmpty()) {
            parts.add("attachments:" + String.join("|", attachmentTokens));
        }
        if (!embedTokens.isEmpty()) {
            parts.add("embeds:" + String.join("|", embedTokens));
        }
        return String.join("\n", parts);
    }

    private static String attachmentToken(Attachment attachment) {
        String url = attachment.url().strip();
        String filename = attachment.filename().strip();
        if (url.isEmpty() && filename.isEmpty()) {
            return null;
        }
        return filename + "|" + url;
    }

    private static String embedToken(Embed embed) {
        String combined = Stream.of(embed.title().strip(), embed.description().strip())
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining("\n"));
        return combined.isEmpty() ? null : combined;
    }
}
