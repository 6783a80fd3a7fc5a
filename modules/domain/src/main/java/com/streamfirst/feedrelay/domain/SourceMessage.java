package com.streamfirst.feedrelay.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Subset of a source feed message used by the relay.
 */
@Value
@Builder(toBuilder = true)
public class SourceMessage {

    /** Message type codes that carry forwardable user content */
    public static final Set<Integer> FORWARDABLE_TYPES = Set.of(0, 19, 20, 21, 23);

    /** Source-issued identifier, snowflake-ordered */
    @NonNull String id;

    /** Channel or thread the message was posted in */
    String channelId;

    @Builder.Default String authorId = "";

    @Builder.Default String authorName = "";

    @Builder.Default String content = "";

    @Singular List<Attachment> attachments;

    @Singular List<Embed> embeds;

    @Singular List<String> stickers;

    /** Role identifiers held by the author */
    @Singular Set<String> roleIds;

    /** Creation time if the source reported one */
    Instant timestamp;

    /** Source message type code, 0 for a regular message */
    int type;

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public boolean hasAttachmentsOrEmbeds() {
        return !attachments.isEmpty() || !embeds.isEmpty();
    }

    /**
     * Returns true if the message carries user content worth forwarding: a regular type code,
     * or any attachment or embed regardless of type.
     */
    public boolean isForwardable() {
        return FORWARDABLE_TYPES.contains(type) || hasAttachmentsOrEmbeds();
    }
}
