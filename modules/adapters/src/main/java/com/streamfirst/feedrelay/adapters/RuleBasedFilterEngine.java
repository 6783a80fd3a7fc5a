package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.Attachment;
import com.streamfirst.feedrelay.domain.FilterDecision;
import com.streamfirst.feedrelay.domain.FilterProfile;
import com.streamfirst.feedrelay.domain.SettingsParser;
import com.streamfirst.feedrelay.domain.SourceMessage;
import com.streamfirst.feedrelay.ports.FilterEngine;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.*;

/**
 * Filter engine applying a mapping's allow/deny lists in a fixed order: stickers, senders, roles,
 * whitelist, blacklist, then content types. The first rule that fails decides.
 */
@Slf4j
public class RuleBasedFilterEngine implements FilterEngine {

    private static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".gif", ".webp");
    private static final List<String> VIDEO_EXTENSIONS = List.of(".mp4", ".mov", ".mkv", ".webm");
    private static final List<String> AUDIO_EXTENSIONS = List.of(".mp3", ".ogg", ".wav", ".flac");

    @Override
    public FilterDecision evaluate(SourceMessage message, FilterProfile profile) {
        FilterDecision decision = decide(message, profile);
        if (!decision.allowed()) {
            log.debug("Message {} denied by rule {}", message.getId(), decision.reason());
        }
        return decision;
    }

    private FilterDecision decide(SourceMessage message, FilterProfile profile) {
        if (!message.getStickers().isEmpty()) {
            return FilterDecision.deny("sticker_blocked");
        }

        String authorId = message.getAuthorId() == null ? "" : message.getAuthorId().strip();
        String authorName = SettingsParser.normalizeUsername(message.getAuthorName());

        Senders allowed = Senders.of(profile.getAllowedSenders());
        if (!allowed.isEmpty() && !allowed.matches(authorId, authorName)) {
            return FilterDecision.deny("sender_not_allowed");
        }
        if (Senders.of(profile.getBlockedSenders()).matches(authorId, authorName)) {
            return FilterDecision.deny("sender_blocked");
        }

        Set<String> allowedRoles = cleaned(profile.getAllowedRoles(), false);
        if (!allowedRoles.isEmpty() && Collections.disjoint(message.getRoleIds(), allowedRoles)) {
            return FilterDecision.deny("role_not_allowed");
        }
        if (!Collections.disjoint(message.getRoleIds(), cleaned(profile.getBlockedRoles(), false))) {
            return FilterDecision.deny("role_blocked");
        }

        String content = message.getContent() == null ? "" : message.getContent().toLowerCase(Locale.ROOT);
        if (!profile.getWhitelist().isEmpty()
                && cleaned(profile.getWhitelist(), true).stream().noneMatch(content::contains)) {
            return FilterDecision.deny("whitelist_miss");
        }
        if (cleaned(profile.getBlacklist(), true).stream().anyMatch(content::contains)) {
            return FilterDecision.deny("blacklist_hit");
        }

        Set<String> types = inferTypes(message);
        Set<String> allowedTypes = cleaned(profile.getAllowedTypes(), true);
        if (!allowedTypes.isEmpty() && Collections.disjoint(types, allowedTypes)) {
            return FilterDecision.deny("type_not_allowed");
        }
        if (!Collections.disjoint(types, cleaned(profile.getBlockedTypes(), true))) {
            return FilterDecision.deny("type_blocked");
        }
        return FilterDecision.allow();
    }

    /**
     * Content categories of a message: text, sticker, image, video, audio, attachment, embed or empty.
     */
    static Set<String> inferTypes(SourceMessage message) {
        Set<String> types = new LinkedHashSet<>();
        boolean hasContent = message.getContent() != null && !message.getContent().isEmpty();
        if (hasContent) {
            types.add("text");
        }
        if (!message.getStickers().isEmpty()) {
            types.add("sticker");
        }
        for (Attachment attachment : message.getAttachments()) {
            types.add(attachmentType(attachment));
        }
        if (!message.getEmbeds().isEmpty()) {
            types.add("embed");
        }
        if (!hasContent && !message.hasAttachmentsOrEmbeds()) {
            types.add("empty");
        }
        return types;
    }

    private static String attachmentType(Attachment attachment) {
        String filename = attachment.filename().toLowerCase(Locale.ROOT);
        String contentType = attachment.contentType().toLowerCase(Locale.ROOT);
        if (IMAGE_EXTENSIONS.stream().anyMatch(filename::endsWith)) {
            return "image";
        }
        if (VIDEO_EXTENSIONS.stream().anyMatch(filename::endsWith)) {
            return "video";
        }
        if (AUDIO_EXTENSIONS.stream().anyMatch(filename::endsWith)) {
            return "audio";
        }
        if (contentType.startsWith("image/")) {
            return "image";
        }
        if (contentType.startsWith("video/")) {
            return "video";
        }
        if (contentType.startsWith("audio/")) {
            return "audio";
        }
        return "attachment";
    }

    private static Set<String> cleaned(Set<String> values, boolean lowercase) {
        Set<String> result = new HashSet<>();
        for (String value : values) {
            String text = value == null ? "" : value.strip();
            if (!text.isEmpty()) {
                result.add(lowercase ? text.toLowerCase(Locale.ROOT) : text);
            }
        }
        return result;
    }

    /**
     * Sender list split into numeric ids and normalized usernames.
     */
    private record Senders(Set<String> ids, Set<String> names) {

        static Senders of(Set<String> values) {
            Set<String> ids = new HashSet<>();
            Set<String> names = new HashSet<>();
            for (String value : values) {
                String text = value == null ? "" : value.strip();
                if (text.isEmpty()) {
                    continue;
                }
                String digits = text.startsWith("-") ? text.substring(1) : text;
                if (!digits.isEmpty() && digits.chars().allMatch(Character::isDigit)) {
                    ids.add(new BigInteger(text).toString());
                } else {
                    String normalized = SettingsParser.normalizeUsername(text);
                    names.add(normalized == null ? text.toLowerCase(Locale.ROOT) : normalized);
                }
            }
            return new Senders(ids, names);
        }

        boolean isEmpty() {
            return ids.isEmpty() && names.isEmpty();
        }

        boolean matches(String authorId, String authorName) {
            return ids.contains(authorId) || (authorName != null && names.contains(authorName));
        }
    }
}
