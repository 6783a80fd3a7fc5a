package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.Attachment;
import com.streamfirst.feedrelay.domain.Embed;
import com.streamfirst.feedrelay.domain.FormattingProfile;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.MessageKind;
import com.streamfirst.feedrelay.domain.OutboundPayload;
import com.streamfirst.feedrelay.domain.SourceMessage;
import com.streamfirst.feedrelay.ports.MessageRenderer;

import java.util.*;

/**
 * Renders source messages as plain text: a header with the mapping label and author, the content,
 * embeds and attachments. Image attachments are passed as image URLs instead of text. Bodies longer
 * than the profile's maximum length are split into continuation messages.
 */
public class PlainTextRenderer implements MessageRenderer {

    static final String PIN_ICON = "📌";
    static final String THREAD_ICON = "🧵";
    static final String SEPARATOR = " • ";

    private static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".gif", ".webp");

    @Override
    public OutboundPayload render(SourceMessage message, MappingConfig mapping, MessageKind kind, String threadTitle) {
        FormattingProfile formatting = mapping.getFormatting();
        List<String> blocks = new ArrayList<>();

        blocks.add(header(message, mapping, kind, threadTitle));

        String content = message.getContent() == null ? "" : message.getContent().strip();
        if (!content.isEmpty()) {
            blocks.add(content);
        }

        for (Embed embed : message.getEmbeds()) {
            String block = embedBlock(embed);
            if (!block.isEmpty()) {
                blocks.add(block);
            }
        }

        List<String> imageUrls = new ArrayList<>();
        List<Attachment> files = new ArrayList<>();
        for (Attachment attachment : message.getAttachments()) {
            if (isImage(attachment) && !attachment.url().isBlank()) {
                imageUrls.add(attachment.url());
            } else {
                files.add(attachment);
            }
        }
        if (!files.isEmpty()) {
            blocks.add(attachmentsBlock(files, formatting.getAttachmentsStyle()));
        }

        if (formatting.isShowSourceLink() && message.getChannelId() != null) {
            blocks.add("Source: " + message.getChannelId() + "/" + message.getId());
        }

        List<String> chunks = chunk(String.join("\n\n", blocks), formatting.getMaxLength(), formatting.getEllipsis());
        return new OutboundPayload(
                chunks.get(0),
                chunks.subList(1, chunks.size()),
                null,
                formatting.isDisablePreview(),
                imageUrls);
    }

    private static String header(SourceMessage message, MappingConfig mapping, MessageKind kind, String threadTitle) {
        StringBuilder header = new StringBuilder();
        if (kind == MessageKind.PINNED) {
            header.append(PIN_ICON).append(' ');
        }
        header.append(mapping.displayLabel());
        String author = message.getAuthorName() == null ? "" : message.getAuthorName().strip();
        if (!author.isEmpty()) {
            header.append(SEPARATOR).append(author);
        }
        if (kind == MessageKind.FORUM_THREAD && threadTitle != null && !threadTitle.isBlank()) {
            header.append('\n').append(THREAD_ICON).append(' ').append(threadTitle.strip());
        }
        return header.toString();
    }

    private static String embedBlock(Embed embed) {
        List<String> lines = new ArrayList<>(2);
        if (!embed.title().isBlank()) {
            lines.add(embed.title().strip());
        }
        if (!embed.description().isBlank()) {
            lines.add(embed.description().strip());
        }
        return String.join("\n", lines);
    }

    private static String attachmentsBlock(List<Attachment> files, FormattingProfile.AttachmentsStyle style) {
        List<String> lines = new ArrayList<>();
        if (style == FormattingProfile.AttachmentsStyle.LINKS) {
            for (Attachment file : files) {
                lines.add(file.url().isBlank() ? file.filename() : file.url());
            }
            return String.join("\n", lines);
        }
        lines.add("Attachments: " + files.size());
        int index = 1;
        for (Attachment file : files) {
            String name = file.filename().isBlank() ? "Attachment " + index : file.filename();
            lines.add(file.url().isBlank() ? "• " + name : "• " + name + ": " + file.url());
            index++;
        }
        return String.join("\n", lines);
    }

    static boolean isImage(Attachment attachment) {
        String filename = attachment.filename().toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(filename::endsWith)
                || attachment.contentType().toLowerCase(Locale.ROOT).startsWith("image/");
    }

    /**
     * Splits text into chunks of at most {@code limit} characters, preferring line breaks.
     * A line longer than the limit is cut and the cut is marked with the ellipsis.
     */
    static List<String> chunk(String text, int limit, String ellipsis) {
        String marker = ellipsis == null ? "" : ellipsis;
        if (limit <= marker.length() || text.length() <= limit) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        String remaining = text;
        while (remaining.length() > limit) {
            int cut = remaining.lastIndexOf('\n', limit);
            if (cut > 0) {
                chunks.add(remaining.substring(0, cut).stripTrailing());
                remaining = remaining.substring(cut + 1);
            } else {
                int hard = limit - marker.length();
                chunks.add(remaining.substring(0, hard) + marker);
                remaining = remaining.substring(hard);
            }
        }
        if (!remaining.isBlank()) {
            chunks.add(remaining);
        }
        return chunks;
    }
}
