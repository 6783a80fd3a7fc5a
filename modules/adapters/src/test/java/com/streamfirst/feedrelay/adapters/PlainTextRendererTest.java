package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.Attachment;
import com.streamfirst.feedrelay.domain.Embed;
import com.streamfirst.feedrelay.domain.FormattingProfile;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.MessageKind;
import com.streamfirst.feedrelay.domain.OutboundPayload;
import com.streamfirst.feedrelay.domain.SourceMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlainTextRendererTest {

    private final PlainTextRenderer renderer = new PlainTextRenderer();

    private static MappingConfig mapping(FormattingProfile formatting) {
        return MappingConfig.builder()
                .mappingId("m1")
                .sourceId("src")
                .destinationId("chat")
                .label("News")
                .formatting(formatting)
                .build();
    }

    private static SourceMessage.SourceMessageBuilder message() {
        return SourceMessage.builder()
                .id("555")
                .channelId("src")
                .authorName("alice")
                .content("  Hello world  ");
    }

    @Test
    void renders_header_and_content() {
        OutboundPayload payload = renderer.render(message().build(), mapping(FormattingProfile.DEFAULT),
                MessageKind.MESSAGE, null);

        assertThat(payload.text()).isEqualTo("News • alice\n\nHello world");
        assertThat(payload.extraMessages()).isEmpty();
        assertThat(payload.parseMode()).isNull();
        assertThat(payload.disablePreview()).isTrue();
    }

    @Test
    void pinned_and_forum_kinds_are_marked() {
        MappingConfig mapping = mapping(FormattingProfile.DEFAULT);

        assertThat(renderer.render(message().build(), mapping, MessageKind.PINNED, null).text())
                .startsWith("📌 News • alice");
        assertThat(renderer.render(message().build(), mapping, MessageKind.FORUM_THREAD, " Launch ").text())
                .startsWith("News • alice\n🧵 Launch\n\nHello world");
    }

    @Test
    void label_falls_back_to_source_id() {
        MappingConfig unlabeled = mapping(FormattingProfile.DEFAULT).withLabel("");

        assertThat(renderer.render(message().authorName("").build(), unlabeled, MessageKind.MESSAGE, null).text())
                .startsWith("src\n\n");
    }

    @Test
    void images_are_separated_from_other_attachments() {
        SourceMessage message = message()
                .attachment(new Attachment("photo.jpg", "https://cdn/photo.jpg", ""))
                .attachment(new Attachment("notes.txt", "https://cdn/notes.txt", "text/plain"))
                .attachment(new Attachment("", "https://cdn/blob", ""))
                .build();

        OutboundPayload payload = renderer.render(message, mapping(FormattingProfile.DEFAULT), MessageKind.MESSAGE, null);

        assertThat(payload.imageUrls()).containsExactly("https://cdn/photo.jpg");
        assertThat(payload.text()).endsWith(
                "Attachments: 2\n• notes.txt: https://cdn/notes.txt\n• Attachment 2: https://cdn/blob");
    }

    @Test
    void link_style_lists_bare_urls_and_embeds_are_included() {
        FormattingProfile links = FormattingProfile.builder()
                .attachmentsStyle(FormattingProfile.AttachmentsStyle.LINKS)
                .showSourceLink(true)
                .disablePreview(false)
                .build();
        SourceMessage message = message()
                .embed(new Embed("Title", "Description"))
                .attachment(new Attachment("a.zip", "https://cdn/a.zip", ""))
                .build();

        OutboundPayload payload = renderer.render(message, mapping(links), MessageKind.MESSAGE, null);

        assertThat(payload.text()).isEqualTo(
                "News • alice\n\nHello world\n\nTitle\nDescription\n\nhttps://cdn/a.zip\n\nSource: src/555");
        assertThat(payload.disablePreview()).isFalse();
    }

    @Test
    void long_text_is_split_into_chunks() {
        FormattingProfile small = FormattingProfile.builder().maxLength(30).build();
        SourceMessage message = message().content("first line of text\nsecond line of text").build();

        OutboundPayload payload = renderer.render(message, mapping(small), MessageKind.MESSAGE, null);

        assertThat(payload.text()).isEqualTo("News • alice");
        assertThat(payload.extraMessages()).containsExactly("first line of text", "second line of text");
    }

    @Test
    void chunk_prefers_line_breaks_and_marks_hard_cuts() {
        assertThat(PlainTextRenderer.chunk("short", 10, "…")).containsExactly("short");
        assertThat(PlainTextRenderer.chunk("aaaa\nbbbb", 6, "…")).containsExactly("aaaa", "bbbb");
        assertThat(PlainTextRenderer.chunk("abcdefghij", 6, "…")).containsExactly("abcde…", "fghij");
        assertThat(PlainTextRenderer.chunk("", 5, "…")).isEqualTo(List.of(""));
    }
}
