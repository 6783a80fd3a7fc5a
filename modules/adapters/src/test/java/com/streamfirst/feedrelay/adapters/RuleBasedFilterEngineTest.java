package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.Attachment;
import com.streamfirst.feedrelay.domain.Embed;
import com.streamfirst.feedrelay.domain.FilterDecision;
import com.streamfirst.feedrelay.domain.FilterProfile;
import com.streamfirst.feedrelay.domain.SourceMessage;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedFilterEngineTest {

    private final RuleBasedFilterEngine engine = new RuleBasedFilterEngine();

    private static SourceMessage.SourceMessageBuilder message(String content) {
        return SourceMessage.builder()
                .id("100")
                .authorId("42")
                .authorName("Alice")
                .content(content);
    }

    @Test
    void empty_profile_allows_everything() {
        assertThat(engine.evaluate(message("hello").build(), FilterProfile.EMPTY).allowed()).isTrue();
    }

    @Test
    void stickers_are_always_denied() {
        FilterDecision decision = engine.evaluate(message("").sticker("wave").build(), FilterProfile.EMPTY);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("sticker_blocked");
    }

    @Test
    void allowed_senders_match_ids_and_usernames() {
        FilterProfile byId = FilterProfile.builder().allowedSenders(Set.of("0042")).build();
        FilterProfile byName = FilterProfile.builder().allowedSenders(Set.of("@ALICE")).build();
        FilterProfile other = FilterProfile.builder().allowedSenders(Set.of("bob", "7")).build();

        assertThat(engine.evaluate(message("hi").build(), byId).allowed()).isTrue();
        assertThat(engine.evaluate(message("hi").build(), byName).allowed()).isTrue();
        assertThat(engine.evaluate(message("hi").build(), other).reason()).isEqualTo("sender_not_allowed");
    }

    @Test
    void blocked_sender_is_denied() {
        FilterProfile profile = FilterProfile.builder().blockedSenders(Set.of("alice")).build();

        assertThat(engine.evaluate(message("hi").build(), profile).reason()).isEqualTo("sender_blocked");
    }

    @Test
    void roles_are_checked_after_senders() {
        FilterProfile allow = FilterProfile.builder().allowedRoles(Set.of("mod")).build();
        FilterProfile block = FilterProfile.builder().blockedRoles(Set.of("muted")).build();

        assertThat(engine.evaluate(message("hi").roleId("member").build(), allow).reason())
                .isEqualTo("role_not_allowed");
        assertThat(engine.evaluate(message("hi").roleId("mod").build(), allow).allowed()).isTrue();
        assertThat(engine.evaluate(message("hi").roleId("muted").build(), block).reason())
                .isEqualTo("role_blocked");
    }

    @Test
    void whitelist_and_blacklist_match_case_insensitive_substrings() {
        FilterProfile profile = FilterProfile.builder()
                .whitelist(Set.of("Release"))
                .blacklist(Set.of("beta"))
                .build();

        assertThat(engine.evaluate(message("New RELEASE out").build(), profile).allowed()).isTrue();
        assertThat(engine.evaluate(message("nothing here").build(), profile).reason()).isEqualTo("whitelist_miss");
        assertThat(engine.evaluate(message("release Beta 2").build(), profile).reason()).isEqualTo("blacklist_hit");
    }

    @Test
    void first_failing_rule_decides() {
        FilterProfile profile = FilterProfile.builder()
                .blockedSenders(Set.of("42"))
                .blacklist(Set.of("spam"))
                .build();

        assertThat(engine.evaluate(message("spam").build(), profile).reason()).isEqualTo("sender_blocked");
    }

    @Test
    void content_types_are_filtered() {
        SourceMessage photo = message("")
                .attachment(new Attachment("cat.PNG", "https://cdn/cat.png", ""))
                .build();
        FilterProfile imagesOnly = FilterProfile.builder().allowedTypes(Set.of("image")).build();
        FilterProfile noImages = FilterProfile.builder().blockedTypes(Set.of("IMAGE")).build();

        assertThat(engine.evaluate(photo, imagesOnly).allowed()).isTrue();
        assertThat(engine.evaluate(message("text").build(), imagesOnly).reason()).isEqualTo("type_not_allowed");
        assertThat(engine.evaluate(photo, noImages).reason()).isEqualTo("type_blocked");
    }

    @Test
    void infers_types_from_extension_then_content_type() {
        SourceMessage message = message("caption")
                .attachment(new Attachment("clip.mp4", "u1", ""))
                .attachment(new Attachment("voice", "u2", "audio/ogg"))
                .attachment(new Attachment("report.pdf", "u3", "application/pdf"))
                .embed(new Embed("Title", ""))
                .build();

        assertThat(RuleBasedFilterEngine.inferTypes(message))
                .containsExactly("text", "video", "audio", "attachment", "embed");
        assertThat(RuleBasedFilterEngine.inferTypes(message("").build())).containsExactly("empty");
    }
}
