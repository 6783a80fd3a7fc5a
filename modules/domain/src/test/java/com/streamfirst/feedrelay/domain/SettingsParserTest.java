package com.streamfirst.feedrelay.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SettingsParserTest {

    private static final Duration FALLBACK = Duration.ofSeconds(7);

    @Test
    void bare_integers_are_milliseconds_and_decimals_are_seconds() {
        assertThat(SettingsParser.parseDelay("250", FALLBACK)).isEqualTo(Duration.ofMillis(250));
        assertThat(SettingsParser.parseDelay("1.5", FALLBACK)).isEqualTo(Duration.ofMillis(1500));
        assertThat(SettingsParser.parseDelay("2e0", FALLBACK)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void negative_delays_clamp_and_garbage_falls_back() {
        assertThat(SettingsParser.parseDelay("-5", FALLBACK)).isEqualTo(Duration.ZERO);
        assertThat(SettingsParser.parseDelay("-0.5", FALLBACK)).isEqualTo(Duration.ZERO);
        assertThat(SettingsParser.parseDelay("soon", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(SettingsParser.parseDelay("  ", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(SettingsParser.parseDelay(null, FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    void booleans_accept_common_spellings() {
        assertThat(SettingsParser.parseBool("ON", false)).isTrue();
        assertThat(SettingsParser.parseBool(" yes ", false)).isTrue();
        assertThat(SettingsParser.parseBool("0", true)).isFalse();
        assertThat(SettingsParser.parseBool("maybe", true)).isTrue();
        assertThat(SettingsParser.parseBool(null, false)).isFalse();
    }

    @Test
    void seconds_accept_fractions() {
        assertThat(SettingsParser.parseSeconds("2.5", FALLBACK)).isEqualTo(Duration.ofMillis(2500));
        assertThat(SettingsParser.parseSeconds("-1", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(SettingsParser.parseSeconds("x", FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    void usernames_are_lowercased_without_at_sign() {
        assertThat(SettingsParser.normalizeUsername(" @Alice ")).isEqualTo("alice");
        assertThat(SettingsParser.normalizeUsername("@")).isNull();
        assertThat(SettingsParser.normalizeUsername(null)).isNull();
    }
}
