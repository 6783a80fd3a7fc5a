package com.streamfirst.feedrelay.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SnowflakesTest {

    @Test
    void epoch_maps_to_zero_and_earlier_instants_clamp() {
        assertThat(Snowflakes.fromInstant(Instant.ofEpochMilli(Snowflakes.EPOCH_MILLIS))).isZero();
        assertThat(Snowflakes.fromInstant(Instant.EPOCH)).isZero();
    }

    @Test
    void timestamp_is_stored_in_the_high_bits() {
        Instant moment = Instant.parse("2024-03-01T12:00:00Z");
        long snowflake = Snowflakes.fromInstant(moment);

        assertThat(snowflake).isEqualTo((moment.toEpochMilli() - Snowflakes.EPOCH_MILLIS) << 22);
        assertThat(Snowflakes.toInstant(snowflake)).isEqualTo(moment);
        assertThat(Snowflakes.toInstant(snowflake + 4_000)).isEqualTo(moment);
    }
}
