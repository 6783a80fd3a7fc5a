package com.streamfirst.feedrelay.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageIdsTest {

    @Test
    void numeric_ids_sort_numerically_not_lexicographically() {
        List<String> ids = new ArrayList<>(List.of("100", "9", "1000000000000000000001", "20"));
        ids.sort(MessageIds.ORDER);
        assertThat(ids).containsExactly("9", "20", "100", "1000000000000000000001");
    }

    @Test
    void non_numeric_ids_rank_as_zero_and_tie_break_lexicographically() {
        List<String> ids = new ArrayList<>(List.of("5", "beta", "0", "alpha"));
        ids.sort(MessageIds.ORDER);
        assertThat(ids).containsExactly("0", "alpha", "beta", "5");
    }

    @Test
    void null_marker_is_older_than_everything() {
        assertThat(MessageIds.isNewer("1", null)).isTrue();
        assertThat(MessageIds.isNewer("1", "")).isTrue();
        assertThat(MessageIds.isNewer("10", "9")).isTrue();
        assertThat(MessageIds.isNewer("9", "10")).isFalse();
        assertThat(MessageIds.isNewer("10", "10")).isFalse();
    }

    @Test
    void at_or_before_only_applies_to_numeric_ids() {
        assertThat(MessageIds.isAtOrBefore("100", 100)).isTrue();
        assertThat(MessageIds.isAtOrBefore("101", 100)).isFalse();
        assertThat(MessageIds.isAtOrBefore("abc", 100)).isFalse();
        assertThat(MessageIds.isNumeric("-1")).isFalse();
    }
}
