package com.streamfirst.feedrelay.domain;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CursorStateTest {

    @Test
    void reconcile_keeps_the_newer_stream_position() {
        CursorState snapshot = CursorState.builder().lastSeenId("100").build();
        CursorState stored = CursorState.builder().lastSeenId("250").build();

        assertThat(snapshot.reconcile(stored).getLastSeenId()).isEqualTo("250");
        assertThat(stored.reconcile(snapshot).getLastSeenId()).isEqualTo("250");
        assertThat(snapshot.reconcile(CursorState.EMPTY).getLastSeenId()).isEqualTo("100");
        assertThat(CursorState.EMPTY.reconcile(stored).getLastSeenId()).isEqualTo("250");
    }

    @Test
    void reconcile_unites_known_ids_of_captured_baselines() {
        CursorState snapshot = CursorState.builder().knownPinnedIds(Set.of("a")).pinnedSynced(true).build();
        CursorState stored = CursorState.builder().knownPinnedIds(Set.of("a", "b")).pinnedSynced(true).build();

        CursorState reconciled = snapshot.reconcile(stored);

        assertThat(reconciled.getKnownPinnedIds()).containsExactlyInAnyOrder("a", "b");
        assertThat(reconciled.isPinnedSynced()).isTrue();
    }

    @Test
    void reconcile_prefers_the_side_that_captured_a_baseline() {
        CursorState snapshot = CursorState.EMPTY;
        CursorState stored = CursorState.builder().knownThreadIds(Set.of("t1", "t2")).forumSynced(true).build();

        CursorState reconciled = snapshot.reconcile(stored);

        assertThat(reconciled.isForumSynced()).isTrue();
        assertThat(reconciled.getKnownThreadIds()).containsExactlyInAnyOrder("t1", "t2");
        assertThat(stored.reconcile(stored)).isSameAs(stored);
    }
}
