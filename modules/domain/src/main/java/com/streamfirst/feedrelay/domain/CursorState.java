package com.streamfirst.feedrelay.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Persisted progress of a mapping. Which fields matter depends on the monitoring mode:
 * stream mappings use {@code lastSeenId}, pinned mappings the pinned set and flag, forum mappings
 * the thread set and flag. State only moves forward unless an administrator resets it.
 */
@Value
@With
@Builder(toBuilder = true)
public class CursorState {

    public static final CursorState EMPTY = CursorState.builder().build();

    /** Newest message id handled in stream mode, null before the first pass */
    String lastSeenId;

    @Builder.Default Set<String> knownPinnedIds = Set.of();

    /** False until a baseline of pinned ids has been captured */
    boolean pinnedSynced;

    @Builder.Default Set<String> knownThreadIds = Set.of();

    /** False until a baseline of forum threads has been captured */
    boolean forumSynced;

    public boolean isBootstrap() {
        return lastSeenId == null || lastSeenId.isEmpty();
    }

    /**
     * Combines this cursor with the one read back from storage, which another writer may have
     * advanced. The stream position is the newer of the two. A baseline captured by either side
     * counts, and known ids of two captured baselines are united.
     */
    public CursorState reconcile(CursorState stored) {
        if (stored == null || stored.equals(this)) {
            return this;
        }
        String lastSeen = stored.lastSeenId != null && MessageIds.isNewer(stored.lastSeenId, lastSeenId)
                ? stored.lastSeenId
                : lastSeenId;
        return CursorState.builder()
                .lastSeenId(lastSeen)
                .knownPinnedIds(unite(pinnedSynced, knownPinnedIds, stored.pinnedSynced, stored.knownPinnedIds))
                .pinnedSynced(pinnedSynced || stored.pinnedSynced)
                .knownThreadIds(unite(forumSynced, knownThreadIds, stored.forumSynced, stored.knownThreadIds))
                .forumSynced(forumSynced || stored.forumSynced)
                .build();
    }

    private static Set<String> unite(boolean synced, Set<String> ids, boolean otherSynced, Set<String> otherIds) {
        if (synced != otherSynced) {
            return synced ? ids : otherIds;
        }
        Set<String> united = new LinkedHashSet<>(ids);
        united.addAll(otherIds);
        return Set.copyOf(united);
    }
}
