package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.CursorState;
import com.streamfirst.feedrelay.domain.ForumThread;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.MessageIds;
import com.streamfirst.feedrelay.domain.MessageKind;
import com.streamfirst.feedrelay.domain.RuntimeOptions;
import com.streamfirst.feedrelay.domain.Snowflakes;
import com.streamfirst.feedrelay.domain.SourceMessage;
import com.streamfirst.feedrelay.ports.ConfigRepository;
import com.streamfirst.feedrelay.ports.SourceFeed;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Runs one synchronization pass over a mapping in its monitoring mode and advances the mapping's
 * cursor. Each pass holds the mapping's {@link ChannelGuard} lock for its whole duration.
 *
 * <p>Stream mode forwards messages newer than the last seen id. Pinned and forum modes diff the
 * current set of pinned messages or threads against the known set and forward the additions.
 * All modes skip content created before the process started, so a restart never replays history.
 */
@Slf4j
@Builder
public class SyncEngine {

    @NonNull private final SourceFeed sourceFeed;
    @NonNull private final ConfigRepository configRepository;
    @NonNull private final ForwardingPipeline pipeline;
    @NonNull private final ChannelGuard guard;
    /** Paces sends to the destination, shared with the coordinator which updates its rate */
    @NonNull private final RateLimiter sinkRate;

    @Builder.Default private final Sleeper sleeper = Sleeper.SYSTEM;
    @Builder.Default private final Instant processStart = Instant.now();
    @Builder.Default private final Duration fetchFailurePause = Duration.ofSeconds(1);
    @Builder.Default private final Random random = new Random();

    /**
     * Processes one mapping.
     *
     * @param mapping the current snapshot of the mapping
     * @param runtime runtime options of the applied configuration
     * @param abortRequested polled between messages; when it returns true the pass stops early and
     *                       keeps the progress made so far
     * @return the outcome with the updated mapping snapshot
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public SyncOutcome process(MappingConfig mapping, RuntimeOptions runtime, BooleanSupplier abortRequested)
            throws InterruptedException {
        if (!mapping.isActive()) {
            log.debug("Skipping inactive mapping {}", mapping.getMappingId());
            return SyncOutcome.unchanged(mapping);
        }
        if (mapping.isBlockedByHealth()) {
            log.debug("Skipping mapping {} blocked by failed health check", mapping.getMappingId());
            return SyncOutcome.unchanged(mapping);
        }
        try (ChannelGuard.Permit ignored = guard.lock(mapping.getSourceId())) {
            MappingConfig current = withStoredCursor(mapping);
            return switch (current.getMode()) {
                case STREAM -> syncStream(current, runtime, abortRequested);
                case PINNED -> syncPinned(current, runtime, abortRequested);
                case FORUM -> syncForum(current, runtime, abortRequested);
            };
        }
    }

    /**
     * A manual forward holding the lock before this pass may have moved the cursor past the snapshot.
     */
    private MappingConfig withStoredCursor(MappingConfig mapping) {
        Optional<CursorState> stored;
        try {
            stored = configRepository.loadCursor(mapping.getMappingId());
        } catch (RuntimeException e) {
            log.warn("Failed to read back cursor of mapping {}, using snapshot: {}", mapping.getMappingId(), e.toString());
            return mapping;
        }
        return stored
                .map(cursor -> mapping.withCursor(mapping.getCursor().reconcile(cursor)))
                .orElse(mapping);
    }

    /**
     * Releases the idle per-source locks of sources that are no longer mapped.
     */
    public void retainSources(Set<String> sourceIds) {
        int dropped = guard.retainOnly(sourceIds);
        if (dropped > 0) {
            log.debug("Dropped {} locks of removed sources", dropped);
        }
    }

    public Instant getProcessStart() {
        return processStart;
    }

    private SyncOutcome syncStream(MappingConfig mapping, RuntimeOptions runtime, BooleanSupplier abortRequested)
            throws InterruptedException {
        CursorState cursor = mapping.getCursor();
        String previous = cursor.getLastSeenId();
        List<SourceMessage> fetched;
        try {
            fetched = sourceFeed.fetchSince(mapping.getSourceId(), previous, runtime.getFetchLimit());
        } catch (RuntimeException e) {
            log.error("Failed to fetch messages of {}", mapping.getSourceId(), e);
            sleeper.sleep(fetchFailurePause);
            return SyncOutcome.unchanged(mapping);
        }
        if (fetched.isEmpty()) {
            return SyncOutcome.unchanged(mapping);
        }

        boolean bootstrap = cursor.isBootstrap();
        Instant baseline = cutoff(mapping);
        long baselineMarker = Snowflakes.fromInstant(baseline);
        long startMarker = Snowflakes.fromInstant(processStart);
        boolean deduplicate = mapping.deduplicate(runtime);

        String lastSeen = previous;
        int forwarded = 0;
        int failed = 0;
        boolean interrupted = false;
        for (SourceMessage message : inIdOrder(fetched)) {
            if (abortRequested.getAsBoolean()) {
                interrupted = true;
                break;
            }
            if (isAtOrBefore(message, startMarker, processStart)) {
                lastSeen = advance(lastSeen, message.getId());
                continue;
            }
            if (bootstrap) {
                if (isAtOrBefore(message, baselineMarker, baseline)) {
                    lastSeen = advance(lastSeen, message.getId());
                    continue;
                }
                bootstrap = false;
            }
            Optional<String> rejection = pipeline.rejectionReason(message, mapping);
            if (rejection.isPresent()) {
                log.debug("Message {} of {} skipped: {}", message.getId(), mapping.getSourceId(), rejection.get());
                lastSeen = advance(lastSeen, message.getId());
                continue;
            }
            sinkRate.acquire();
            if (abortRequested.getAsBoolean()) {
                interrupted = true;
                break;
            }
            if (pipeline.isDuplicate(message, deduplicate)) {
                log.debug("Message {} of {} is a duplicate", message.getId(), mapping.getSourceId());
                lastSeen = advance(lastSeen, message.getId());
                continue;
            }
            if (pipeline.deliver(mapping, message, MessageKind.MESSAGE, null)) {
                forwarded++;
                lastSeen = advance(lastSeen, message.getId());
                pause(runtime);
            } else {
                failed++;
                lastSeen = advance(lastSeen, message.getId());
            }
        }

        MappingConfig updated = mapping;
        if (lastSeen != null && !lastSeen.equals(previous)) {
            String cursorId = lastSeen;
            persist(mapping, () -> configRepository.saveStreamCursor(mapping.getMappingId(), cursorId));
            updated = mapping.withCursor(cursor.withLastSeenId(lastSeen));
        }
        if (forwarded > 0 || failed > 0) {
            log.info("Mapping {}: forwarded {} messages, {} failed", mapping.getMappingId(), forwarded, failed);
        }
        return new SyncOutcome(updated, forwarded, failed, interrupted);
    }

    private SyncOutcome syncPinned(MappingConfig mapping, RuntimeOptions runtime, BooleanSupplier abortRequested)
            throws InterruptedException {
        CursorState cursor = mapping.getCursor();
        List<SourceMessage> pinned;
        try {
            pinned = sourceFeed.fetchPinned(mapping.getSourceId());
        } catch (RuntimeException e) {
            log.error("Failed to fetch pinned messages of {}", mapping.getSourceId(), e);
            sleeper.sleep(fetchFailurePause);
            return SyncOutcome.unchanged(mapping);
        }

        Map<String, SourceMessage> byId = new LinkedHashMap<>();
        for (SourceMessage message : pinned) {
            byId.putIfAbsent(message.getId(), message);
        }
        Set<String> current = Set.copyOf(byId.keySet());
        Set<String> known = cursor.getKnownPinnedIds();

        if (!cursor.isPinnedSynced()) {
            log.info("Captured {} pinned messages of {} as baseline", current.size(), mapping.getSourceId());
            return new SyncOutcome(savePinned(mapping, current), 0, 0, false);
        }
        if (current.isEmpty()) {
            return known.isEmpty()
                    ? SyncOutcome.unchanged(mapping)
                    : new SyncOutcome(savePinned(mapping, Set.of()), 0, 0, false);
        }
        if (current.equals(known)) {
            return SyncOutcome.unchanged(mapping);
        }

        Instant cutoff = cutoff(mapping);
        long cutoffMarker = Snowflakes.fromInstant(cutoff);
        boolean deduplicate = mapping.deduplicate(runtime);
        Set<String> processed = new HashSet<>();
        int forwarded = 0;
        int failed = 0;
        boolean interrupted = false;
        List<SourceMessage> additions = byId.values().stream()
                .filter(message -> !known.contains(message.getId()))
                .sorted(Comparator.comparing(SourceMessage::getId, MessageIds.ORDER))
                .toList();
        for (SourceMessage message : additions) {
            if (abortRequested.getAsBoolean()) {
                interrupted = true;
                break;
            }
            if (isAtOrBefore(message, cutoffMarker, cutoff)) {
                processed.add(message.getId());
                continue;
            }
            Optional<String> rejection = pipeline.rejectionReason(message, mapping);
            if (rejection.isPresent()) {
                log.debug("Pinned message {} of {} skipped: {}", message.getId(), mapping.getSourceId(), rejection.get());
                processed.add(message.getId());
                continue;
            }
            sinkRate.acquire();
            if (abortRequested.getAsBoolean()) {
                interrupted = true;
                break;
            }
            if (pipeline.isDuplicate(message, deduplicate)) {
                processed.add(message.getId());
                continue;
            }
            if (pipeline.deliver(mapping, message, MessageKind.PINNED, null)) {
                processed.add(message.getId());
                forwarded++;
                pause(runtime);
            } else {
                failed++;
            }
        }

        Set<String> updatedKnown = interrupted ? merge(known, current, processed) : current;
        MappingConfig updated = updatedKnown.equals(known) ? mapping : savePinned(mapping, updatedKnown);
        if (forwarded > 0 || failed > 0) {
            log.info("Mapping {}: forwarded {} pinned messages, {} failed", mapping.getMappingId(), forwarded, failed);
        }
        return new SyncOutcome(updated, forwarded, failed, interrupted);
    }

    private SyncOutcome syncForum(MappingConfig mapping, RuntimeOptions runtime, BooleanSupplier abortRequested)
            throws InterruptedException {
        CursorState cursor = mapping.getCursor();
        List<ForumThread> threads;
        try {
            threads = sourceFeed.fetchThreads(mapping.getSourceId());
        } catch (RuntimeException e) {
            log.error("Failed to list forum threads of {}", mapping.getSourceId(), e);
            sleeper.sleep(fetchFailurePause);
            return SyncOutcome.unchanged(mapping);
        }

        Map<String, ForumThread> byId = new LinkedHashMap<>();
        for (ForumThread thread : threads) {
            byId.putIfAbsent(thread.id(), thread);
        }
        Set<String> current = Set.copyOf(byId.keySet());
        Set<String> known = cursor.getKnownThreadIds();

        if (!cursor.isForumSynced()) {
            log.info("Captured {} forum threads of {} as baseline", current.size(), mapping.getSourceId());
            return new SyncOutcome(saveForum(mapping, current), 0, 0, false);
        }
        if (current.isEmpty()) {
            return known.isEmpty()
                    ? SyncOutcome.unchanged(mapping)
                    : new SyncOutcome(saveForum(mapping, Set.of()), 0, 0, false);
        }
        if (current.equals(known)) {
            return SyncOutcome.unchanged(mapping);
        }

        boolean deduplicate = mapping.deduplicate(runtime);
        Set<String> processed = new HashSet<>();
        int forwarded = 0;
        int failed = 0;
        boolean interrupted = false;
        List<ForumThread> additions = byId.values().stream()
                .filter(thread -> !known.contains(thread.id()))
                .sorted(Comparator.comparing(ForumThread::id, MessageIds.ORDER))
                .toList();
        for (ForumThread thread : additions) {
            if (abortRequested.getAsBoolean()) {
                interrupted = true;
                break;
            }
            Optional<SourceMessage> starter;
            try {
                starter = sourceFeed.fetchSince(thread.id(), null, runtime.getFetchLimit()).stream()
                        .min(Comparator.comparing(SourceMessage::getId, MessageIds.ORDER));
            } catch (RuntimeException e) {
                log.error("Failed to fetch messages of forum thread {}", thread.id(), e);
                failed++;
                continue;
            }
            if (starter.isEmpty()) {
                processed.add(thread.id());
                continue;
            }
            SourceMessage message = starter.get();
            Optional<String> rejection = pipeline.rejectionReason(message, mapping);
            if (rejection.isPresent()) {
                log.debug("Forum thread {} of {} skipped: {}", thread.id(), mapping.getSourceId(), rejection.get());
                processed.add(thread.id());
                continue;
            }
            sinkRate.acquire();
            if (abortRequested.getAsBoolean()) {
                interrupted = true;
                break;
            }
            if (pipeline.isDuplicate(message, deduplicate)) {
                processed.add(thread.id());
                continue;
            }
            if (pipeline.deliver(mapping, message, MessageKind.FORUM_THREAD, thread.title())) {
                processed.add(thread.id());
                forwarded++;
                pause(runtime);
            } else {
                failed++;
            }
        }

        Set<String> updatedKnown = interrupted ? merge(known, current, processed) : current;
        MappingConfig updated = updatedKnown.equals(known) ? mapping : saveForum(mapping, updatedKnown);
        if (forwarded > 0 || failed > 0) {
            log.info("Mapping {}: forwarded {} forum threads, {} failed", mapping.getMappingId(), forwarded, failed);
        }
        return new SyncOutcome(updated, forwarded, failed, interrupted);
    }

    private MappingConfig savePinned(MappingConfig mapping, Set<String> knownIds) {
        Set<String> ids = Set.copyOf(knownIds);
        persist(mapping, () -> configRepository.savePinnedState(mapping.getMappingId(), ids, true));
        return mapping.withCursor(mapping.getCursor().withKnownPinnedIds(ids).withPinnedSynced(true));
    }

    private MappingConfig saveForum(MappingConfig mapping, Set<String> knownIds) {
        Set<String> ids = Set.copyOf(knownIds);
        persist(mapping, () -> configRepository.saveForumState(mapping.getMappingId(), ids, true));
        return mapping.withCursor(mapping.getCursor().withKnownThreadIds(ids).withForumSynced(true));
    }

    /**
     * Cursor writes that fail are logged; the in-memory snapshot still advances so the next pass
     * does not forward the same messages again.
     */
    private void persist(MappingConfig mapping, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.error("Failed to persist cursor of mapping {}", mapping.getMappingId(), e);
        }
    }

    private void pause(RuntimeOptions runtime) throws InterruptedException {
        if (!runtime.hasJitter()) {
            return;
        }
        long min = runtime.getMinDelay().toNanos();
        long max = runtime.getMaxDelay().toNanos();
        long delay = max > min ? min + (long) (random.nextDouble() * (max - min)) : min;
        sleeper.sleep(Duration.ofNanos(delay));
    }

    /**
     * Later of the mapping's creation time and the process start. Content at or before it is never forwarded.
     */
    private Instant cutoff(MappingConfig mapping) {
        Instant createdAt = mapping.getCreatedAt();
        return createdAt != null && createdAt.isAfter(processStart) ? createdAt : processStart;
    }

    private static boolean isAtOrBefore(SourceMessage message, long marker, Instant moment) {
        if (MessageIds.isAtOrBefore(message.getId(), marker)) {
            return true;
        }
        return message.getTimestamp().map(timestamp -> !timestamp.isAfter(moment)).orElse(false);
    }

    private static String advance(String lastSeen, String candidate) {
        return MessageIds.isNewer(candidate, lastSeen) ? candidate : lastSeen;
    }

    private static List<SourceMessage> inIdOrder(List<SourceMessage> messages) {
        Map<String, SourceMessage> unique = new LinkedHashMap<>();
        for (SourceMessage message : messages) {
            unique.putIfAbsent(message.getId(), message);
        }
        List<SourceMessage> ordered = new ArrayList<>(unique.values());
        ordered.sort(Comparator.comparing(SourceMessage::getId, MessageIds.ORDER));
        return ordered;
    }

    private static Set<String> merge(Set<String> known, Set<String> current, Set<String> processed) {
        Set<String> merged = new LinkedHashSet<>();
        for (String id : known) {
            if (current.contains(id)) {
                merged.add(id);
            }
        }
        merged.addAll(processed);
        return Set.copyOf(merged);
    }
}
