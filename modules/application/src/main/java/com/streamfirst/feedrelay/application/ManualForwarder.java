package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.ManualForwardActivity;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.MessageIds;
import com.streamfirst.feedrelay.domain.MessageKind;
import com.streamfirst.feedrelay.domain.RuntimeOptions;
import com.streamfirst.feedrelay.domain.SourceMessage;
import com.streamfirst.feedrelay.ports.ConfigChangeListener;
import com.streamfirst.feedrelay.ports.ConfigRepository;
import com.streamfirst.feedrelay.ports.SourceFeed;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Administrator action that forwards the most recent messages of one or all mappings on demand.
 *
 * <p>Runs under the same per-source lock as the monitor loop, shares its deduplication cache, paces
 * sends with its own limiter and only ever moves cursors forward. The outcome is recorded as a
 * {@link ManualForwardActivity}; cursor changes are announced through the change listener.
 */
@Slf4j
@Builder
public class ManualForwarder {

    public static final int DEFAULT_MAX_LIMIT = 100;
    static final double MIN_RATE = 0.1;

    @NonNull private final SourceFeed sourceFeed;
    @NonNull private final ConfigRepository configRepository;
    @NonNull private final ForwardingPipeline pipeline;
    @NonNull private final ChannelGuard guard;
    @NonNull private final ConfigChangeListener changeListener;

    @Builder.Default private final Clock clock = Clock.systemUTC();
    @Builder.Default private final int maxLimit = DEFAULT_MAX_LIMIT;

    /**
     * Forwards up to {@code requested} recent messages per selected mapping.
     *
     * @param requested how many messages to forward, capped at the maximum limit
     * @param sourceId source of a single mapping, or null, {@code all} or {@code *} for every mapping
     * @return the recorded activity
     * @throws IllegalArgumentException if the count is not positive or the source is unknown
     * @throws IllegalStateException if no credential or no mapping is configured
     * @throws InterruptedException if cancelled while waiting for a lock or the limiter
     */
    public ManualForwardActivity forwardRecent(int requested, String sourceId) throws InterruptedException {
        if (requested <= 0) {
            throw new IllegalArgumentException("Message count must be positive");
        }
        String credential = configRepository.loadCredential()
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new IllegalStateException("Source credential is not configured"));
        sourceFeed.setCredential(credential);
        sourceFeed.setNetworkOptions(configRepository.loadNetworkOptions());

        List<MappingConfig> selected = select(configRepository.loadMappings(), sourceId);
        RuntimeOptions runtime = configRepository.loadRuntimeOptions();
        int limit = Math.min(requested, maxLimit);
        RateLimiter limiter = new RateLimiter(Math.max(runtime.getRatePerSecond(), MIN_RATE));
        Instant invokedAt = clock.instant();

        log.info("Manual forward of up to {} messages from {} mappings", limit, selected.size());
        List<ManualForwardActivity.Entry> entries = new ArrayList<>();
        boolean stateChanged = false;
        int total = 0;
        for (MappingConfig mapping : selected) {
            MappingRun run;
            try (ChannelGuard.Permit ignored = guard.lock(mapping.getSourceId())) {
                run = forwardMapping(withStoredCursor(mapping), runtime, limit, limiter, invokedAt);
            }
            entries.add(run.entry());
            total += run.entry().forwarded();
            stateChanged |= run.stateChanged();
        }

        ManualForwardActivity activity = new ManualForwardActivity(invokedAt, requested, limit, total, entries);
        if (!entries.isEmpty()) {
            configRepository.recordManualForward(activity);
        }
        if (stateChanged) {
            changeListener.onConfigChanged();
        }
        log.info("Manual forward finished: {} messages forwarded", total);
        return activity;
    }

    private MappingConfig withStoredCursor(MappingConfig mapping) {
        return configRepository.loadCursor(mapping.getMappingId())
                .map(cursor -> mapping.withCursor(mapping.getCursor().reconcile(cursor)))
                .orElse(mapping);
    }

    private List<MappingConfig> select(List<MappingConfig> mappings, String sourceId) {
        if (mappings.isEmpty()) {
            throw new IllegalStateException("No mappings are configured");
        }
        if (sourceId == null || sourceId.isBlank() || "all".equalsIgnoreCase(sourceId) || "*".equals(sourceId)) {
            return mappings;
        }
        List<MappingConfig> matching = mappings.stream()
                .filter(mapping -> mapping.getSourceId().equals(sourceId.strip()))
                .toList();
        if (matching.isEmpty()) {
            throw new IllegalArgumentException("Unknown source " + sourceId);
        }
        return matching;
    }

    private MappingRun forwardMapping(
            MappingConfig mapping,
            RuntimeOptions runtime,
            int limit,
            RateLimiter limiter,
            Instant invokedAt) throws InterruptedException {
        if (!mapping.isActive()) {
            return MappingRun.skipped(mapping, "mapping disabled, skipped");
        }
        if (mapping.isBlockedByHealth()) {
            return MappingRun.skipped(mapping, "source unavailable per health check, skipped");
        }
        return switch (mapping.getMode()) {
            case STREAM -> forwardStream(mapping, runtime, limit, limiter, invokedAt);
            case PINNED -> forwardPinned(mapping, runtime, limit, limiter);
            case FORUM -> MappingRun.skipped(mapping, "forum threads are forwarded automatically, skipped");
        };
    }

    private MappingRun forwardStream(
            MappingConfig mapping,
            RuntimeOptions runtime,
            int limit,
            RateLimiter limiter,
            Instant invokedAt) throws InterruptedException {
        int fetchLimit = Math.min(maxLimit, Math.max(limit + 5, 2 * limit));
        List<SourceMessage> messages;
        try {
            messages = sourceFeed.fetchSince(mapping.getSourceId(), null, fetchLimit);
        } catch (RuntimeException e) {
            log.error("Failed to fetch messages of {} for manual forward", mapping.getSourceId(), e);
            return MappingRun.skipped(mapping, "failed to fetch messages");
        }
        if (messages.isEmpty()) {
            return MappingRun.skipped(mapping, "no messages found");
        }
        List<SourceMessage> eligible = recent(messages, invokedAt);
        if (eligible.isEmpty()) {
            return MappingRun.skipped(mapping, "no matching messages");
        }
        List<SourceMessage> subset = eligible.subList(Math.max(0, eligible.size() - limit), eligible.size());

        boolean deduplicate = mapping.deduplicate(runtime);
        String previous = mapping.getCursor().getLastSeenId();
        String lastSeen = previous;
        int forwarded = 0;
        for (SourceMessage message : subset) {
            if (MessageIds.isNewer(message.getId(), lastSeen)) {
                lastSeen = message.getId();
            }
            if (pipeline.rejectionReason(message, mapping).isPresent() || pipeline.isDuplicate(message, deduplicate)) {
                continue;
            }
            limiter.acquire();
            if (pipeline.deliver(mapping, message, MessageKind.MESSAGE, null)) {
                forwarded++;
            }
        }

        boolean changed = lastSeen != null && !lastSeen.equals(previous);
        if (changed) {
            configRepository.saveStreamCursor(mapping.getMappingId(), lastSeen);
        }
        StringBuilder note = new StringBuilder(forwarded > 0
                ? "forwarded " + forwarded + " of " + subset.size() + " messages"
                : "no matching messages");
        int remaining = eligible.size() - subset.size();
        if (remaining > 0) {
            note.append(", ").append(remaining).append(" more available");
        }
        return new MappingRun(entry(mapping, forwarded, note.toString()), changed);
    }

    private MappingRun forwardPinned(
            MappingConfig mapping,
            RuntimeOptions runtime,
            int limit,
            RateLimiter limiter) throws InterruptedException {
        List<SourceMessage> pinned;
        try {
            pinned = sourceFeed.fetchPinned(mapping.getSourceId());
        } catch (RuntimeException e) {
            log.error("Failed to fetch pinned messages of {} for manual forward", mapping.getSourceId(), e);
            return MappingRun.skipped(mapping, "failed to fetch pinned messages");
        }

        Set<String> known = mapping.getCursor().getKnownPinnedIds();
        Map<String, SourceMessage> byId = new LinkedHashMap<>();
        for (SourceMessage message : pinned) {
            byId.putIfAbsent(message.getId(), message);
        }
        Set<String> current = byId.keySet();

        if (current.isEmpty()) {
            boolean changed = !known.isEmpty();
            if (changed) {
                configRepository.savePinnedState(mapping.getMappingId(), Set.of(), true);
            }
            return new MappingRun(entry(mapping, 0, "no pinned messages"), changed);
        }
        if (!mapping.getCursor().isPinnedSynced()) {
            configRepository.savePinnedState(mapping.getMappingId(), Set.copyOf(current), true);
            return new MappingRun(entry(mapping, 0, "pinned messages synchronized, nothing new"), true);
        }

        List<SourceMessage> ordered = new ArrayList<>(byId.values());
        ordered.sort(Comparator.comparing(SourceMessage::getId, MessageIds.ORDER));
        List<SourceMessage> subset = ordered.subList(Math.max(0, ordered.size() - limit), ordered.size());

        boolean deduplicate = mapping.deduplicate(runtime);
        Set<String> handled = new HashSet<>();
        int forwarded = 0;
        for (SourceMessage message : subset) {
            if (known.contains(message.getId())) {
                continue;
            }
            if (pipeline.rejectionReason(message, mapping).isPresent() || pipeline.isDuplicate(message, deduplicate)) {
                handled.add(message.getId());
                continue;
            }
            limiter.acquire();
            if (pipeline.deliver(mapping, message, MessageKind.PINNED, null)) {
                handled.add(message.getId());
                forwarded++;
            }
        }

        Set<String> updatedKnown = new LinkedHashSet<>();
        for (String id : known) {
            if (current.contains(id)) {
                updatedKnown.add(id);
            }
        }
        updatedKnown.addAll(handled);
        boolean changed = !updatedKnown.equals(known);
        if (changed) {
            configRepository.savePinnedState(mapping.getMappingId(), Set.copyOf(updatedKnown), true);
        }
        String note = forwarded > 0
                ? "forwarded " + forwarded + " pinned of " + subset.size() + " messages"
                : "no matching pinned messages";
        return new MappingRun(entry(mapping, forwarded, note), changed);
    }

    /**
     * Unique messages not newer than the invocation, oldest first.
     */
    static List<SourceMessage> recent(List<SourceMessage> messages, Instant invokedAt) {
        Map<String, SourceMessage> unique = new LinkedHashMap<>();
        for (SourceMessage message : messages) {
            if (message.getTimestamp().map(timestamp -> timestamp.isAfter(invokedAt)).orElse(false)) {
                continue;
            }
            unique.putIfAbsent(message.getId(), message);
        }
        List<SourceMessage> ordered = new ArrayList<>(unique.values());
        ordered.sort(Comparator
                .comparing((SourceMessage message) -> message.getTimestamp().orElse(Instant.EPOCH))
                .thenComparing(SourceMessage::getId, MessageIds.ORDER));
        return ordered;
    }

    private static ManualForwardActivity.Entry entry(MappingConfig mapping, int forwarded, String note) {
        return new ManualForwardActivity.Entry(
                mapping.getSourceId(), mapping.displayLabel(), forwarded, mapping.getMode(), note);
    }

    private record MappingRun(ManualForwardActivity.Entry entry, boolean stateChanged) {

        static MappingRun skipped(MappingConfig mapping, String note) {
            return new MappingRun(
                    new ManualForwardActivity.Entry(mapping.getSourceId(), mapping.displayLabel(), 0, mapping.getMode(), note),
                    false);
        }
    }
}
