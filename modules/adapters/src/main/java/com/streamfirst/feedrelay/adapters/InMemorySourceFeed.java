package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.*;
import com.streamfirst.feedrelay.ports.SourceFeed;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of SourceFeed for testing and development.
 * Channels, pinned messages and forum threads are seeded by the caller; probes answer from
 * configurable state and every call is counted.
 */
@Slf4j
public class InMemorySourceFeed implements SourceFeed {

    private final Map<String, List<SourceMessage>> messages = new ConcurrentHashMap<>();
    private final Map<String, List<SourceMessage>> pinned = new ConcurrentHashMap<>();
    private final Map<String, List<ForumThread>> threads = new ConcurrentHashMap<>();
    private final Set<String> inaccessible = ConcurrentHashMap.newKeySet();
    private final Set<String> failingSources = ConcurrentHashMap.newKeySet();
    private final Map<String, String> validCredentials = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    private volatile boolean proxyHealthy = true;
    private volatile String credential;
    private volatile NetworkOptions network = NetworkOptions.NONE;

    public void addMessage(String sourceId, SourceMessage message) {
        messages.computeIfAbsent(sourceId, k -> new CopyOnWriteArrayList<>()).add(message);
    }

    public void setPinned(String sourceId, List<SourceMessage> pinnedMessages) {
        pinned.put(sourceId, new CopyOnWriteArrayList<>(pinnedMessages));
    }

    public void setThreads(String sourceId, List<ForumThread> forumThreads) {
        threads.put(sourceId, new CopyOnWriteArrayList<>(forumThreads));
    }

    public void setAccessible(String sourceId, boolean accessible) {
        if (accessible) {
            inaccessible.remove(sourceId);
        } else {
            inaccessible.add(sourceId);
        }
    }

    /**
     * Makes every fetch from the source throw a {@link FeedException} until reset.
     */
    public void setFailing(String sourceId, boolean failing) {
        if (failing) {
            failingSources.add(sourceId);
        } else {
            failingSources.remove(sourceId);
        }
    }

    /**
     * Accepts a credential; verification reports {@code normalized} as the canonical form.
     */
    public void acceptCredential(String credential, String normalized) {
        validCredentials.put(credential, normalized);
    }

    public void setProxyHealthy(boolean healthy) {
        this.proxyHealthy = healthy;
    }

    public String currentCredential() {
        return credential;
    }

    public NetworkOptions currentNetwork() {
        return network;
    }

    public int callCount(String operation) {
        AtomicInteger counter = calls.get(operation);
        return counter == null ? 0 : counter.get();
    }

    @Override
    public List<SourceMessage> fetchSince(String sourceId, String afterId, int limit) {
        count("fetchSince");
        checkFailing(sourceId);
        List<SourceMessage> ordered = new ArrayList<>(messages.getOrDefault(sourceId, List.of()));
        ordered.sort(Comparator.comparing(SourceMessage::getId, MessageIds.ORDER));
        List<SourceMessage> page;
        if (afterId == null) {
            page = ordered.subList(Math.max(0, ordered.size() - limit), ordered.size());
        } else {
            page = ordered.stream()
                    .filter(message -> MessageIds.isNewer(message.getId(), afterId))
                    .limit(limit)
                    .toList();
        }
        // newest first, the way the remote API pages
        List<SourceMessage> result = new ArrayList<>(page);
        Collections.reverse(result);
        log.debug("Fetched {} messages from {} after {}", result.size(), sourceId, afterId);
        return result;
    }

    @Override
    public List<SourceMessage> fetchPinned(String sourceId) {
        count("fetchPinned");
        checkFailing(sourceId);
        return List.copyOf(pinned.getOrDefault(sourceId, List.of()));
    }

    @Override
    public List<ForumThread> fetchThreads(String sourceId) {
        count("fetchThreads");
        checkFailing(sourceId);
        return List.copyOf(threads.getOrDefault(sourceId, List.of()));
    }

    @Override
    public boolean checkAccessible(String sourceId) {
        count("checkAccessible");
        return !inaccessible.contains(sourceId);
    }

    @Override
    public Result<String> verifyCredential(String credential) {
        count("verifyCredential");
        String normalized = validCredentials.get(credential);
        if (normalized == null) {
            return Result.failure("credential rejected by source");
        }
        return Result.success(normalized);
    }

    @Override
    public Result<Void> checkProxy(NetworkOptions network) {
        count("checkProxy");
        return proxyHealthy ? Result.success() : Result.failure("proxy did not respond");
    }

    @Override
    public void setCredential(String credential) {
        this.credential = credential;
    }

    @Override
    public void setNetworkOptions(NetworkOptions network) {
        this.network = network == null ? NetworkOptions.NONE : network;
    }

    private void checkFailing(String sourceId) {
        if (failingSources.contains(sourceId)) {
            throw new FeedException("Source " + sourceId + " unavailable");
        }
    }

    private void count(String operation) {
        calls.computeIfAbsent(operation, k -> new AtomicInteger()).incrementAndGet();
    }
}
