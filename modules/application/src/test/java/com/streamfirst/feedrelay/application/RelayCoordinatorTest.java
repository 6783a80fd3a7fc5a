package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.adapters.InMemoryAdminNotifier;
import com.streamfirst.feedrelay.adapters.InMemoryConfigRepository;
import com.streamfirst.feedrelay.adapters.InMemorySinkFeed;
import com.streamfirst.feedrelay.adapters.InMemorySourceFeed;
import com.streamfirst.feedrelay.adapters.PlainTextRenderer;
import com.streamfirst.feedrelay.adapters.RuleBasedFilterEngine;
import com.streamfirst.feedrelay.domain.ForumThread;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.NetworkOptions;
import com.streamfirst.feedrelay.domain.Result;
import com.streamfirst.feedrelay.domain.SourceMessage;
import com.streamfirst.feedrelay.ports.SourceFeed;
import lombok.RequiredArgsConstructor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

import static com.streamfirst.feedrelay.application.TestMessages.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RelayCoordinatorTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemorySourceFeed sourceFeed;
    private InMemorySinkFeed sinkFeed;
    private InMemoryConfigRepository repository;
    private InMemoryAdminNotifier notifier;
    private RelayCoordinator coordinator;
    private final AtomicInteger handshakeViolations = new AtomicInteger();

    @BeforeEach
    void setUp() {
        sourceFeed = new InMemorySourceFeed();
        sinkFeed = new InMemorySinkFeed();
        repository = new InMemoryConfigRepository();
        notifier = new InMemoryAdminNotifier();
        repository.setSetting(InMemoryConfigRepository.CREDENTIAL, "tok");
        repository.setSetting(InMemoryConfigRepository.POLL_INTERVAL, "0.05");
        repository.setSetting(InMemoryConfigRepository.RATE, "1000");
        sourceFeed.acceptCredential("tok", "tok");
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.stop();
        }
    }

    private RelayCoordinator newCoordinator(SourceFeed feed) {
        RelaySettings settings = RelaySettings.builder()
                .supervisorRetryDelay(Duration.ofMillis(50))
                .credentialWait(Duration.ofMillis(50))
                .mappingFailurePause(Duration.ofMillis(10))
                .fetchFailurePause(Duration.ofMillis(10))
                .shutdownTimeout(Duration.ofSeconds(2))
                .build();
        ChannelGuard guard = new ChannelGuard();
        RateLimiter sinkRate = new RateLimiter(0);
        SyncEngine engine = SyncEngine.builder()
                .sourceFeed(feed)
                .configRepository(repository)
                .pipeline(new ForwardingPipeline(
                        new RuleBasedFilterEngine(), new PlainTextRenderer(), sinkFeed, new MessageDeduplicator()))
                .guard(guard)
                .sinkRate(sinkRate)
                .processStart(START)
                .fetchFailurePause(settings.getFetchFailurePause())
                .build();
        HealthMonitor healthMonitor = new HealthMonitor(
                feed, repository, notifier, new HealthRegistry(), new BoundedRetry(1, Duration.ZERO, Sleeper.SYSTEM));
        return RelayCoordinator.builder()
                .configRepository(repository)
                .sourceFeed(feed)
                .syncEngine(engine)
                .healthMonitor(healthMonitor)
                .sourceRate(new RateLimiter(0))
                .sinkRate(sinkRate)
                .settings(settings)
                .healthIntervalOverride(Duration.ofMillis(100))
                .build();
    }

    private void addMapping(String id, String sourceId) {
        repository.saveMapping(MappingConfig.builder()
                .mappingId(id)
                .sourceId(sourceId)
                .destinationId("chat-" + id)
                .label("Label " + id)
                .createdAt(START.minusSeconds(60))
                .build());
    }

    @Test
    void forwards_new_messages_once_health_covers_the_configuration() {
        addMapping("m1", "src");
        sourceFeed.addMessage("src", at(START.plusSeconds(5), "hello"));
        coordinator = newCoordinator(sourceFeed);

        coordinator.start();

        await().atMost(TIMEOUT).until(() -> sinkFeed.texts().size() == 1);
        assertThat(sinkFeed.texts().get(0)).contains("hello");
        assertThat(coordinator.appliedVersion()).isGreaterThanOrEqualTo(1);
        assertThat(coordinator.healthVersion()).isGreaterThanOrEqualTo(coordinator.appliedVersion());
        assertThat(coordinator.isRunning()).isTrue();
    }

    @Test
    void configuration_change_is_picked_up_while_running() {
        addMapping("m1", "src");
        coordinator = newCoordinator(sourceFeed);
        coordinator.start();
        await().atMost(TIMEOUT).until(() -> coordinator.appliedVersion() >= 1);
        long before = coordinator.configVersion();

        addMapping("m2", "other");
        sourceFeed.addMessage("other", at(START.plusSeconds(5), "from the new mapping"));
        coordinator.onConfigChanged();

        assertThat(coordinator.configVersion()).isEqualTo(before + 1);
        await().atMost(TIMEOUT).until(() -> coordinator.appliedVersion() >= before + 1
                && coordinator.currentMappings().size() == 2);
        await().atMost(TIMEOUT).until(() -> sinkFeed.texts().stream().anyMatch(text -> text.contains("from the new mapping")));
    }

    @Test
    void idles_without_a_credential_until_one_is_configured() throws InterruptedException {
        repository.setSetting(InMemoryConfigRepository.CREDENTIAL, null);
        addMapping("m1", "src");
        sourceFeed.addMessage("src", at(START.plusSeconds(5), "waiting"));
        coordinator = newCoordinator(sourceFeed);
        coordinator.start();

        await().atMost(TIMEOUT).until(() -> coordinator.appliedVersion() >= 1);
        Thread.sleep(200);
        assertThat(sinkFeed.deliveries()).isEmpty();
        assertThat(sourceFeed.callCount("fetchSince")).isZero();

        repository.setSetting(InMemoryConfigRepository.CREDENTIAL, "tok");
        coordinator.onConfigChanged();

        await().atMost(TIMEOUT).until(() -> sinkFeed.texts().size() == 1);
    }

    @Test
    void never_fetches_with_configuration_ahead_of_health() {
        addMapping("m1", "src");
        sourceFeed.addMessage("src", at(START.plusSeconds(5), "one"));
        HandshakeCheckingFeed checking = new HandshakeCheckingFeed(sourceFeed,
                () -> coordinator.healthVersion() - coordinator.appliedVersion());
        coordinator = newCoordinator(checking);
        coordinator.start();

        for (int i = 0; i < 5; i++) {
            long target = coordinator.configVersion() + 1;
            coordinator.onConfigChanged();
            await().atMost(TIMEOUT).until(() -> coordinator.appliedVersion() >= target);
        }

        await().atMost(TIMEOUT).until(() -> sourceFeed.callCount("fetchSince") > 0);
        assertThat(handshakeViolations).hasValue(0);
    }

    @Test
    void stop_terminates_the_loops() throws InterruptedException {
        addMapping("m1", "src");
        coordinator = newCoordinator(sourceFeed);
        coordinator.start();
        await().atMost(TIMEOUT).until(() -> coordinator.appliedVersion() >= 1);

        coordinator.stop();

        assertThat(coordinator.isRunning()).isFalse();
        assertThat(coordinator.getState()).isEqualTo(HandshakeState.IDLE);
        int calls = sourceFeed.callCount("fetchSince");
        sourceFeed.addMessage("src", at(START.plusSeconds(5), "after stop"));
        Thread.sleep(200);
        assertThat(sourceFeed.callCount("fetchSince")).isEqualTo(calls);
        assertThat(sinkFeed.deliveries()).isEmpty();
    }

    @Test
    void health_problem_blocks_the_mapping_after_reload() {
        addMapping("m1", "src");
        sourceFeed.setAccessible("src", false);
        sourceFeed.addMessage("src", at(START.plusSeconds(5), "hidden"));
        coordinator = newCoordinator(sourceFeed);
        coordinator.start();

        await().atMost(TIMEOUT).until(() -> !notifier.notices().isEmpty());
        assertThat(notifier.notices().get(0)).contains("Mapping Label m1");
        await().atMost(TIMEOUT).until(() -> coordinator.currentMappings().size() == 1
                && coordinator.currentMappings().get(0).isBlockedByHealth());
        assertThat(sinkFeed.deliveries()).isEmpty();

        sourceFeed.setAccessible("src", true);

        await().atMost(TIMEOUT).until(() -> sinkFeed.texts().size() == 1);
    }

    /**
     * Delegating feed that counts fetches made while the applied configuration is newer than the
     * published health version.
     */
    @RequiredArgsConstructor
    private class HandshakeCheckingFeed implements SourceFeed {

        private final SourceFeed delegate;
        private final LongSupplier healthLead;

        @Override
        public List<SourceMessage> fetchSince(String sourceId, String afterId, int limit) {
            if (healthLead.getAsLong() < 0) {
                handshakeViolations.incrementAndGet();
            }
            return delegate.fetchSince(sourceId, afterId, limit);
        }

        @Override
        public List<SourceMessage> fetchPinned(String sourceId) {
            return delegate.fetchPinned(sourceId);
        }

        @Override
        public List<ForumThread> fetchThreads(String sourceId) {
            return delegate.fetchThreads(sourceId);
        }

        @Override
        public boolean checkAccessible(String sourceId) {
            return delegate.checkAccessible(sourceId);
        }

        @Override
        public Result<String> verifyCredential(String credential) {
            return delegate.verifyCredential(credential);
        }

        @Override
        public Result<Void> checkProxy(NetworkOptions network) {
            return delegate.checkProxy(network);
        }

        @Override
        public void setCredential(String credential) {
            delegate.setCredential(credential);
        }

        @Override
        public void setNetworkOptions(NetworkOptions network) {
            delegate.setNetworkOptions(network);
        }
    }
}
