package com.streamfirst.feedrelay.boot;

import com.streamfirst.feedrelay.adapters.*;
import com.streamfirst.feedrelay.application.*;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.RuntimeOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;

/**
 * Wires the relay: in-memory adapters behind the ports, the application services and the
 * coordinator, which starts with the application and stops with the context.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAppConfiguration {

    // --- Adapter Beans (in-memory source, destination and settings store) ---

    @Bean
    public InMemoryConfigRepository configRepository(RelayProperties properties) {
        InMemoryConfigRepository repository = new InMemoryConfigRepository();
        properties.getSettings().forEach(repository::setSetting);
        if (properties.getCredential() != null) {
            repository.saveCredential(properties.getCredential());
        }
        Instant now = Instant.now();
        for (RelayProperties.Mapping mapping : properties.getMappings()) {
            String id = mapping.getId() != null ? mapping.getId() : mapping.getSourceId();
            repository.saveMapping(MappingConfig.builder()
                    .mappingId(id)
                    .sourceId(mapping.getSourceId())
                    .destinationId(mapping.getDestinationId())
                    .destinationThreadId(mapping.getDestinationThreadId())
                    .label(mapping.getLabel())
                    .mode(mapping.getMode())
                    .active(mapping.isActive())
                    .deduplicateOverride(mapping.getDeduplicate())
                    .createdAt(now)
                    .build());
        }
        log.info("Settings store seeded with {} mappings", properties.getMappings().size());
        return repository;
    }

    @Bean
    public InMemorySourceFeed sourceFeed(RelayProperties properties) {
        InMemorySourceFeed sourceFeed = new InMemorySourceFeed();
        if (properties.getCredential() != null) {
            String credential = properties.getCredential().strip();
            sourceFeed.acceptCredential(credential, credential);
        }
        return sourceFeed;
    }

    @Bean
    public InMemorySinkFeed sinkFeed() {
        return new InMemorySinkFeed();
    }

    @Bean
    public InMemoryAdminNotifier adminNotifier() {
        return new InMemoryAdminNotifier();
    }

    @Bean
    public RuleBasedFilterEngine filterEngine() {
        return new RuleBasedFilterEngine();
    }

    @Bean
    public PlainTextRenderer messageRenderer() {
        return new PlainTextRenderer();
    }

    // --- Application Service Beans ---

    @Bean
    public MessageDeduplicator messageDeduplicator(RelayProperties properties) {
        return new MessageDeduplicator(properties.getDedupCapacity());
    }

    @Bean
    public ChannelGuard channelGuard() {
        return new ChannelGuard();
    }

    @Bean
    public RateLimiter sourceRateLimiter() {
        return new RateLimiter(RuntimeOptions.DEFAULT_RATE_PER_SECOND);
    }

    @Bean
    public RateLimiter sinkRateLimiter() {
        return new RateLimiter(RuntimeOptions.DEFAULT_RATE_PER_SECOND);
    }

    @Bean
    public ForwardingPipeline forwardingPipeline(
            RuleBasedFilterEngine filterEngine,
            PlainTextRenderer messageRenderer,
            InMemorySinkFeed sinkFeed,
            MessageDeduplicator messageDeduplicator) {
        return new ForwardingPipeline(filterEngine, messageRenderer, sinkFeed, messageDeduplicator);
    }

    @Bean
    public SyncEngine syncEngine(
            InMemorySourceFeed sourceFeed,
            InMemoryConfigRepository configRepository,
            ForwardingPipeline forwardingPipeline,
            ChannelGuard channelGuard,
            @Qualifier("sinkRateLimiter") RateLimiter sinkRateLimiter,
            RelayProperties properties) {
        return SyncEngine.builder()
                .sourceFeed(sourceFeed)
                .configRepository(configRepository)
                .pipeline(forwardingPipeline)
                .guard(channelGuard)
                .sinkRate(sinkRateLimiter)
                .fetchFailurePause(properties.getFetchFailurePause())
                .build();
    }

    @Bean
    public HealthMonitor healthMonitor(
            InMemorySourceFeed sourceFeed,
            InMemoryConfigRepository configRepository,
            InMemoryAdminNotifier adminNotifier,
            RelayProperties properties) {
        return new HealthMonitor(
                sourceFeed,
                configRepository,
                adminNotifier,
                new HealthRegistry(configRepository.loadHealthRecords()),
                new BoundedRetry(properties.getHealthRetryAttempts(), properties.getHealthRetryDelay(), Sleeper.SYSTEM));
    }

    @Bean(destroyMethod = "stop")
    public RelayCoordinator relayCoordinator(
            InMemoryConfigRepository configRepository,
            InMemorySourceFeed sourceFeed,
            SyncEngine syncEngine,
            HealthMonitor healthMonitor,
            @Qualifier("sourceRateLimiter") RateLimiter sourceRateLimiter,
            @Qualifier("sinkRateLimiter") RateLimiter sinkRateLimiter,
            RelayProperties properties) {
        return RelayCoordinator.builder()
                .configRepository(configRepository)
                .sourceFeed(sourceFeed)
                .syncEngine(syncEngine)
                .healthMonitor(healthMonitor)
                .sourceRate(sourceRateLimiter)
                .sinkRate(sinkRateLimiter)
                .settings(properties.toSettings())
                .build();
    }

    @Bean
    public ManualForwarder manualForwarder(
            InMemorySourceFeed sourceFeed,
            InMemoryConfigRepository configRepository,
            ForwardingPipeline forwardingPipeline,
            ChannelGuard channelGuard,
            RelayCoordinator relayCoordinator,
            RelayProperties properties) {
        return ManualForwarder.builder()
                .sourceFeed(sourceFeed)
                .configRepository(configRepository)
                .pipeline(forwardingPipeline)
                .guard(channelGuard)
                .changeListener(relayCoordinator)
                .maxLimit(properties.getManualForwardMaxLimit())
                .build();
    }

    // --- Execution Logic ---

    @Bean
    public CommandLineRunner relayRunner(RelayCoordinator relayCoordinator, RelayProperties properties) {
        return args -> {
            if (!properties.isAutoStart()) {
                log.info("Relay auto start disabled");
                return;
            }
            relayCoordinator.start();
        };
    }
}
