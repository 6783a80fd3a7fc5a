package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.HealthRecord;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.RuntimeOptions;
import com.streamfirst.feedrelay.ports.ConfigChangeListener;
import com.streamfirst.feedrelay.ports.ConfigRepository;
import com.streamfirst.feedrelay.ports.SourceFeed;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Owns the relay's background loops and the configuration/health version handshake between them.
 *
 * <p>The monitor loop applies a configuration version only after the health loop has completed a
 * pass covering that version, then runs the {@link SyncEngine} over every mapping. The health loop
 * runs on an interval and whenever the configuration changes. Both loops run under a
 * {@link Supervisor} on their own platform threads; {@link #stop()} interrupts them.
 */
@Slf4j
public class RelayCoordinator implements ConfigChangeListener {

    static final String MONITOR_LOOP = "monitor";
    static final String HEALTH_LOOP = "health";
    static final String ADMIN_LOOP = "admin";

    private final ConfigRepository configRepository;
    private final SourceFeed sourceFeed;
    private final SyncEngine syncEngine;
    private final HealthMonitor healthMonitor;
    private final RateLimiter sourceRate;
    private final RateLimiter sinkRate;
    private final Supervisor supervisor;
    private final Sleeper sleeper;
    private final RelaySettings settings;
    private final SupervisedLoop adminLoop;
    private final Duration healthIntervalOverride;

    private final VersionHandshake handshake = new VersionHandshake();

    private volatile HandshakeState state = HandshakeState.IDLE;
    private volatile long appliedVersion;
    private volatile MonitorState current = MonitorState.EMPTY;
    private ExecutorService executor;

    /**
     * @param sourceRate paces calls to the source between mappings
     * @param sinkRate the limiter the sync engine paces sends with; its rate follows the runtime options
     * @param adminLoop optional external loop (e.g. an admin bot) supervised alongside the relay loops
     * @param healthIntervalOverride fixed health interval, null to follow the runtime options
     */
    @Builder
    public RelayCoordinator(
            @NonNull ConfigRepository configRepository,
            @NonNull SourceFeed sourceFeed,
            @NonNull SyncEngine syncEngine,
            @NonNull HealthMonitor healthMonitor,
            @NonNull RateLimiter sourceRate,
            @NonNull RateLimiter sinkRate,
            Supervisor supervisor,
            Sleeper sleeper,
            RelaySettings settings,
            SupervisedLoop adminLoop,
            Duration healthIntervalOverride) {
        this.configRepository = configRepository;
        this.sourceFeed = sourceFeed;
        this.syncEngine = syncEngine;
        this.healthMonitor = healthMonitor;
        this.sourceRate = sourceRate;
        this.sinkRate = sinkRate;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.supervisor = supervisor == null ? new Supervisor(this.sleeper) : supervisor;
        this.settings = settings == null ? RelaySettings.DEFAULTS : settings;
        this.adminLoop = adminLoop;
        this.healthIntervalOverride = healthIntervalOverride;
    }

    /**
     * Starts the supervised loops. Calling it on a running coordinator has no effect.
     */
    public synchronized void start() {
        if (executor != null) {
            log.warn("Relay coordinator already running");
            return;
        }
        int loops = adminLoop == null ? 2 : 3;
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(loops, runnable -> {
            Thread thread = new Thread(runnable, "relay-loop-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        List<Callable<Void>> tasks = new ArrayList<>();
        tasks.add(supervised(MONITOR_LOOP, this::runMonitorLoop));
        tasks.add(supervised(HEALTH_LOOP, this::runHealthLoop));
        if (adminLoop != null) {
            tasks.add(supervised(ADMIN_LOOP, adminLoop));
        }
        for (Callable<Void> task : tasks) {
            executor.submit(task);
        }
        log.info("Relay coordinator started with {} loops", loops);
    }

    /**
     * Interrupts every loop and waits for them to exit.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Relay loops did not stop within {}", settings.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping relay loops");
        } finally {
            executor = null;
            state = HandshakeState.IDLE;
        }
        log.info("Relay coordinator stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    /**
     * Records a configuration change made by the administration component.
     */
    @Override
    public void onConfigChanged() {
        log.debug("Configuration change signalled");
        handshake.signalRefresh();
    }

    public HandshakeState getState() {
        return state;
    }

    public long configVersion() {
        return handshake.configVersion();
    }

    public long healthVersion() {
        return handshake.healthVersion();
    }

    /**
     * Configuration version the monitor loop is currently working with, 0 before the first reload.
     */
    public long appliedVersion() {
        return appliedVersion;
    }

    public List<MappingConfig> currentMappings() {
        return current.getMappings();
    }

    private Callable<Void> supervised(String name, SupervisedLoop loop) {
        return () -> {
            try {
                supervisor.supervise(name, loop, settings.getSupervisorRetryDelay());
            } catch (InterruptedException e) {
                log.debug("{} loop exited", name);
            } catch (Throwable e) {
                log.error("{} loop terminated", name, e);
                throw e;
            }
            return null;
        };
    }

    void runMonitorLoop() throws InterruptedException {
        MonitorState snapshot = reloadWhenHealthy();
        while (true) {
            if (handshake.isRefreshPending()) {
                snapshot = reloadWhenHealthy();
            }
            if (!snapshot.canForward()) {
                state = HandshakeState.IDLE;
                log.debug("No usable source credential, waiting");
                handshake.awaitRefresh(settings.getCredentialWait());
                continue;
            }
            snapshot = processMappings(snapshot);
            current = snapshot;
            state = HandshakeState.IDLE;
            handshake.awaitRefresh(snapshot.getRuntime().getPollInterval());
        }
    }

    private MonitorState processMappings(MonitorState snapshot) throws InterruptedException {
        state = HandshakeState.ACTIVE;
        long version = appliedVersion;
        RuntimeOptions runtime = snapshot.getRuntime();
        List<MappingConfig> mappings = new ArrayList<>(snapshot.getMappings());
        for (int i = 0; i < mappings.size(); i++) {
            if (handshake.isStale(version)) {
                log.debug("Configuration changed, stopping pass at mapping {}", i);
                break;
            }
            MappingConfig mapping = mappings.get(i);
            sourceRate.acquire();
            try {
                SyncOutcome outcome = syncEngine.process(mapping, runtime, handshake::isRefreshPending);
                mappings.set(i, outcome.getMapping());
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                log.error("Failed to process mapping {} ({})", mapping.getMappingId(), mapping.getSourceId(), e);
                sleeper.sleep(settings.getMappingFailurePause());
            }
        }
        return snapshot.withMappings(List.copyOf(mappings));
    }

    /**
     * Waits until a health pass covers the latest configuration version, then loads and applies it.
     */
    private MonitorState reloadWhenHealthy() throws InterruptedException {
        while (true) {
            state = HandshakeState.RELOAD_PENDING;
            long target = handshake.beginReload();
            state = HandshakeState.WAITING_FOR_HEALTH;
            log.debug("Waiting for health pass covering configuration v{}", target);
            if (!handshake.awaitHealth(target)) {
                continue;
            }
            MonitorState snapshot = MonitorState.load(configRepository);
            sourceFeed.setCredential(snapshot.getCredential());
            sourceFeed.setNetworkOptions(snapshot.getNetwork());
            sourceRate.setRate(snapshot.getRuntime().getRatePerSecond());
            sinkRate.setRate(snapshot.getRuntime().getRatePerSecond());
            syncEngine.retainSources(snapshot.getMappings().stream()
                    .map(MappingConfig::getSourceId)
                    .collect(Collectors.toSet()));
            appliedVersion = target;
            current = snapshot;
            log.info("Configuration v{} applied: {} mappings", target, snapshot.getMappings().size());
            return snapshot;
        }
    }

    void runHealthLoop() throws InterruptedException {
        Duration interval = healthIntervalOverride != null
                ? healthIntervalOverride
                : RuntimeOptions.DEFAULT_HEALTH_CHECK_INTERVAL;
        boolean first = true;
        while (true) {
            if (first) {
                first = false;
                handshake.clearHealthWakeup();
            } else {
                handshake.awaitHealthWakeup(interval);
            }

            long target = handshake.configVersion();
            MonitorState snapshot = MonitorState.load(configRepository);
            HealthMonitor.PassResult result = healthMonitor.runPass(snapshot);
            if (result.isCredentialNormalized()) {
                onConfigChanged();
            }
            if (result.hasTransitions() || credentialBecameUsable(result)) {
                handshake.requestRefresh();
            }
            handshake.publishHealth(target);
            log.debug("Health v{} published", target);

            if (healthIntervalOverride == null) {
                interval = snapshot.getRuntime().effectiveHealthCheckInterval();
            }
        }
    }

    /**
     * The monitor loop idles while its snapshot has no usable credential; a pass that finds the
     * credential valid must make it reload even when the change is not reported to admins.
     */
    private boolean credentialBecameUsable(HealthMonitor.PassResult result) {
        if (current.isCredentialOk()) {
            return false;
        }
        return result.getRecords().stream()
                .anyMatch(record -> HealthRecord.CREDENTIAL.equals(record.subject()) && record.isOk());
    }
}
