package com.streamfirst.feedrelay.application;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Process-level tunables of the relay loops. Unlike {@link com.streamfirst.feedrelay.domain.RuntimeOptions}
 * these are fixed at startup.
 */
@Value
@Builder(toBuilder = true)
public class RelaySettings {

    public static final RelaySettings DEFAULTS = RelaySettings.builder().build();

    @Builder.Default Duration supervisorRetryDelay = Supervisor.DEFAULT_RETRY_DELAY;

    /** Pause of the monitor loop while no usable credential is configured */
    @Builder.Default Duration credentialWait = Duration.ofSeconds(3);

    /** Pause after a mapping failed, before the next mapping is processed */
    @Builder.Default Duration mappingFailurePause = Duration.ofSeconds(1);

    /** Pause after a source fetch failed */
    @Builder.Default Duration fetchFailurePause = Duration.ofSeconds(1);

    @Builder.Default int dedupCapacity = MessageDeduplicator.DEFAULT_CAPACITY;

    @Builder.Default int healthRetryAttempts = BoundedRetry.DEFAULT_ATTEMPTS;

    @Builder.Default Duration healthRetryDelay = BoundedRetry.DEFAULT_DELAY;

    @Builder.Default int manualForwardMaxLimit = ManualForwarder.DEFAULT_MAX_LIMIT;

    /** How long {@link RelayCoordinator#stop()} waits for the loops to exit */
    @Builder.Default Duration shutdownTimeout = Duration.ofSeconds(5);
}
