package com.streamfirst.feedrelay.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Global tunables of the relay loops. Reloaded on every configuration version change.
 */
@Value
public class RuntimeOptions {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final double DEFAULT_RATE_PER_SECOND = 8.0;
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(180);
    public static final Duration MIN_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(10);
    public static final int DEFAULT_FETCH_LIMIT = 50;

    public static final RuntimeOptions DEFAULTS = RuntimeOptions.builder().build();

    Duration pollInterval;
    /** Lower bound of the random pause after each forwarded message */
    Duration minDelay;
    /** Upper bound of the random pause, never below {@code minDelay} */
    Duration maxDelay;
    /** Calls per second for each rate limiter, non-positive disables pacing */
    double ratePerSecond;
    Duration healthCheckInterval;
    /** Dedup default for mappings without their own setting */
    boolean deduplicate;
    /** Maximum number of messages fetched per stream pass */
    int fetchLimit;

    @Builder(toBuilder = true)
    private RuntimeOptions(
            Duration pollInterval,
            Duration minDelay,
            Duration maxDelay,
            Double ratePerSecond,
            Duration healthCheckInterval,
            boolean deduplicate,
            Integer fetchLimit) {
        this.pollInterval = positiveOr(pollInterval, DEFAULT_POLL_INTERVAL);
        Duration min = minDelay == null || minDelay.isNegative() ? Duration.ZERO : minDelay;
        Duration max = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
        this.minDelay = min;
        this.maxDelay = max.compareTo(min) < 0 ? min : max;
        this.ratePerSecond = ratePerSecond == null ? DEFAULT_RATE_PER_SECOND : ratePerSecond;
        this.healthCheckInterval = positiveOr(healthCheckInterval, DEFAULT_HEALTH_CHECK_INTERVAL);
        this.deduplicate = deduplicate;
        this.fetchLimit = fetchLimit == null || fetchLimit <= 0 ? DEFAULT_FETCH_LIMIT : fetchLimit;
    }

    /**
     * Health check interval with the floor applied, so a misconfigured value cannot hammer the source.
     */
    public Duration effectiveHealthCheckInterval() {
        return healthCheckInterval.compareTo(MIN_HEALTH_CHECK_INTERVAL) < 0
                ? MIN_HEALTH_CHECK_INTERVAL
                : healthCheckInterval;
    }

    public boolean hasJitter() {
        return !maxDelay.isZero();
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
