package com.streamfirst.feedrelay.application;

import lombok.Getter;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Re-runs a probe a fixed number of times with a fixed pause until it succeeds.
 * The last result is returned whether or not it succeeded.
 */
@Getter
public class BoundedRetry {

    public static final int DEFAULT_ATTEMPTS = 3;
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);

    private final int attempts;
    private final Duration delay;
    private final Sleeper sleeper;

    public BoundedRetry(int attempts, Duration delay, Sleeper sleeper) {
        this.attempts = Math.max(1, attempts);
        this.delay = delay;
        this.sleeper = sleeper;
    }

    public static BoundedRetry defaults(Sleeper sleeper) {
        return new BoundedRetry(DEFAULT_ATTEMPTS, DEFAULT_DELAY, sleeper);
    }

    public <T> T call(Probe<T> probe, Predicate<? super T> succeeded) throws InterruptedException {
        T result = probe.attempt();
        for (int attempt = 1; attempt < attempts && !succeeded.test(result); attempt++) {
            sleeper.sleep(delay);
            result = probe.attempt();
        }
        return result;
    }

    /**
     * A single attempt of a health probe.
     */
    @FunctionalInterface
    public interface Probe<T> {
        T attempt() throws InterruptedException;
    }
}
