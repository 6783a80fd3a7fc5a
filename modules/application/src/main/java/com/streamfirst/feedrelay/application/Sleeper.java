package com.streamfirst.feedrelay.application;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Interruptible pause used by the relay loops. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
