package com.streamfirst.feedrelay.application;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Paces calls to at most a configured number per second.
 *
 * <p>Callers are served in arrival order: the caller holding the lock sleeps until the next permit
 * is due and moves the marker forward, while the others queue behind it. Changing the rate does not
 * reset the marker, so the new interval applies from the next {@link #acquire()}.
 */
public class RateLimiter {

    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile long intervalNanos;
    private long nextPermitNanos;
    private boolean primed;

    public RateLimiter(double ratePerSecond) {
        setRate(ratePerSecond);
    }

    /**
     * Sets the permitted calls per second. Zero or negative disables pacing.
     */
    public void setRate(double ratePerSecond) {
        this.intervalNanos = ratePerSecond <= 0 ? 0L : (long) (TimeUnit.SECONDS.toNanos(1) / ratePerSecond);
    }

    public double getRate() {
        long interval = intervalNanos;
        return interval <= 0 ? 0.0 : (double) TimeUnit.SECONDS.toNanos(1) / interval;
    }

    /**
     * Blocks until at least one interval has elapsed since the previous permit.
     *
     * @throws InterruptedException if the thread is interrupted while queued or waiting
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long interval = intervalNanos;
            if (interval <= 0) {
                return;
            }
            long now = System.nanoTime();
            if (primed && now - nextPermitNanos < 0) {
                TimeUnit.NANOSECONDS.sleep(nextPermitNanos - now);
            }
            nextPermitNanos = System.nanoTime() + interval;
            primed = true;
        } finally {
            lock.unlock();
        }
    }
}
