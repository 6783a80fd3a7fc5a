package com.streamfirst.feedrelay.application;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared versions and wake-up flags that let the monitor loop apply a configuration only after a
 * health pass has validated it.
 *
 * <p>The configuration version starts at 1 with a refresh already pending; the health version starts
 * at -1, so the first reload waits for the first health pass. Every change bumps the configuration
 * version, sets the refresh flag and wakes the health loop.
 */
public class VersionHandshake {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private long configVersion = 1;
    private long healthVersion = -1;
    private boolean refreshPending = true;
    private boolean healthWakeupPending;

    /**
     * Records a configuration change: bumps the version, requests a refresh and wakes the health loop.
     */
    public void signalRefresh() {
        lock.lock();
        try {
            configVersion++;
            refreshPending = true;
            healthWakeupPending = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests a reload without changing the configuration version, e.g. after health transitions.
     */
    public void requestRefresh() {
        lock.lock();
        try {
            refreshPending = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the refresh flag and returns the configuration version the reload must reach.
     */
    public long beginReload() {
        lock.lock();
        try {
            refreshPending = false;
            return configVersion;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the health version reaches {@code target}.
     *
     * @return true once health caught up, false if another refresh was requested meanwhile
     */
    public boolean awaitHealth(long target) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (healthVersion < target) {
                if (refreshPending) {
                    return false;
                }
                changed.await();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publishes the configuration version a completed health pass covered. Never moves backwards.
     */
    public void publishHealth(long version) {
        lock.lock();
        try {
            if (version > healthVersion) {
                healthVersion = version;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for a refresh request or the timeout, whichever comes first.
     *
     * @return true if a refresh is pending
     */
    public boolean awaitRefresh(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!refreshPending && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return refreshPending;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for a health wake-up or the timeout, then consumes the wake-up.
     *
     * @return true if woken by a configuration change
     */
    public boolean awaitHealthWakeup(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!healthWakeupPending && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            boolean woken = healthWakeupPending;
            healthWakeupPending = false;
            return woken;
        } finally {
            lock.unlock();
        }
    }

    public void clearHealthWakeup() {
        lock.lock();
        try {
            healthWakeupPending = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true if the configuration applied at {@code appliedVersion} has been superseded.
     */
    public boolean isStale(long appliedVersion) {
        lock.lock();
        try {
            return refreshPending || configVersion > appliedVersion;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRefreshPending() {
        lock.lock();
        try {
            return refreshPending;
        } finally {
            lock.unlock();
        }
    }

    public long configVersion() {
        lock.lock();
        try {
            return configVersion;
        } finally {
            lock.unlock();
        }
    }

    public long healthVersion() {
        lock.lock();
        try {
            return healthVersion;
        } finally {
            lock.unlock();
        }
    }
}
