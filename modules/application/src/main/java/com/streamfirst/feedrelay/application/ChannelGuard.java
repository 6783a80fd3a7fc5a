package com.streamfirst.feedrelay.application;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-source mutual exclusion, so the monitor loop and a manual forward never work on the same
 * source channel at once. Locks for different keys are independent.
 */
public class ChannelGuard {

    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * Acquires the lock for a key, blocking until it is free.
     *
     * @return a permit that releases the lock when closed
     * @throws InterruptedException if interrupted while waiting; the lock is not held in that case
     */
    public Permit lock(String key) throws InterruptedException {
        Entry entry;
        synchronized (entries) {
            entry = entries.computeIfAbsent(key, k -> new Entry());
            entry.users++;
        }
        try {
            entry.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            release(entry);
            throw e;
        }
        return new Permit(this, entry);
    }

    public boolean isLocked(String key) {
        synchronized (entries) {
            Entry entry = entries.get(key);
            return entry != null && entry.lock.isLocked();
        }
    }

    /**
     * Drops the lock of a key nobody holds or waits for. Used when a mapping is removed.
     *
     * @return true if the key is no longer tracked
     */
    public boolean forget(String key) {
        synchronized (entries) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return true;
            }
            if (entry.users > 0) {
                return false;
            }
            entries.remove(key);
            return true;
        }
    }

    /**
     * Forgets every idle key outside the given set.
     *
     * @return how many keys were dropped
     */
    public int retainOnly(Set<String> keys) {
        synchronized (entries) {
            List<String> stale = entries.keySet().stream()
                    .filter(key -> !keys.contains(key))
                    .toList();
            int dropped = 0;
            for (String key : stale) {
                if (forget(key)) {
                    dropped++;
                }
            }
            return dropped;
        }
    }

    public int trackedKeys() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void release(Entry entry) {
        synchronized (entries) {
            entry.users--;
        }
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    /**
     * Held lock on one key. Closing twice is a no-op.
     */
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Permit implements AutoCloseable {

        private final ChannelGuard guard;
        private final Entry entry;
        private boolean released;

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            entry.lock.unlock();
            guard.release(entry);
        }
    }
}
