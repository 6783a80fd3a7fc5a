package com.streamfirst.feedrelay.application;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Bounded recency set of message signatures, used to drop re-sent duplicates across all mappings.
 * Oldest signatures are evicted first once the capacity is exceeded.
 */
public class MessageDeduplicator {

    public static final int DEFAULT_CAPACITY = 512;

    private final int capacity;
    private final Deque<String> order = new ArrayDeque<>();
    private final Set<String> known = new HashSet<>();

    public MessageDeduplicator() {
        this(DEFAULT_CAPACITY);
    }

    public MessageDeduplicator(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    /**
     * Returns true if the signature was seen recently, recording it otherwise.
     * Null or blank signatures are never duplicates and are not recorded.
     */
    public synchronized boolean isDuplicate(String signature) {
        if (signature == null || signature.isBlank()) {
            return false;
        }
        if (known.contains(signature)) {
            return true;
        }
        known.add(signature);
        order.addLast(signature);
        if (order.size() > capacity) {
            known.remove(order.removeFirst());
        }
        return false;
    }

    public synchronized int size() {
        return order.size();
    }

    public int capacity() {
        return capacity;
    }
}
