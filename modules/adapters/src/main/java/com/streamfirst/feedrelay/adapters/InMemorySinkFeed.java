package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.FeedException;
import com.streamfirst.feedrelay.domain.OutboundPayload;
import com.streamfirst.feedrelay.ports.SinkFeed;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * In-memory implementation of SinkFeed that records every delivered payload.
 * Failures can be injected per payload for testing.
 */
@Slf4j
public class InMemorySinkFeed implements SinkFeed {

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private volatile Predicate<OutboundPayload> failWhen = payload -> false;
    private final AtomicInteger attempts = new AtomicInteger();

    @Override
    public void send(String destinationId, OutboundPayload payload, Long threadId) {
        attempts.incrementAndGet();
        if (failWhen.test(payload)) {
            log.debug("Rejecting delivery to {}", destinationId);
            throw FeedException.rejected("Delivery to " + destinationId + " refused");
        }
        deliveries.add(new Delivery(destinationId, payload, threadId));
        log.debug("Delivered message to {} (thread {})", destinationId, threadId);
    }

    /**
     * Makes deliveries of matching payloads fail with a rejected {@link FeedException}.
     */
    public void failWhen(Predicate<OutboundPayload> condition) {
        this.failWhen = condition == null ? payload -> false : condition;
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public List<String> texts() {
        return deliveries.stream().map(delivery -> delivery.payload().text()).toList();
    }

    /**
     * Number of send calls including failed ones.
     */
    public int attempts() {
        return attempts.get();
    }

    public void clear() {
        deliveries.clear();
        attempts.set(0);
    }

    /**
     * A payload accepted by the destination.
     */
    public record Delivery(String destinationId, OutboundPayload payload, Long threadId) {
    }
}
