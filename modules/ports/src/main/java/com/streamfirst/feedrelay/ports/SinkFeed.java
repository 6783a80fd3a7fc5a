package com.streamfirst.feedrelay.ports;

import com.streamfirst.feedrelay.domain.OutboundPayload;

/**
 * Port for the destination messaging API the relay writes to.
 */
public interface SinkFeed {

    /**
     * Delivers a rendered payload.
     *
     * @param destinationId the destination chat
     * @param payload the rendered message
     * @param threadId optional topic inside the destination chat, null for the main chat
     * @throws com.streamfirst.feedrelay.domain.FeedException if the destination rejects or cannot be reached
     */
    void send(String destinationId, OutboundPayload payload, Long threadId);
}
