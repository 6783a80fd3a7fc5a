package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.FeedException;
import com.streamfirst.feedrelay.domain.FilterDecision;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.MessageKind;
import com.streamfirst.feedrelay.domain.OutboundPayload;
import com.streamfirst.feedrelay.domain.SourceMessage;
import com.streamfirst.feedrelay.ports.FilterEngine;
import com.streamfirst.feedrelay.ports.MessageRenderer;
import com.streamfirst.feedrelay.ports.SinkFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Per-message steps shared by the sync engine and manual forwarding: admission (type and filter),
 * duplicate detection and delivery.
 */
@Slf4j
@RequiredArgsConstructor
public class ForwardingPipeline {

    static final String NOT_FORWARDABLE = "not_forwardable";

    private final FilterEngine filterEngine;
    private final MessageRenderer renderer;
    private final SinkFeed sinkFeed;
    private final MessageDeduplicator deduplicator;

    /**
     * Returns why the message must not be forwarded through the mapping, empty if it may be.
     */
    public Optional<String> rejectionReason(SourceMessage message, MappingConfig mapping) {
        if (!message.isForwardable()) {
            return Optional.of(NOT_FORWARDABLE);
        }
        FilterDecision decision = filterEngine.evaluate(message, mapping.getFilters());
        if (!decision.allowed()) {
            return Optional.of(decision.reason() == null ? "filtered" : decision.reason());
        }
        return Optional.empty();
    }

    /**
     * Checks and records the message signature when deduplication is enabled for the mapping.
     */
    public boolean isDuplicate(SourceMessage message, boolean deduplicate) {
        return deduplicate && deduplicator.isDuplicate(MessageSignatures.of(message));
    }

    /**
     * Renders and sends a message.
     *
     * @return true if the destination accepted it
     */
    public boolean deliver(MappingConfig mapping, SourceMessage message, MessageKind kind, String threadTitle) {
        OutboundPayload payload = renderer.render(message, mapping, kind, threadTitle);
        try {
            sinkFeed.send(mapping.getDestinationId(), payload, mapping.getDestinationThreadId());
            log.debug("Forwarded {} {} from {} to {}", kind, message.getId(), mapping.getSourceId(), mapping.getDestinationId());
            return true;
        } catch (FeedException e) {
            if (e.isRejected()) {
                log.warn("Destination {} rejected {} {}: {}",
                        mapping.getDestinationId(), kind, message.getId(), e.getMessage());
            } else {
                log.error("Failed to forward {} {} from {} to {}",
                        kind, message.getId(), mapping.getSourceId(), mapping.getDestinationId(), e);
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to forward {} {} from {} to {}",
                    kind, message.getId(), mapping.getSourceId(), mapping.getDestinationId(), e);
            return false;
        }
    }
}
