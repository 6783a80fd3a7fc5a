package com.streamfirst.feedrelay.ports;

import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.MessageKind;
import com.streamfirst.feedrelay.domain.OutboundPayload;
import com.streamfirst.feedrelay.domain.SourceMessage;

/**
 * Converts source messages into destination-native payloads. Implementations must be pure.
 */
public interface MessageRenderer {

    /**
     * Renders a message using the mapping's label and formatting profile.
     *
     * @param message the source message
     * @param mapping the mapping the message is forwarded through
     * @param kind why the message is forwarded
     * @param threadTitle title of the forum thread the message opens, null for other kinds
     * @return the payload to send
     */
    OutboundPayload render(SourceMessage message, MappingConfig mapping, MessageKind kind, String threadTitle);

    default OutboundPayload render(SourceMessage message, MappingConfig mapping, MessageKind kind) {
        return render(message, mapping, kind, null);
    }
}
