package com.streamfirst.feedrelay.ports;

import com.streamfirst.feedrelay.domain.FilterDecision;
import com.streamfirst.feedrelay.domain.FilterProfile;
import com.streamfirst.feedrelay.domain.SourceMessage;

/**
 * Decides whether a message passes a mapping's filter profile.
 */
public interface FilterEngine {

    FilterDecision evaluate(SourceMessage message, FilterProfile profile);
}
