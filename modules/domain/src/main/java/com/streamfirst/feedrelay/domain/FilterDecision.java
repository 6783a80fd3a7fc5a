package com.streamfirst.feedrelay.domain;

/**
 * Outcome of evaluating a mapping's filter profile against a message.
 *
 * @param allowed whether the message may be forwarded
 * @param reason machine readable rule that denied the message, null when allowed
 */
public record FilterDecision(boolean allowed, String reason) {
    private static final FilterDecision ALLOW = new FilterDecision(true, null);

    public static FilterDecision allow() {
        return ALLOW;
    }

    public static FilterDecision deny(String reason) {
        return new FilterDecision(false, reason);
    }
}
