package com.streamfirst.feedrelay.domain;

/**
 * Failure reported by a source or sink feed client.
 * Transient failures (network, timeouts) and upstream rejections are both recoverable;
 * rejections are additionally a health signal for the subject that caused them.
 */
public class FeedException extends RuntimeException {

    private final boolean rejected;

    public FeedException(String message) {
        this(message, false, null);
    }

    public FeedException(String message, Throwable cause) {
        this(message, false, cause);
    }

    private FeedException(String message, boolean rejected, Throwable cause) {
        super(message, cause);
        this.rejected = rejected;
    }

    /**
     * Creates an exception for a request the upstream API refused (4xx class).
     */
    public static FeedException rejected(String message) {
        return new FeedException(message, true, null);
    }

    public boolean isRejected() {
        return rejected;
    }
}
