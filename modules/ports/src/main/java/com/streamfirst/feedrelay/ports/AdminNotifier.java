package com.streamfirst.feedrelay.ports;

/**
 * Delivers operational notices (health digests) to the relay administrators.
 */
public interface AdminNotifier {

    /**
     * Sends a notice to every administrator.
     *
     * @param message plain text notice
     * @throws com.streamfirst.feedrelay.domain.FeedException if delivery fails
     */
    void notifyAdmins(String message);
}
