package com.streamfirst.feedrelay.ports;

/**
 * Observer invoked by the administration component after it mutates the configuration.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Signals that mappings, runtime options, network options or the credential changed.
     * Must be cheap and non-blocking.
     */
    void onConfigChanged();
}
