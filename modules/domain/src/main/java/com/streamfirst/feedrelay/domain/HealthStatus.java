package com.streamfirst.feedrelay.domain;

import java.util.Locale;

/**
 * Health state of a monitored subject (proxy, credential or mapping).
 */
public enum HealthStatus {
    /** Last probe succeeded */
    OK,
    /** Last probe failed */
    ERROR,
    /** Not probed because a dependency is down, or never probed */
    UNKNOWN,
    /** Subject is switched off and is not probed */
    DISABLED;

    /**
     * Lowercase form used by configuration stores.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HealthStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (HealthStatus status : values()) {
            if (status.name().equalsIgnoreCase(raw.trim())) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
