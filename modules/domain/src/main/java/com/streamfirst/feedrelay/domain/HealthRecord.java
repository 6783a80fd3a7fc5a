package com.streamfirst.feedrelay.domain;

import java.util.Objects;

/**
 * Result of checking one subject during a health pass.
 *
 * @param subject the subject key, e.g. {@code proxy}, {@code token} or {@code mapping:<sourceId>}
 * @param status the observed status
 * @param message optional explanation, null when there is nothing to say
 * @param label human readable name used in admin digests
 */
public record HealthRecord(String subject, HealthStatus status, String message, String label) {
    public static final String PROXY = "proxy";
    public static final String CREDENTIAL = "token";
    public static final String MAPPING_PREFIX = "mapping:";

    public HealthRecord {
        Objects.requireNonNull(subject, "Health subject cannot be null");
        Objects.requireNonNull(status, "Health status cannot be null");
        label = label == null || label.isBlank() ? subject : label;
    }

    public static String mappingSubject(String sourceId) {
        return MAPPING_PREFIX + sourceId;
    }

    public static boolean isMappingSubject(String subject) {
        return subject != null && subject.startsWith(MAPPING_PREFIX);
    }

    public boolean isOk() {
        return status == HealthStatus.OK;
    }
}
