package com.streamfirst.feedrelay.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One source to destination binding. Instances are immutable snapshots; the sync engine returns a
 * new snapshot whenever it advances the cursor.
 */
@Value
@With
@Builder(toBuilder = true)
public class MappingConfig {

    /** Storage key of the mapping */
    @NonNull String mappingId;

    /** Source channel identifier */
    @NonNull String sourceId;

    /** Destination chat identifier */
    @NonNull String destinationId;

    /** Optional topic/thread inside the destination chat */
    Long destinationThreadId;

    @Builder.Default String label = "";

    @Builder.Default boolean active = true;

    /** When the mapping was added, null if unknown */
    Instant createdAt;

    /** Mapping-level dedup setting, null to inherit the runtime default */
    Boolean deduplicateOverride;

    @Builder.Default @NonNull FilterProfile filters = FilterProfile.EMPTY;

    @Builder.Default @NonNull FormattingProfile formatting = FormattingProfile.DEFAULT;

    @Builder.Default @NonNull MonitoringMode mode = MonitoringMode.STREAM;

    /** Mapping health as of the last completed health pass */
    @Builder.Default @NonNull HealthStatus healthStatus = HealthStatus.UNKNOWN;

    @Builder.Default @NonNull CursorState cursor = CursorState.EMPTY;

    public String displayLabel() {
        return label == null || label.isBlank() ? sourceId : label;
    }

    /**
     * Active mappings whose last health check failed are skipped until they recover.
     */
    public boolean isBlockedByHealth() {
        return active && healthStatus == HealthStatus.ERROR;
    }

    public boolean deduplicate(RuntimeOptions runtime) {
        return deduplicateOverride != null ? deduplicateOverride : runtime.isDeduplicate();
    }

    public String healthSubject() {
        return HealthRecord.mappingSubject(sourceId);
    }

    @Override
    public String toString() {
        return "MappingConfig{" +
               "mappingId='" + mappingId + '\'' +
               ", sourceId='" + sourceId + '\'' +
               ", destinationId='" + destinationId + '\'' +
               ", mode=" + mode +
               ", active=" + active +
               '}';
    }
}
