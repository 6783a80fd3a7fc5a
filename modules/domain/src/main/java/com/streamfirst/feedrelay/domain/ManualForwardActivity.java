package com.streamfirst.feedrelay.domain;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of an administrator-triggered "forward recent messages" action.
 *
 * @param timestamp when the action ran
 * @param requested how many messages the administrator asked for
 * @param limit the per-mapping limit actually applied
 * @param totalForwarded messages forwarded across all mappings
 * @param entries one outcome per mapping
 */
public record ManualForwardActivity(
        Instant timestamp,
        int requested,
        int limit,
        int totalForwarded,
        List<Entry> entries
) {
    public ManualForwardActivity {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Outcome for one mapping.
     *
     * @param sourceId the mapping's source channel
     * @param label display label
     * @param forwarded messages forwarded for this mapping
     * @param mode monitoring mode the mapping ran in
     * @param note short human readable outcome
     */
    public record Entry(String sourceId, String label, int forwarded, MonitoringMode mode, String note) {
    }
}
