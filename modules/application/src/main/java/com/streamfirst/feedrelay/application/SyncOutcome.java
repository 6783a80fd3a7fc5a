package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.MappingConfig;
import lombok.Value;

/**
 * Result of one sync pass over a mapping. {@code mapping} is the snapshot with its cursor advanced
 * and replaces the previous one for later passes.
 */
@Value
public class SyncOutcome {
    MappingConfig mapping;
    int forwarded;
    int failed;
    /** True if the pass stopped early because a configuration refresh was requested */
    boolean interrupted;

    public static SyncOutcome unchanged(MappingConfig mapping) {
        return new SyncOutcome(mapping, 0, 0, false);
    }
}
