package com.streamfirst.feedrelay.ports;

import com.streamfirst.feedrelay.domain.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Port for the persistent settings store shared with the administration component.
 * Provides configuration snapshots and persistence for cursor state, health and audit entries.
 * Persistence failures surface as runtime exceptions.
 */
public interface ConfigRepository {

    /**
     * Loads every configured mapping with its cursor state and last mapping health status.
     * Filter profiles are already merged with the global default profile.
     */
    List<MappingConfig> loadMappings();

    RuntimeOptions loadRuntimeOptions();

    NetworkOptions loadNetworkOptions();

    /**
     * Gets the source feed credential, empty if none has been configured.
     */
    Optional<String> loadCredential();

    void saveCredential(String credential);

    /**
     * Gets every persisted health record keyed by subject.
     */
    Map<String, HealthRecord> loadHealthRecords();

    default Optional<HealthRecord> loadHealth(String subject) {
        return Optional.ofNullable(loadHealthRecords().get(subject));
    }

    void saveHealth(HealthRecord record);

    /**
     * Removes mapping health records whose source is no longer configured.
     *
     * @param sourceIds source ids of the mappings that remain configured
     */
    void pruneMappingHealth(Set<String> sourceIds);

    /**
     * Reads back the persisted cursor of a mapping, empty if the mapping no longer exists.
     */
    Optional<CursorState> loadCursor(String mappingId);

    void saveStreamCursor(String mappingId, String lastSeenId);

    void savePinnedState(String mappingId, Set<String> knownIds, boolean synced);

    void saveForumState(String mappingId, Set<String> knownThreadIds, boolean synced);

    void recordManualForward(ManualForwardActivity activity);
}
