package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.*;
import com.streamfirst.feedrelay.ports.ConfigRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of ConfigRepository for testing and development.
 * Settings are kept as text, the way administrators enter them, and parsed on every load.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryConfigRepository implements ConfigRepository {

    public static final String CREDENTIAL = "source.credential";
    public static final String POLL_INTERVAL = "runtime.poll";
    public static final String DELAY_MIN = "runtime.delay_min";
    public static final String DELAY_MAX = "runtime.delay_max";
    public static final String RATE = "runtime.rate";
    public static final String HEALTH_INTERVAL = "runtime.health_interval";
    public static final String DEDUPLICATE = "runtime.deduplicate_messages";
    public static final String FETCH_LIMIT = "runtime.fetch_limit";
    public static final String PROXY_URL = "proxy.url";
    public static final String PROXY_LOGIN = "proxy.login";
    public static final String PROXY_PASSWORD = "proxy.password";
    public static final String USER_AGENT = "network.user_agent";

    private final Map<String, String> settings = new ConcurrentHashMap<>();
    private final Map<String, MappingConfig> mappings = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, HealthRecord> health = new ConcurrentHashMap<>();
    private final List<ManualForwardActivity> manualForwards = new CopyOnWriteArrayList<>();
    private volatile FilterProfile defaultFilters = FilterProfile.EMPTY;

    public void setSetting(String key, String value) {
        if (value == null) {
            settings.remove(key);
        } else {
            settings.put(key, value);
        }
    }

    public Optional<String> getSetting(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    /**
     * Sets the filter profile every mapping inherits in addition to its own.
     */
    public void setDefaultFilters(FilterProfile filters) {
        this.defaultFilters = filters == null ? FilterProfile.EMPTY : filters;
    }

    public void saveMapping(MappingConfig mapping) {
        log.debug("Saving mapping {}", mapping);
        mappings.put(mapping.getMappingId(), mapping);
    }

    public void removeMapping(String mappingId) {
        MappingConfig removed = mappings.remove(mappingId);
        log.debug("Removed mapping {}", removed);
    }

    /**
     * Gets the mapping as stored, without the default filters or health status applied.
     */
    public Optional<MappingConfig> findMapping(String mappingId) {
        return Optional.ofNullable(mappings.get(mappingId));
    }

    public List<ManualForwardActivity> manualForwardHistory() {
        return List.copyOf(manualForwards);
    }

    @Override
    public List<MappingConfig> loadMappings() {
        List<MappingConfig> stored;
        synchronized (mappings) {
            stored = new ArrayList<>(mappings.values());
        }
        FilterProfile defaults = defaultFilters;
        return stored.stream()
                .map(mapping -> mapping
                        .withFilters(defaults.merge(mapping.getFilters()))
                        .withHealthStatus(Optional.ofNullable(health.get(mapping.healthSubject()))
                                .map(HealthRecord::status)
                                .orElse(HealthStatus.UNKNOWN)))
                .toList();
    }

    @Override
    public RuntimeOptions loadRuntimeOptions() {
        String fetchLimit = settings.get(FETCH_LIMIT);
        return RuntimeOptions.builder()
                .pollInterval(SettingsParser.parseSeconds(settings.get(POLL_INTERVAL), RuntimeOptions.DEFAULT_POLL_INTERVAL))
                .minDelay(SettingsParser.parseDelay(settings.get(DELAY_MIN), Duration.ZERO))
                .maxDelay(SettingsParser.parseDelay(settings.get(DELAY_MAX), Duration.ZERO))
                .ratePerSecond(SettingsParser.parseDouble(settings.get(RATE), RuntimeOptions.DEFAULT_RATE_PER_SECOND))
                .healthCheckInterval(SettingsParser.parseSeconds(
                        settings.get(HEALTH_INTERVAL), RuntimeOptions.DEFAULT_HEALTH_CHECK_INTERVAL))
                .deduplicate(SettingsParser.parseBool(settings.get(DEDUPLICATE), false))
                .fetchLimit(fetchLimit == null ? null : (int) SettingsParser.parseDouble(fetchLimit, RuntimeOptions.DEFAULT_FETCH_LIMIT))
                .build();
    }

    @Override
    public NetworkOptions loadNetworkOptions() {
        return new NetworkOptions(
                settings.get(PROXY_URL),
                settings.get(PROXY_LOGIN),
                settings.get(PROXY_PASSWORD),
                settings.get(USER_AGENT));
    }

    @Override
    public Optional<String> loadCredential() {
        return Optional.ofNullable(settings.get(CREDENTIAL)).filter(value -> !value.isBlank());
    }

    @Override
    public void saveCredential(String credential) {
        log.debug("Saving source credential");
        setSetting(CREDENTIAL, credential);
    }

    @Override
    public Map<String, HealthRecord> loadHealthRecords() {
        return Map.copyOf(health);
    }

    @Override
    public void saveHealth(HealthRecord record) {
        health.put(record.subject(), record);
    }

    @Override
    public void pruneMappingHealth(Set<String> sourceIds) {
        health.keySet().removeIf(subject -> HealthRecord.isMappingSubject(subject)
                && !sourceIds.contains(subject.substring(HealthRecord.MAPPING_PREFIX.length())));
    }

    @Override
    public Optional<CursorState> loadCursor(String mappingId) {
        return findMapping(mappingId).map(MappingConfig::getCursor);
    }

    @Override
    public void saveStreamCursor(String mappingId, String lastSeenId) {
        updateCursor(mappingId, cursor -> cursor.withLastSeenId(lastSeenId));
    }

    @Override
    public void savePinnedState(String mappingId, Set<String> knownIds, boolean synced) {
        updateCursor(mappingId, cursor -> cursor.withKnownPinnedIds(Set.copyOf(knownIds)).withPinnedSynced(synced));
    }

    @Override
    public void saveForumState(String mappingId, Set<String> knownThreadIds, boolean synced) {
        updateCursor(mappingId, cursor -> cursor.withKnownThreadIds(Set.copyOf(knownThreadIds)).withForumSynced(synced));
    }

    @Override
    public void recordManualForward(ManualForwardActivity activity) {
        log.info("Recorded manual forward: {} messages across {} mappings",
                activity.totalForwarded(), activity.entries().size());
        manualForwards.add(activity);
    }

    private void updateCursor(String mappingId, UnaryOperator<CursorState> change) {
        MappingConfig updated = mappings.computeIfPresent(mappingId,
                (id, mapping) -> mapping.withCursor(change.apply(mapping.getCursor())));
        if (updated == null) {
            throw new IllegalArgumentException("Mapping not found: " + mappingId);
        }
        log.debug("Updated cursor of mapping {}: {}", mappingId, updated.getCursor());
    }
}
