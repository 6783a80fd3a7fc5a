package com.streamfirst.feedrelay.adapters;

import com.streamfirst.feedrelay.domain.FilterProfile;
import com.streamfirst.feedrelay.domain.HealthRecord;
import com.streamfirst.feedrelay.domain.HealthStatus;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.RuntimeOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryConfigRepositoryTest {

    private final InMemoryConfigRepository repository = new InMemoryConfigRepository();

    private static MappingConfig mapping(String id, String sourceId) {
        return MappingConfig.builder().mappingId(id).sourceId(sourceId).destinationId("chat").build();
    }

    @Test
    void runtime_options_are_parsed_from_settings() {
        repository.setSetting(InMemoryConfigRepository.POLL_INTERVAL, "0.5");
        repository.setSetting(InMemoryConfigRepository.DELAY_MIN, "250");
        repository.setSetting(InMemoryConfigRepository.DELAY_MAX, "1.5");
        repository.setSetting(InMemoryConfigRepository.RATE, "2.5");
        repository.setSetting(InMemoryConfigRepository.DEDUPLICATE, "yes");
        repository.setSetting(InMemoryConfigRepository.FETCH_LIMIT, "20");

        RuntimeOptions options = repository.loadRuntimeOptions();

        assertThat(options.getPollInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(options.getMinDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(options.getMaxDelay()).isEqualTo(Duration.ofMillis(1500));
        assertThat(options.getRatePerSecond()).isEqualTo(2.5);
        assertThat(options.isDeduplicate()).isTrue();
        assertThat(options.getFetchLimit()).isEqualTo(20);
    }

    @Test
    void missing_settings_fall_back_to_defaults() {
        RuntimeOptions options = repository.loadRuntimeOptions();

        assertThat(options.getPollInterval()).isEqualTo(RuntimeOptions.DEFAULT_POLL_INTERVAL);
        assertThat(options.getRatePerSecond()).isEqualTo(RuntimeOptions.DEFAULT_RATE_PER_SECOND);
        assertThat(options.getFetchLimit()).isEqualTo(RuntimeOptions.DEFAULT_FETCH_LIMIT);
        assertThat(repository.loadCredential()).isEmpty();
    }

    @Test
    void loaded_mappings_carry_default_filters_and_health() {
        repository.setDefaultFilters(FilterProfile.builder().blacklist(Set.of("ads")).build());
        repository.saveMapping(mapping("m1", "src").toBuilder()
                .filters(FilterProfile.builder().blacklist(Set.of("spam")).build())
                .build());
        repository.saveHealth(new HealthRecord(HealthRecord.mappingSubject("src"), HealthStatus.ERROR, "gone", "Mapping src"));

        MappingConfig loaded = repository.loadMappings().get(0);

        assertThat(loaded.getFilters().getBlacklist()).containsExactlyInAnyOrder("ads", "spam");
        assertThat(loaded.getHealthStatus()).isEqualTo(HealthStatus.ERROR);
        assertThat(repository.findMapping("m1").orElseThrow().getFilters().getBlacklist()).containsExactly("spam");
    }

    @Test
    void cursor_updates_require_a_known_mapping() {
        repository.saveMapping(mapping("m1", "src"));

        repository.saveStreamCursor("m1", "900");
        repository.savePinnedState("m1", Set.of("1"), true);

        assertThat(repository.findMapping("m1").orElseThrow().getCursor().getLastSeenId()).isEqualTo("900");
        assertThat(repository.findMapping("m1").orElseThrow().getCursor().getKnownPinnedIds()).containsExactly("1");
        assertThatThrownBy(() -> repository.saveStreamCursor("missing", "1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.loadCursor("m1")).hasValueSatisfying(
                cursor -> assertThat(cursor.getLastSeenId()).isEqualTo("900"));
        assertThat(repository.loadCursor("missing")).isEmpty();
    }

    @Test
    void pruning_keeps_global_records_and_current_mappings() {
        repository.saveHealth(new HealthRecord(HealthRecord.PROXY, HealthStatus.OK, null, "Source proxy"));
        repository.saveHealth(new HealthRecord(HealthRecord.mappingSubject("kept"), HealthStatus.OK, null, "Mapping kept"));
        repository.saveHealth(new HealthRecord(HealthRecord.mappingSubject("gone"), HealthStatus.OK, null, "Mapping gone"));

        repository.pruneMappingHealth(Set.of("kept"));

        assertThat(repository.loadHealthRecords().keySet())
                .containsExactlyInAnyOrder(HealthRecord.PROXY, HealthRecord.mappingSubject("kept"));
    }
}
