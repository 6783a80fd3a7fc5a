package com.streamfirst.feedrelay.domain;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MappingConfigTest {

    private final MappingConfig mapping = MappingConfig.builder()
            .mappingId("m1")
            .sourceId("100")
            .destinationId("chat")
            .build();

    @Test
    void only_active_mappings_in_error_are_blocked() {
        assertThat(mapping.isBlockedByHealth()).isFalse();
        assertThat(mapping.withHealthStatus(HealthStatus.ERROR).isBlockedByHealth()).isTrue();
        assertThat(mapping.withHealthStatus(HealthStatus.ERROR).withActive(false).isBlockedByHealth()).isFalse();
    }

    @Test
    void dedup_override_wins_over_runtime_default() {
        RuntimeOptions dedupOn = RuntimeOptions.builder().deduplicate(true).build();

        assertThat(mapping.deduplicate(dedupOn)).isTrue();
        assertThat(mapping.withDeduplicateOverride(false).deduplicate(dedupOn)).isFalse();
        assertThat(mapping.withDeduplicateOverride(true).deduplicate(RuntimeOptions.DEFAULTS)).isTrue();
    }

    @Test
    void label_falls_back_to_source_id() {
        assertThat(mapping.displayLabel()).isEqualTo("100");
        assertThat(mapping.withLabel("News").displayLabel()).isEqualTo("News");
        assertThat(mapping.healthSubject()).isEqualTo("mapping:100");
    }

    @Test
    void filter_profiles_merge_by_union() {
        FilterProfile global = FilterProfile.builder().blacklist(Set.of("spam")).build();
        FilterProfile own = FilterProfile.builder().blacklist(Set.of("ads")).whitelist(Set.of("news")).build();

        FilterProfile merged = global.merge(own);

        assertThat(merged.getBlacklist()).containsExactlyInAnyOrder("spam", "ads");
        assertThat(merged.getWhitelist()).containsExactly("news");
    }
}
