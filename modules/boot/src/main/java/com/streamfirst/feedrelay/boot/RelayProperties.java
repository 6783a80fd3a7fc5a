package com.streamfirst.feedrelay.boot;

import com.streamfirst.feedrelay.application.RelaySettings;
import com.streamfirst.feedrelay.domain.MonitoringMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relay configuration bound from {@code relay.*}.
 *
 * <p>Loop tunables are fixed for the life of the process. {@code settings}, {@code credential} and
 * {@code mappings} only seed the in-memory settings store; once running, administrators change them
 * through the store and signal the coordinator.
 */
@Data
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /** Start the relay loops when the application starts */
    private boolean autoStart = true;

    private Duration supervisorRetryDelay = Duration.ofSeconds(5);
    private Duration credentialWait = Duration.ofSeconds(3);
    private Duration mappingFailurePause = Duration.ofSeconds(1);
    private Duration fetchFailurePause = Duration.ofSeconds(1);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private int dedupCapacity = 512;
    private int healthRetryAttempts = 3;
    private Duration healthRetryDelay = Duration.ofSeconds(1);
    private int manualForwardMaxLimit = 100;

    /** Source credential to seed, accepted as-is by the in-memory source */
    private String credential;

    /** Textual runtime settings to seed, e.g. {@code runtime.rate: "4"} */
    private Map<String, String> settings = new LinkedHashMap<>();

    private List<Mapping> mappings = new ArrayList<>();

    public RelaySettings toSettings() {
        return RelaySettings.builder()
                .supervisorRetryDelay(supervisorRetryDelay)
                .credentialWait(credentialWait)
                .mappingFailurePause(mappingFailurePause)
                .fetchFailurePause(fetchFailurePause)
                .shutdownTimeout(shutdownTimeout)
                .dedupCapacity(dedupCapacity)
                .healthRetryAttempts(healthRetryAttempts)
                .healthRetryDelay(healthRetryDelay)
                .manualForwardMaxLimit(manualForwardMaxLimit)
                .build();
    }

    @Data
    public static class Mapping {
        private String id;
        private String sourceId;
        private String destinationId;
        private Long destinationThreadId;
        private String label = "";
        private MonitoringMode mode = MonitoringMode.STREAM;
        private boolean active = true;
        private Boolean deduplicate;
    }
}
