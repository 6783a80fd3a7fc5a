package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.HealthRecord;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.NetworkOptions;
import com.streamfirst.feedrelay.domain.RuntimeOptions;
import com.streamfirst.feedrelay.ports.ConfigRepository;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Immutable configuration snapshot the loops work from between reloads.
 */
@Value
@With
public class MonitorState {

    public static final MonitorState EMPTY =
            new MonitorState(List.of(), RuntimeOptions.DEFAULTS, NetworkOptions.NONE, null, false);

    @NonNull List<MappingConfig> mappings;
    @NonNull RuntimeOptions runtime;
    @NonNull NetworkOptions network;
    /** Source credential, null when none is configured */
    String credential;
    /** Whether the last health pass found the credential valid */
    boolean credentialOk;

    public MonitorState(
            List<MappingConfig> mappings,
            RuntimeOptions runtime,
            NetworkOptions network,
            String credential,
            boolean credentialOk) {
        this.mappings = List.copyOf(mappings);
        this.runtime = runtime;
        this.network = network;
        this.credential = credential;
        this.credentialOk = credentialOk;
    }

    public static MonitorState load(ConfigRepository repository) {
        String credential = repository.loadCredential()
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .orElse(null);
        boolean credentialOk = repository.loadHealth(HealthRecord.CREDENTIAL)
                .map(HealthRecord::isOk)
                .orElse(false);
        return new MonitorState(
                repository.loadMappings(),
                repository.loadRuntimeOptions(),
                repository.loadNetworkOptions(),
                credential,
                credentialOk);
    }

    /**
     * Returns true if the monitor loop may call the source with this snapshot's credential.
     */
    public boolean canForward() {
        return credential != null && credentialOk;
    }
}
