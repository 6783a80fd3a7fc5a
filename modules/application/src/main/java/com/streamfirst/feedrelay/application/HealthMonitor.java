package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.HealthRecord;
import com.streamfirst.feedrelay.domain.HealthStatus;
import com.streamfirst.feedrelay.domain.MappingConfig;
import com.streamfirst.feedrelay.domain.NetworkOptions;
import com.streamfirst.feedrelay.domain.Result;
import com.streamfirst.feedrelay.ports.AdminNotifier;
import com.streamfirst.feedrelay.ports.ConfigRepository;
import com.streamfirst.feedrelay.ports.SourceFeed;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one health pass: probes the proxy, the credential and every mapping's source channel,
 * persists the results and notifies administrators about problems and recoveries.
 */
@Slf4j
@RequiredArgsConstructor
public class HealthMonitor {

    static final String DEPENDENCY_DOWN = "check unavailable: proxy is not responding";
    static final String NO_CREDENTIAL = "check unavailable: no valid source credential";
    static final String CREDENTIAL_MISSING = "source credential is not configured";
    static final String SOURCE_UNAVAILABLE = "source channel unavailable or access denied";

    private final SourceFeed sourceFeed;
    private final ConfigRepository configRepository;
    private final AdminNotifier adminNotifier;
    private final HealthRegistry registry;
    private final BoundedRetry retry;

    /**
     * Probes every subject of the snapshot and records the results.
     *
     * @param state the configuration snapshot to check
     * @return what was recorded and which transitions were reported
     * @throws InterruptedException if cancelled between or during probes
     */
    public PassResult runPass(MonitorState state) throws InterruptedException {
        List<HealthRecord> updates = new ArrayList<>();
        NetworkOptions network = state.getNetwork();

        sourceFeed.setCredential(state.getCredential());
        sourceFeed.setNetworkOptions(network);

        boolean proxyConfigured = network.proxyConfigured();
        boolean proxyBlocked = false;
        if (proxyConfigured) {
            Result<Void> proxy = retry.call(() -> probe(() -> sourceFeed.checkProxy(network)), Result::isSuccess);
            proxyBlocked = proxy.isFailure();
            updates.add(new HealthRecord(
                    HealthRecord.PROXY,
                    proxy.isSuccess() ? HealthStatus.OK : HealthStatus.ERROR,
                    proxy.getErrorMessage().orElse(null),
                    "Source proxy"));
        } else {
            updates.add(new HealthRecord(HealthRecord.PROXY, HealthStatus.DISABLED, null, "Source proxy"));
        }

        String credential = state.getCredential() == null ? "" : state.getCredential().strip();
        boolean credentialOk = false;
        boolean credentialNormalized = false;
        if (proxyBlocked) {
            updates.add(new HealthRecord(HealthRecord.CREDENTIAL, HealthStatus.UNKNOWN, DEPENDENCY_DOWN, "Source credential"));
        } else if (credential.isEmpty()) {
            updates.add(new HealthRecord(HealthRecord.CREDENTIAL, HealthStatus.ERROR, CREDENTIAL_MISSING, "Source credential"));
        } else {
            String value = credential;
            Result<String> verified = retry.call(() -> probe(() -> sourceFeed.verifyCredential(value)), Result::isSuccess);
            credentialOk = verified.isSuccess();
            updates.add(new HealthRecord(
                    HealthRecord.CREDENTIAL,
                    credentialOk ? HealthStatus.OK : HealthStatus.ERROR,
                    verified.getErrorMessage().orElse(null),
                    "Source credential"));
            String normalized = verified.getData().map(String::strip).orElse("");
            if (credentialOk && !normalized.isEmpty() && !normalized.equals(credential)) {
                log.info("Source credential normalized, storing the corrected value");
                configRepository.saveCredential(normalized);
                sourceFeed.setCredential(normalized);
                credentialNormalized = true;
            }
        }

        RateLimiter checkRate = new RateLimiter(Math.max(1.0, state.getRuntime().getRatePerSecond()));
        Set<String> sourceIds = new LinkedHashSet<>();
        for (MappingConfig mapping : state.getMappings()) {
            sourceIds.add(mapping.getSourceId());
            updates.add(checkMapping(mapping, proxyBlocked, credentialOk, checkRate));
        }

        configRepository.pruneMappingHealth(sourceIds);
        for (HealthRecord update : updates) {
            configRepository.saveHealth(update);
        }
        registry.retainMappings(sourceIds.stream().map(HealthRecord::mappingSubject).collect(Collectors.toSet()));

        HealthRegistry.Transitions transitions = registry.record(updates);
        if (!transitions.problems().isEmpty()) {
            notifyAdmins(formatDigest(transitions.problems(), false));
        }
        if (!transitions.recoveries().isEmpty()) {
            notifyAdmins(formatDigest(transitions.recoveries(), true));
        }

        log.debug("Health pass finished: {} subjects, {} problems, {} recoveries",
                updates.size(), transitions.problems().size(), transitions.recoveries().size());
        return new PassResult(updates, transitions, credentialNormalized);
    }

    private HealthRecord checkMapping(
            MappingConfig mapping,
            boolean proxyBlocked,
            boolean credentialOk,
            RateLimiter checkRate) throws InterruptedException {
        String subject = mapping.healthSubject();
        String label = "Mapping " + mapping.displayLabel();
        if (!mapping.isActive()) {
            return new HealthRecord(subject, HealthStatus.DISABLED, null, label);
        }
        if (proxyBlocked) {
            return new HealthRecord(subject, HealthStatus.UNKNOWN, DEPENDENCY_DOWN, label);
        }
        if (!credentialOk) {
            return new HealthRecord(subject, HealthStatus.UNKNOWN, NO_CREDENTIAL, label);
        }
        boolean accessible = retry.call(() -> {
            checkRate.acquire();
            return checkAccessible(mapping.getSourceId());
        }, Boolean::booleanValue);
        return accessible
                ? new HealthRecord(subject, HealthStatus.OK, null, label)
                : new HealthRecord(subject, HealthStatus.ERROR, SOURCE_UNAVAILABLE, label);
    }

    private boolean checkAccessible(String sourceId) {
        try {
            return sourceFeed.checkAccessible(sourceId);
        } catch (RuntimeException e) {
            log.debug("Access check for {} failed: {}", sourceId, e.getMessage());
            return false;
        }
    }

    private void notifyAdmins(String message) {
        try {
            adminNotifier.notifyAdmins(message);
        } catch (RuntimeException e) {
            log.error("Failed to deliver health notice to administrators", e);
        }
    }

    static String formatDigest(List<HealthRecord> records, boolean recovered) {
        StringBuilder digest = new StringBuilder(recovered ? "Components recovered:" : "Problems detected:");
        digest.append("\n");
        for (HealthRecord record : records) {
            digest.append("\n• ").append(record.label());
            if (!recovered) {
                String message = record.message() == null || record.message().isBlank()
                        ? "no details"
                        : record.message();
                digest.append(" - ").append(message);
            }
        }
        return digest.toString();
    }

    private static <T> Result<T> probe(ProbeCall<T> call) {
        try {
            return call.invoke();
        } catch (RuntimeException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return Result.failure(reason);
        }
    }

    @FunctionalInterface
    private interface ProbeCall<T> {
        Result<T> invoke();
    }

    /**
     * Outcome of one health pass.
     */
    @Value
    public static class PassResult {
        List<HealthRecord> records;
        HealthRegistry.Transitions transitions;
        /** True if the stored credential was replaced by its normalized form */
        boolean credentialNormalized;

        public boolean hasTransitions() {
            return !transitions.isEmpty();
        }
    }
}
