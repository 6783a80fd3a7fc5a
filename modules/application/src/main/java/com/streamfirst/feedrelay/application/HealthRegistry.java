package com.streamfirst.feedrelay.application;

import com.streamfirst.feedrelay.domain.HealthRecord;
import com.streamfirst.feedrelay.domain.HealthStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Remembers the last observed status of every monitored subject and classifies status changes.
 * A change into {@link HealthStatus#ERROR} is a problem, a change from ERROR to OK is a recovery;
 * any other change is recorded without being reported.
 */
@Slf4j
public class HealthRegistry {

    private final Map<String, HealthStatus> previous = new HashMap<>();

    public HealthRegistry() {
    }

    public HealthRegistry(Map<String, HealthRecord> persisted) {
        persisted.forEach((subject, record) -> previous.put(subject, record.status()));
    }

    /**
     * Records a batch of results and returns the problems and recoveries among them.
     */
    public synchronized Transitions record(List<HealthRecord> updates) {
        List<HealthRecord> problems = new ArrayList<>();
        List<HealthRecord> recoveries = new ArrayList<>();
        for (HealthRecord update : updates) {
            HealthStatus before = previous.put(update.subject(), update.status());
            if (before == update.status()) {
                continue;
            }
            log.debug("Health of {} changed from {} to {}", update.subject(), before, update.status());
            if (update.status() == HealthStatus.ERROR) {
                log.warn("Health problem with {}: {}", update.subject(), update.message());
                problems.add(update);
            } else if (before == HealthStatus.ERROR && update.status() == HealthStatus.OK) {
                log.info("{} recovered", update.subject());
                recoveries.add(update);
            }
        }
        return new Transitions(problems, recoveries);
    }

    /**
     * Forgets mapping subjects that are no longer monitored. Other subjects are kept.
     */
    public synchronized void retainMappings(Set<String> mappingSubjects) {
        previous.keySet().removeIf(subject ->
                HealthRecord.isMappingSubject(subject) && !mappingSubjects.contains(subject));
    }

    public synchronized Optional<HealthStatus> statusOf(String subject) {
        return Optional.ofNullable(previous.get(subject));
    }

    public synchronized Map<String, HealthStatus> snapshot() {
        return Map.copyOf(previous);
    }

    /**
     * Problems and recoveries found in one health pass.
     */
    public record Transitions(List<HealthRecord> problems, List<HealthRecord> recoveries) {

        public Transitions {
            problems = List.copyOf(problems);
            recoveries = List.copyOf(recoveries);
        }

        public boolean isEmpty() {
            return problems.isEmpty() && recoveries.isEmpty();
        }
    }
}
