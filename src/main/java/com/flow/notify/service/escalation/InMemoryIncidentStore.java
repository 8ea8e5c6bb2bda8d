package com.flow.notify.service.escalation;

import com.flow.notify.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * In-memory implementation of IncidentStore.
 * Thread-safe; the open index is updated with atomic map operations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryIncidentStore implements IncidentStore {

    private final MetricsConfig metricsConfig;

    private final Map<String, Incident> incidents = new ConcurrentHashMap<>();
    private final Map<OpenKey, Incident> open = new ConcurrentHashMap<>();
    private final Map<OpenKey, Incident> lastClosed = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerGauge(
                "notify.incidents.open",
                "Number of open incidents",
                this::openCount
        );
        metricsConfig.registerGauge(
                "notify.incidents.count",
                "Number of retained incidents",
                this::count
        );
    }

    @Override
    public Optional<Incident> findById(String incidentId) {
        return Optional.ofNullable(incidents.get(incidentId));
    }

    @Override
    public Optional<Incident> findOpen(String fingerprint, String policyId) {
        return Optional.ofNullable(open.get(new OpenKey(fingerprint, policyId)));
    }

    @Override
    public Incident openIfAbsent(String fingerprint, String policyId, Supplier<Incident> factory) {
        return open.computeIfAbsent(new OpenKey(fingerprint, policyId), key -> {
            Incident incident = factory.get();
            incidents.put(incident.getId(), incident);
            return incident;
        });
    }

    @Override
    public void markClosed(Incident incident) {
        OpenKey key = new OpenKey(incident.getFingerprint(), incident.getPolicyId());
        open.remove(key, incident);
        lastClosed.put(key, incident);
    }

    @Override
    public Optional<Incident> findLastClosed(String fingerprint, String policyId) {
        return Optional.ofNullable(lastClosed.get(new OpenKey(fingerprint, policyId)));
    }

    @Override
    public List<Incident> findOpenByFingerprint(String fingerprint) {
        return open.entrySet().stream()
                .filter(entry -> entry.getKey().fingerprint().equals(fingerprint))
                .map(Map.Entry::getValue)
                .toList();
    }

    @Override
    public Collection<Incident> findAll() {
        return List.copyOf(incidents.values());
    }

    @Override
    public int archiveIf(Predicate<Incident> filter) {
        int before = incidents.size();
        incidents.values().removeIf(filter);
        int removed = before - incidents.size();
        if (removed > 0) {
            log.info("Archived {} closed incidents", removed);
        }
        return removed;
    }

    @Override
    public int forgetClosedIf(Predicate<Incident> filter) {
        int before = lastClosed.size();
        lastClosed.values().removeIf(filter);
        return before - lastClosed.size();
    }

    @Override
    public int count() {
        return incidents.size();
    }

    @Override
    public int openCount() {
        return open.size();
    }

    private record OpenKey(String fingerprint, String policyId) {}
}
