package com.fantasy.anomaly.repository;

import com.fantasy.anomaly.model.ActiveAlert;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps its own copies of alerts; callers only ever receive detached instances.
 */
@Repository
@ConditionalOnProperty(prefix = "anomaly.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryActiveAnomalyStore implements ActiveAnomalyStore {

    private final ConcurrentHashMap<String, ActiveAlert> alerts = new ConcurrentHashMap<>();

    @Override
    public Optional<ActiveAlert> findByKey(String alertKey) {
        return Optional.ofNullable(alerts.get(alertKey)).map(InMemoryActiveAnomalyStore::copy);
    }

    @Override
    public Optional<ActiveAlert> findById(String anomalyId) {
        return alerts.values().stream()
                .filter(alert -> anomalyId.equals(alert.getAnomaly().getId()))
                .findFirst()
                .map(InMemoryActiveAnomalyStore::copy);
    }

    @Override
    public List<ActiveAlert> findAll() {
        return alerts.values().stream()
                .map(InMemoryActiveAnomalyStore::copy)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void save(ActiveAlert alert) {
        alerts.put(alert.getAlertKey(), copy(alert));
    }

    @Override
    public void delete(String alertKey) {
        alerts.remove(alertKey);
    }

    private static ActiveAlert copy(ActiveAlert alert) {
        return alert.toBuilder().build();
    }
}
