package com.fantasy.anomaly.repository;

import com.fantasy.anomaly.model.ActiveAlert;

import java.util.List;
import java.util.Optional;

/**
 * Active-anomaly table keyed by alert key ({@code subjectId:type:metric}).
 * All writes come from the alert lifecycle service.
 */
public interface ActiveAnomalyStore {

    Optional<ActiveAlert> findByKey(String alertKey);

    /**
     * Look up an alert by the id of its current anomaly.
     */
    Optional<ActiveAlert> findById(String anomalyId);

    List<ActiveAlert> findAll();

    void save(ActiveAlert alert);

    void delete(String alertKey);
}
