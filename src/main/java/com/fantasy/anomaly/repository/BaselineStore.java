package com.fantasy.anomaly.repository;

import com.fantasy.anomaly.model.Baseline;

import java.util.Optional;

/**
 * Keyed storage for per-subject baselines. Implementations must be safe for
 * concurrent readers and writers.
 */
public interface BaselineStore {

    Optional<Baseline> find(String subjectId);

    void save(Baseline baseline);

    /**
     * @return true if a baseline was removed
     */
    boolean delete(String subjectId);

    int size();
}
