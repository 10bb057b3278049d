package com.fantasy.anomaly.provider;

import com.fantasy.anomaly.model.SubjectMetrics;

/**
 * Source of per-game metric series. Implementations may block on I/O.
 */
public interface MetricsProvider {

    /**
     * @param subjectId the monitored subject
     * @return time-ascending metric series for the subject
     * @throws ProviderFetchException if the data cannot be fetched
     */
    SubjectMetrics get(String subjectId);
}
