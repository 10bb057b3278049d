package com.fantasy.anomaly.engine;

import com.fantasy.anomaly.model.Baseline;
import com.fantasy.anomaly.model.DetectionConfig;
import com.fantasy.anomaly.model.HealthData;
import com.fantasy.anomaly.model.MarketData;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.model.SubjectMetrics;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Everything the detectors need for one subject in one cycle. Any of the data
 * fields may be null when the provider failed or the data is insufficient;
 * detectors that depend on a missing field skip the subject.
 */
@Data
@Builder
public class DetectionContext {
    private Subject subject;

    // Metric series already restricted to the configured window
    private SubjectMetrics metrics;

    // Null while the subject has too little history for a baseline
    private Baseline baseline;

    private MarketData marketData;
    private HealthData healthData;

    private DetectionConfig config;

    // Timestamp stamped on every anomaly produced from this context
    private Instant detectedAt;

    public String getSubjectId() {
        return subject.getId();
    }
}
