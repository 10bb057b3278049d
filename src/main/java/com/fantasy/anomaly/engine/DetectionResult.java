package com.fantasy.anomaly.engine;

import com.fantasy.anomaly.model.DetectedAnomaly;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of running the detectors for one subject. A failed detector leaves
 * {@code success=false} but keeps whatever the other detectors produced.
 */
@Data
public class DetectionResult {
    private boolean success = true;
    private Set<String> errorMessages = new LinkedHashSet<>();
    private List<DetectedAnomaly> anomalies = new ArrayList<>();

    public void fail(String message) {
        success = false;
        errorMessages.add(message);
    }

    public void merge(DetectionResult other) {
        success = success && other.success;
        errorMessages.addAll(other.errorMessages);
        anomalies.addAll(other.anomalies);
    }
}
