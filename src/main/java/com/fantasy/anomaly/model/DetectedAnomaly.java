package com.fantasy.anomaly.model;

import lombok.Value;

/**
 * An anomaly paired with the detector that produced it, so the lifecycle manager can
 * re-run the same check during reconciliation.
 */
@Value
public class DetectedAnomaly {
    DetectorKind detector;
    Anomaly anomaly;

    public String alertKey() {
        return alertKey(detector, anomaly);
    }

    /**
     * One active entry per subject, anomaly type and detector. Metrics checked by the
     * same detector for the same type share the entry.
     */
    public static String alertKey(DetectorKind detector, Anomaly anomaly) {
        return anomaly.getSubjectId() + ":" + anomaly.getType().getValue() + ":" + detector.name();
    }
}
